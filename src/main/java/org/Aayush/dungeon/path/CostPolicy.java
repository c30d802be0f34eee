package org.Aayush.dungeon.path;

/**
 * Per-edge movement rule injected into {@link CorridorPathfinder#findPath}.
 *
 * <p>Implementations must be pure: the verdict may depend only on the two arguments and on
 * state captured at construction (typically a grid snapshot and the search goal). Bounds and
 * trail legality are checked by the pathfinder before the policy is consulted.</p>
 */
@FunctionalInterface
public interface CostPolicy {

    PathCost evaluate(PathNode from, PathMove move);
}
