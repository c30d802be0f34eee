package org.Aayush.dungeon.heuristic;

import org.Aayush.dungeon.grid.GridCoordinate;

/**
 * Heuristic provider contract used by the corridor pathfinder.
 *
 * <p>Providers are immutable. Binding returns an immutable goal-bound estimator
 * reused for every node of one search.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal cell and returns a reusable estimator.
     *
     * @param goal goal cell, must be inside the grid the provider was built for.
     * @return immutable estimator bound to the goal.
     */
    GoalBoundHeuristic bindGoal(GridCoordinate goal);
}
