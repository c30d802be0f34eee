package org.Aayush.dungeon.path;

import org.Aayush.dungeon.grid.GridCoordinate;

/**
 * Read-only view of a settled search node handed to {@link CostPolicy} implementations.
 *
 * @param coordinate cell the node sits on.
 * @param cost accumulated cost from the search origin.
 * @param room whether the node was reached through a room cell.
 * @param corridor whether the node was reached through a corridor cell.
 * @param stairs whether the node was reached by a staircase move.
 */
public record PathNode(GridCoordinate coordinate, double cost, boolean room, boolean corridor, boolean stairs) {

    /**
     * Search origin: zero cost, no classification.
     */
    public static PathNode origin(GridCoordinate coordinate) {
        return new PathNode(coordinate, 0.0d, false, false, false);
    }
}
