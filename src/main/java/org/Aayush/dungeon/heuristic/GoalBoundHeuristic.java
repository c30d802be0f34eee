package org.Aayush.dungeon.heuristic;

import org.Aayush.dungeon.grid.GridCoordinate;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimate(GridCoordinate)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a cell to a pre-bound goal.
     *
     * @param from current cell.
     * @return non-negative estimate.
     */
    double estimate(GridCoordinate from);
}
