package org.Aayush.dungeon.heuristic;

import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Objects;

/**
 * Straight-line (L2) heuristic provider for planar layouts.
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {
    private final GridView grid;

    /**
     * Creates an Euclidean heuristic provider.
     *
     * @param grid grid the searches run on.
     */
    public EuclideanHeuristicProvider(GridView grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.EUCLIDEAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GridCoordinate goal) {
        GoalValidation.requireInside(grid, goal);
        return goal::distanceTo;
    }
}
