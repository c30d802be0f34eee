package org.Aayush.dungeon.heuristic;

import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like plain Dijkstra
 * while still honoring bound-check contracts.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final GoalBoundHeuristic ZERO = from -> 0.0d;

    private final GridView grid;

    /**
     * Creates a null heuristic provider for one grid.
     *
     * @param grid grid used for goal bound validation.
     */
    public NullHeuristicProvider(GridView grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GridCoordinate goal) {
        GoalValidation.requireInside(grid, goal);
        return ZERO;
    }
}
