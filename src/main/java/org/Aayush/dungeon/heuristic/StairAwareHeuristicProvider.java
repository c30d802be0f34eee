package org.Aayush.dungeon.heuristic;

import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Objects;

/**
 * Heuristic for volumetric layouts where level changes need a staircase.
 *
 * <p>Estimate = horizontal L2 distance + {@code |dy| * verticalWeight}, with the vertical term
 * multiplied again by {@code levelChangeMultiplier} while the goal level has not been reached.
 * Vertical distance is deliberately overweighted so the search commits to a staircase early;
 * the estimate is therefore tuned, not admissible.</p>
 */
public final class StairAwareHeuristicProvider implements HeuristicProvider {
    public static final double DEFAULT_VERTICAL_WEIGHT = 2.0d;
    public static final double DEFAULT_LEVEL_CHANGE_MULTIPLIER = 1.5d;

    private final GridView grid;
    private final double verticalWeight;
    private final double levelChangeMultiplier;

    /**
     * Creates a stair-aware heuristic provider.
     *
     * @param grid grid the searches run on.
     * @param verticalWeight weight applied per level of height difference.
     * @param levelChangeMultiplier extra factor while a height difference remains.
     */
    public StairAwareHeuristicProvider(GridView grid, double verticalWeight, double levelChangeMultiplier) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.verticalWeight = verticalWeight;
        this.levelChangeMultiplier = levelChangeMultiplier;
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.STAIR_AWARE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(GridCoordinate goal) {
        GoalValidation.requireInside(grid, goal);
        return new BoundStairAwareHeuristic(goal, verticalWeight, levelChangeMultiplier);
    }

    private static final class BoundStairAwareHeuristic implements GoalBoundHeuristic {
        private final GridCoordinate goal;
        private final double verticalWeight;
        private final double levelChangeMultiplier;

        private BoundStairAwareHeuristic(GridCoordinate goal, double verticalWeight, double levelChangeMultiplier) {
            this.goal = goal;
            this.verticalWeight = verticalWeight;
            this.levelChangeMultiplier = levelChangeMultiplier;
        }

        @Override
        public double estimate(GridCoordinate from) {
            double dx = Math.abs(from.x() - goal.x());
            double dz = Math.abs(from.z() - goal.z());
            double dy = Math.abs(from.y() - goal.y()) * verticalWeight;
            if (from.y() != goal.y()) {
                dy *= levelChangeMultiplier;
            }
            return Math.sqrt(dx * dx + dz * dz) + dy;
        }
    }
}
