package org.Aayush.dungeon.path;

import org.Aayush.dungeon.grid.CellState;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Objects;

/**
 * Default corridor carving rules.
 *
 * <p>Flat step: blocked into stair cells, otherwise {@code distance(to, goal)} plus a state
 * surcharge from {@link CostWeights}. Staircase: every footprint cell must be empty (landings
 * included), optionally with an empty cell past the upper/lower landing, priced at
 * {@code stairCost + distance(to, goal)}.</p>
 */
public final class CorridorCostPolicy implements CostPolicy {
    private final GridView grid;
    private final GridCoordinate goal;
    private final CostWeights weights;

    /**
     * @param grid snapshot of the cells carved so far; never mutated during the search.
     * @param goal search goal the distance term is measured against.
     * @param weights tunables.
     */
    public CorridorCostPolicy(GridView grid, GridCoordinate goal, CostWeights weights) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.goal = Objects.requireNonNull(goal, "goal");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    @Override
    public PathCost evaluate(PathNode from, PathMove move) {
        return move.isStair() ? evaluateStair(move.stair()) : evaluateFlat(move.to());
    }

    private PathCost evaluateFlat(GridCoordinate to) {
        CellState state = grid.get(to);
        double surcharge;
        switch (state) {
            case STAIR:
                return PathCost.blocked();
            case ROOM:
                surcharge = weights.getRoomCost();
                break;
            case CORRIDOR:
                surcharge = weights.getCorridorCost();
                break;
            default:
                surcharge = weights.getEmptyCost();
                break;
        }
        return PathCost.flat(
                to.distanceTo(goal) + surcharge,
                state == CellState.ROOM,
                state == CellState.CORRIDOR
        );
    }

    private PathCost evaluateStair(StairStructure stair) {
        for (GridCoordinate cell : stair.footprint()) {
            if (!grid.inBounds(cell) || grid.get(cell) != CellState.EMPTY) {
                return PathCost.blocked();
            }
        }
        if (weights.isStairClearance()) {
            GridCoordinate beyond = stair.destination().plus(stair.horizontalStep());
            if (grid.inBounds(beyond) && grid.get(beyond) != CellState.EMPTY) {
                return PathCost.blocked();
            }
        }
        return PathCost.stairs(weights.getStairCost() + stair.destination().distanceTo(goal));
    }
}
