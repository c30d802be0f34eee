package org.Aayush.dungeon.path;

import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.Objects;

/**
 * One candidate step evaluated by a {@link CostPolicy}.
 *
 * @param from cell being expanded.
 * @param to destination cell.
 * @param stair staircase geometry for level-changing moves, {@code null} for flat moves.
 */
public record PathMove(GridCoordinate from, GridCoordinate to, StairStructure stair) {

    public PathMove {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    static PathMove flat(GridCoordinate from, GridCoordinate to) {
        return new PathMove(from, to, null);
    }

    static PathMove stair(StairStructure stair) {
        return new PathMove(stair.origin(), stair.destination(), stair);
    }

    public boolean isStair() {
        return stair != null;
    }

    public GridCoordinate offset() {
        return to.minus(from);
    }
}
