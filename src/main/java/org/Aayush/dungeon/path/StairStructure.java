package org.Aayush.dungeon.path;

import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.List;
import java.util.Objects;

/**
 * Six-cell staircase spanning one level change.
 *
 * <p>For a move from {@code s} by offset {@code o} with horizontal unit {@code h} and vertical
 * unit {@code v}, the footprint is {@code s, s+h, s+2h, s+v+h, s+v+2h, s+o}. The four middle
 * cells are the intermediates that get stamped as stair cells.</p>
 */
public final class StairStructure {
    private final GridCoordinate origin;
    private final GridCoordinate destination;
    private final GridCoordinate horizontalStep;
    private final List<GridCoordinate> intermediates;

    private StairStructure(GridCoordinate origin, GridCoordinate offset) {
        this.origin = origin;
        this.destination = origin.plus(offset);
        this.horizontalStep = new GridCoordinate(Integer.signum(offset.x()), 0, Integer.signum(offset.z()));
        GridCoordinate vertical = new GridCoordinate(0, offset.y(), 0);
        this.intermediates = List.of(
                origin.plus(horizontalStep),
                origin.plus(horizontalStep.scale(2)),
                origin.plus(vertical).plus(horizontalStep),
                origin.plus(vertical).plus(horizontalStep.scale(2))
        );
    }

    /**
     * Builds the staircase for a move starting at {@code origin}.
     *
     * @throws IllegalArgumentException when the offset is not a one-level, three-cell staircase move.
     */
    public static StairStructure of(GridCoordinate origin, GridCoordinate offset) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(offset, "offset");
        if (!MoveSet.isStairOffset(offset)) {
            throw new IllegalArgumentException("not a staircase offset: " + offset);
        }
        return new StairStructure(origin, offset);
    }

    public GridCoordinate origin() {
        return origin;
    }

    public GridCoordinate destination() {
        return destination;
    }

    /** Unit horizontal direction the staircase runs along. */
    public GridCoordinate horizontalStep() {
        return horizontalStep;
    }

    /** The four cells between the landings. */
    public List<GridCoordinate> intermediates() {
        return intermediates;
    }

    /**
     * All six cells, landings included, in construction order.
     */
    public List<GridCoordinate> footprint() {
        return List.of(
                origin,
                intermediates.get(0),
                intermediates.get(1),
                intermediates.get(2),
                intermediates.get(3),
                destination
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StairStructure)) return false;
        StairStructure other = (StairStructure) o;
        return origin.equals(other.origin) && destination.equals(other.destination);
    }

    @Override
    public int hashCode() {
        return 31 * origin.hashCode() + destination.hashCode();
    }

    @Override
    public String toString() {
        return "StairStructure{" + origin + " -> " + destination + '}';
    }
}
