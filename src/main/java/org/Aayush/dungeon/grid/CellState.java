package org.Aayush.dungeon.grid;

/**
 * Occupancy of one grid cell.
 *
 * <p>{@code STAIR} is terminal: once reserved by a staircase a cell is never
 * re-labelled as room or corridor.</p>
 */
public enum CellState {
    EMPTY,
    ROOM,
    CORRIDOR,
    STAIR;

    private static final CellState[] VALUES = values();

    /**
     * Decodes a stored ordinal.
     */
    static CellState fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    /**
     * Returns true for carved passage cells (corridor or stair).
     */
    public boolean isPassage() {
        return this == CORRIDOR || this == STAIR;
    }
}
