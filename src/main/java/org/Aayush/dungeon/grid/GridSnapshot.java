package org.Aayush.dungeon.grid;

import java.util.Arrays;

/**
 * Immutable point-in-time copy of a {@link DungeonGrid}.
 *
 * <p>Cost policies read snapshots so that search results are a pure function of
 * the grid state at the moment the search started.</p>
 */
public final class GridSnapshot implements GridView {
    private final int sizeX;
    private final int sizeY;
    private final int sizeZ;
    private final byte[] cells;

    GridSnapshot(int sizeX, int sizeY, int sizeZ, byte[] cells) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeZ = sizeZ;
        this.cells = cells;
    }

    @Override
    public int sizeX() {
        return sizeX;
    }

    @Override
    public int sizeY() {
        return sizeY;
    }

    @Override
    public int sizeZ() {
        return sizeZ;
    }

    @Override
    public CellState get(GridCoordinate coordinate) {
        if (!inBounds(coordinate)) {
            throw new IllegalArgumentException("coordinate " + coordinate + " out of bounds");
        }
        return CellState.fromOrdinal(cells[index(coordinate)]);
    }

    @Override
    public CellState getAt(int index) {
        return CellState.fromOrdinal(cells[index]);
    }

    /**
     * Returns true when both snapshots hold identical extents and cell states.
     */
    public boolean sameCells(GridSnapshot other) {
        return sizeX == other.sizeX && sizeY == other.sizeY && sizeZ == other.sizeZ
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridSnapshot)) return false;
        return sameCells((GridSnapshot) o);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * sizeX + sizeY) + sizeZ) + Arrays.hashCode(cells);
    }
}
