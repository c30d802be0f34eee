package org.Aayush.dungeon.grid;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Mutable dense lattice of {@link CellState}s owned by one generation run.
 * <p>
 * Cells are stored as one byte per cell in a flat array. The grid never resizes.
 * </p>
 * <p><strong>Thread Safety:</strong> NOT thread-safe. One instance per run.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DungeonGrid implements GridView {

    private final int sizeX;
    private final int sizeY;
    private final int sizeZ;
    @Getter(AccessLevel.NONE)
    private final byte[] cells;

    /**
     * Creates an all-{@link CellState#EMPTY} grid.
     *
     * @throws IllegalArgumentException when any extent is non-positive or the cell count overflows.
     */
    public DungeonGrid(int sizeX, int sizeY, int sizeZ) {
        if (sizeX <= 0 || sizeY <= 0 || sizeZ <= 0) {
            throw new IllegalArgumentException(
                    "grid extents must be positive: " + sizeX + "x" + sizeY + "x" + sizeZ
            );
        }
        long count = (long) sizeX * sizeY * sizeZ;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid too large: " + count + " cells");
        }
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeZ = sizeZ;
        this.cells = new byte[(int) count];
    }

    /**
     * Creates a single-level grid spanning {@code sizeX x sizeZ}.
     */
    public static DungeonGrid planar(int sizeX, int sizeZ) {
        return new DungeonGrid(sizeX, 1, sizeZ);
    }

    @Override
    public CellState get(GridCoordinate coordinate) {
        requireInBounds(coordinate);
        return CellState.fromOrdinal(cells[index(coordinate)]);
    }

    @Override
    public CellState getAt(int index) {
        return CellState.fromOrdinal(cells[index]);
    }

    /**
     * Overwrites the state at {@code coordinate}.
     *
     * @throws IllegalArgumentException when the coordinate is out of bounds.
     */
    public void set(GridCoordinate coordinate, CellState state) {
        requireInBounds(coordinate);
        cells[index(coordinate)] = (byte) state.ordinal();
    }

    @Override
    public int count(CellState state) {
        int count = 0;
        byte code = (byte) state.ordinal();
        for (byte cell : cells) {
            if (cell == code) {
                count++;
            }
        }
        return count;
    }

    /**
     * Captures an immutable copy of the current cell states.
     */
    public GridSnapshot snapshot() {
        return new GridSnapshot(sizeX, sizeY, sizeZ, Arrays.copyOf(cells, cells.length));
    }

    private void requireInBounds(GridCoordinate coordinate) {
        if (!inBounds(coordinate)) {
            throw new IllegalArgumentException(
                    "coordinate " + coordinate + " out of bounds ["
                            + sizeX + "x" + sizeY + "x" + sizeZ + "]"
            );
        }
    }
}
