package org.Aayush.dungeon.grid;

/**
 * Read contract over a dense cell-state lattice.
 *
 * <p>Linear index is {@code x + sizeX * y + sizeX * sizeY * z}. With {@code sizeY == 1}
 * this reduces to the planar {@code x + sizeX * z} layout.</p>
 */
public interface GridView {

    int sizeX();

    int sizeY();

    int sizeZ();

    /**
     * Returns the state stored at {@code coordinate}.
     *
     * @throws IllegalArgumentException when the coordinate is out of bounds.
     */
    CellState get(GridCoordinate coordinate);

    /**
     * Returns the state stored at a linear index.
     */
    CellState getAt(int index);

    default int cellCount() {
        return sizeX() * sizeY() * sizeZ();
    }

    /**
     * Counts cells currently in {@code state}.
     */
    default int count(CellState state) {
        int count = 0;
        for (int i = 0, n = cellCount(); i < n; i++) {
            if (getAt(i) == state) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns true when the layout has exactly one vertical level.
     */
    default boolean isPlanar() {
        return sizeY() == 1;
    }

    default boolean inBounds(GridCoordinate c) {
        return inBounds(c.x(), c.y(), c.z());
    }

    default boolean inBounds(int x, int y, int z) {
        return x >= 0 && x < sizeX()
                && y >= 0 && y < sizeY()
                && z >= 0 && z < sizeZ();
    }

    default int index(GridCoordinate c) {
        return c.x() + sizeX() * c.y() + sizeX() * sizeY() * c.z();
    }

    /**
     * Inverse of {@link #index(GridCoordinate)}.
     */
    default GridCoordinate coordinateOf(int index) {
        int layer = sizeX() * sizeY();
        int z = index / layer;
        int rest = index - z * layer;
        int y = rest / sizeX();
        int x = rest - y * sizeX();
        return new GridCoordinate(x, y, z);
    }
}
