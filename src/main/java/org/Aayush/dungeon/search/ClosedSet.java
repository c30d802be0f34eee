package org.Aayush.dungeon.search;

import java.util.BitSet;

/**
 * A memory-efficient set of settled grid cells for one search.
 * <p>
 * This class wraps a {@link java.util.BitSet} to provide O(1) access time and
 * a footprint of roughly one bit per grid cell.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search context.
 * </p>
 */
public class ClosedSet {

    private final BitSet closed;

    /**
     * Constructs a new ClosedSet.
     *
     * @param cellCount number of cells in the searched grid.
     */
    public ClosedSet(int cellCount) {
        this.closed = new BitSet(cellCount);
    }

    /**
     * Marks a cell as settled if it hasn't been settled already.
     *
     * @param cellIndex linear grid index.
     * @return {@code true} if the cell was newly marked, {@code false} if it was already closed.
     */
    public boolean close(int cellIndex) {
        if (closed.get(cellIndex)) {
            return false;
        }
        closed.set(cellIndex);
        return true;
    }

    /**
     * Checks if a cell has been settled.
     */
    public boolean isClosed(int cellIndex) {
        return closed.get(cellIndex);
    }

    /**
     * Number of settled cells.
     */
    public int size() {
        return closed.cardinality();
    }

    /**
     * Resets the set for reuse.
     */
    public void clear() {
        closed.clear();
    }
}
