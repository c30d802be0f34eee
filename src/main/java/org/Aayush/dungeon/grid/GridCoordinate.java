package org.Aayush.dungeon.grid;

/**
 * Integer point on the dungeon lattice.
 *
 * <p>{@code y} is the vertical axis. Planar layouts keep {@code y == 0} and use {@code x}/{@code z}
 * as their two axes.</p>
 *
 * <p>Ordering is lexicographic on {@code (z, y, x)}, which matches ordering by linear grid index.</p>
 */
public record GridCoordinate(int x, int y, int z) implements Comparable<GridCoordinate> {

    public static final GridCoordinate ORIGIN = new GridCoordinate(0, 0, 0);

    /**
     * Creates a planar coordinate at level zero.
     */
    public static GridCoordinate planar(int x, int z) {
        return new GridCoordinate(x, 0, z);
    }

    public GridCoordinate plus(GridCoordinate offset) {
        return new GridCoordinate(x + offset.x, y + offset.y, z + offset.z);
    }

    public GridCoordinate plus(int dx, int dy, int dz) {
        return new GridCoordinate(x + dx, y + dy, z + dz);
    }

    public GridCoordinate minus(GridCoordinate other) {
        return new GridCoordinate(x - other.x, y - other.y, z - other.z);
    }

    public GridCoordinate scale(int factor) {
        return new GridCoordinate(x * factor, y * factor, z * factor);
    }

    /**
     * Euclidean distance between two lattice points.
     */
    public double distanceTo(GridCoordinate other) {
        double dx = other.x - x;
        double dy = other.y - y;
        double dz = other.z - z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Euclidean length of this coordinate read as an offset vector.
     */
    public double length() {
        return Math.sqrt((double) x * x + (double) y * y + (double) z * z);
    }

    @Override
    public int compareTo(GridCoordinate other) {
        int cmp = Integer.compare(z, other.z);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(y, other.y);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(x, other.x);
    }

    @Override
    public String toString() {
        return "[" + x + "," + y + "," + z + "]";
    }
}
