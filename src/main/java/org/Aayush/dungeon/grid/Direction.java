package org.Aayush.dungeon.grid;

/**
 * Axis-aligned unit directions on the lattice.
 */
public enum Direction {
    X_PLUS(1, 0, 0),
    X_MINUS(-1, 0, 0),
    Y_PLUS(0, 1, 0),
    Y_MINUS(0, -1, 0),
    Z_PLUS(0, 0, 1),
    Z_MINUS(0, 0, -1);

    private static final Direction[] VALUES = values();

    private final GridCoordinate offset;

    Direction(int dx, int dy, int dz) {
        this.offset = new GridCoordinate(dx, dy, dz);
    }

    public GridCoordinate offset() {
        return offset;
    }

    /**
     * Returns the direction pointing the other way along the same axis.
     */
    public Direction opposite() {
        return switch (this) {
            case X_PLUS -> X_MINUS;
            case X_MINUS -> X_PLUS;
            case Y_PLUS -> Y_MINUS;
            case Y_MINUS -> Y_PLUS;
            case Z_PLUS -> Z_MINUS;
            case Z_MINUS -> Z_PLUS;
        };
    }

    public boolean isHorizontal() {
        return offset.y() == 0;
    }

    /**
     * Bit used by {@link DirectionSet}.
     */
    int mask() {
        return 1 << ordinal();
    }

    static Direction fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    /**
     * Horizontal heading of a step between two path cells.
     *
     * <p>The x axis wins over z; vertical displacement is ignored so a staircase step
     * reports the compass direction it climbs along.</p>
     *
     * @return heading, or {@code null} when the step has no horizontal component.
     */
    public static Direction headingOf(GridCoordinate from, GridCoordinate to) {
        int dx = to.x() - from.x();
        int dz = to.z() - from.z();
        if (dx > 0) return X_PLUS;
        if (dx < 0) return X_MINUS;
        if (dz > 0) return Z_PLUS;
        if (dz < 0) return Z_MINUS;
        return null;
    }
}
