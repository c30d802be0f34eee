package org.Aayush.dungeon.path;

/**
 * Verdict of a {@link CostPolicy} for one move.
 *
 * @param traversable whether the move may be taken at all.
 * @param cost non-negative step cost, ignored when not traversable.
 * @param stairs whether the move builds a staircase.
 * @param room whether the destination counts as room space.
 * @param corridor whether the destination counts as corridor space.
 */
public record PathCost(boolean traversable, double cost, boolean stairs, boolean room, boolean corridor) {
    private static final PathCost BLOCKED = new PathCost(false, Double.POSITIVE_INFINITY, false, false, false);

    public PathCost {
        if (traversable && (!Double.isFinite(cost) || cost < 0.0d)) {
            throw new IllegalArgumentException("traversable cost must be finite and >= 0, got " + cost);
        }
    }

    public static PathCost blocked() {
        return BLOCKED;
    }

    public static PathCost flat(double cost, boolean room, boolean corridor) {
        return new PathCost(true, cost, false, room, corridor);
    }

    public static PathCost stairs(double cost) {
        return new PathCost(true, cost, true, false, false);
    }
}
