package org.Aayush.dungeon.grid;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of {@link Direction}s packed into a bitmask.
 */
public final class DirectionSet {
    private static final DirectionSet EMPTY = new DirectionSet(0);

    private final int mask;

    private DirectionSet(int mask) {
        this.mask = mask;
    }

    public static DirectionSet empty() {
        return EMPTY;
    }

    public static DirectionSet of(Direction... directions) {
        int mask = 0;
        for (Direction direction : directions) {
            mask |= direction.mask();
        }
        return fromMask(mask);
    }

    /**
     * Rehydrates a set from its packed form.
     */
    public static DirectionSet fromMask(int mask) {
        if (mask == 0) {
            return EMPTY;
        }
        return new DirectionSet(mask);
    }

    public DirectionSet with(Direction direction) {
        int next = mask | direction.mask();
        return next == mask ? this : new DirectionSet(next);
    }

    public boolean contains(Direction direction) {
        return (mask & direction.mask()) != 0;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public int size() {
        return Integer.bitCount(mask);
    }

    public int mask() {
        return mask;
    }

    /**
     * Returns a mutable {@link EnumSet} copy in declaration order.
     */
    public Set<Direction> toSet() {
        EnumSet<Direction> result = EnumSet.noneOf(Direction.class);
        int remaining = mask;
        while (remaining != 0) {
            int bit = Integer.numberOfTrailingZeros(remaining);
            result.add(Direction.fromOrdinal(bit));
            remaining &= remaining - 1;
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectionSet)) return false;
        return mask == ((DirectionSet) o).mask;
    }

    @Override
    public int hashCode() {
        return mask;
    }

    @Override
    public String toString() {
        return toSet().toString();
    }
}
