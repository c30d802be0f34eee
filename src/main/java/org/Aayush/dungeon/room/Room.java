package org.Aayush.dungeon.room;

import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.Objects;

/**
 * Placed room: a stable index (placement order) plus its box.
 */
public record Room(int index, GridBox bounds) {

    public Room {
        if (index < 0) {
            throw new IllegalArgumentException("room index must be >= 0, got " + index);
        }
        Objects.requireNonNull(bounds, "bounds");
    }

    public double centerDistance(Room other) {
        return bounds.centerDistance(other.bounds);
    }

    /**
     * Distance from the box center to the lattice origin.
     */
    public double distanceFromOrigin() {
        double cx = bounds.centerX();
        double cy = bounds.centerY();
        double cz = bounds.centerZ();
        return Math.sqrt(cx * cx + cy * cy + cz * cz);
    }

    public boolean contains(GridCoordinate coordinate) {
        return bounds.contains(coordinate);
    }

    /** Lowest level the room occupies. */
    public int floorLevel() {
        return bounds.minY();
    }
}
