package org.Aayush.dungeon.grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Axis-aligned integer box: {@code origin} inclusive, {@code origin + size} exclusive.
 */
public record GridBox(GridCoordinate origin, GridCoordinate size) {

    public GridBox {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(size, "size");
        if (size.x() < 1 || size.y() < 1 || size.z() < 1) {
            throw new IllegalArgumentException("box extent must be >= 1 on every axis: " + size);
        }
    }

    public int minX() {
        return origin.x();
    }

    public int minY() {
        return origin.y();
    }

    public int minZ() {
        return origin.z();
    }

    /** Exclusive upper bound on x. */
    public int maxX() {
        return origin.x() + size.x();
    }

    /** Exclusive upper bound on y. */
    public int maxY() {
        return origin.y() + size.y();
    }

    /** Exclusive upper bound on z. */
    public int maxZ() {
        return origin.z() + size.z();
    }

    public int volume() {
        return size.x() * size.y() * size.z();
    }

    /**
     * Geometric center in continuous space ({@code origin + size / 2}).
     */
    public double centerX() {
        return origin.x() + size.x() / 2.0d;
    }

    public double centerY() {
        return origin.y() + size.y() / 2.0d;
    }

    public double centerZ() {
        return origin.z() + size.z() / 2.0d;
    }

    /**
     * Distance between the continuous centers of two boxes.
     */
    public double centerDistance(GridBox other) {
        double dx = other.centerX() - centerX();
        double dy = other.centerY() - centerY();
        double dz = other.centerZ() - centerZ();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public boolean contains(GridCoordinate c) {
        return c.x() >= minX() && c.x() < maxX()
                && c.y() >= minY() && c.y() < maxY()
                && c.z() >= minZ() && c.z() < maxZ();
    }

    /**
     * Two boxes intersect iff they overlap on every axis at once.
     */
    public boolean intersects(GridBox other) {
        return minX() < other.maxX() && other.minX() < maxX()
                && minY() < other.maxY() && other.minY() < maxY()
                && minZ() < other.maxZ() && other.minZ() < maxZ();
    }

    /**
     * Grows the box by {@code margin} on both sides of each axis.
     */
    public GridBox inflate(GridCoordinate margin) {
        return new GridBox(origin.minus(margin), size.plus(margin.scale(2)));
    }

    /**
     * Returns true when the box lies inside {@code [0, extent)} on every axis.
     */
    public boolean fitsWithin(int sizeX, int sizeY, int sizeZ) {
        return minX() >= 0 && minY() >= 0 && minZ() >= 0
                && maxX() <= sizeX && maxY() <= sizeY && maxZ() <= sizeZ;
    }

    /**
     * Enumerates every cell in linear-index order (x fastest, then y, then z).
     */
    public List<GridCoordinate> cells() {
        List<GridCoordinate> cells = new ArrayList<>(volume());
        for (int z = minZ(); z < maxZ(); z++) {
            for (int y = minY(); y < maxY(); y++) {
                for (int x = minX(); x < maxX(); x++) {
                    cells.add(new GridCoordinate(x, y, z));
                }
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return "GridBox{origin=" + origin + ", size=" + size + '}';
    }
}
