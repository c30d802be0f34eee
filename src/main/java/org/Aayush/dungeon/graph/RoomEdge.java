package org.Aayush.dungeon.graph;

/**
 * Undirected connection between two rooms, keyed by room index.
 *
 * <p>{@code u -> v} orientation is kept for corridor carving (the corridor starts in {@code u}),
 * but equality ignores it: {@code (u, v)} equals {@code (v, u)}.</p>
 */
public final class RoomEdge {
    private final int u;
    private final int v;
    private final double weight;

    public RoomEdge(int u, int v, double weight) {
        if (u < 0 || v < 0) {
            throw new IllegalArgumentException("room indices must be >= 0: " + u + ", " + v);
        }
        if (u == v) {
            throw new IllegalArgumentException("self edge on room " + u);
        }
        if (Double.isNaN(weight) || weight < 0.0d) {
            throw new IllegalArgumentException("weight must be >= 0, got " + weight);
        }
        this.u = u;
        this.v = v;
        this.weight = weight;
    }

    public int u() {
        return u;
    }

    public int v() {
        return v;
    }

    public double weight() {
        return weight;
    }

    public boolean touches(int room) {
        return u == room || v == room;
    }

    /**
     * Returns the endpoint that is not {@code room}.
     */
    public int other(int room) {
        if (room == u) return v;
        if (room == v) return u;
        throw new IllegalArgumentException("room " + room + " is not an endpoint of " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoomEdge)) return false;
        RoomEdge other = (RoomEdge) o;
        return Math.min(u, v) == Math.min(other.u, other.v)
                && Math.max(u, v) == Math.max(other.u, other.v);
    }

    @Override
    public int hashCode() {
        return Math.min(u, v) * 31 + Math.max(u, v);
    }

    @Override
    public String toString() {
        return "RoomEdge{" + u + " -> " + v + ", weight=" + weight + '}';
    }
}
