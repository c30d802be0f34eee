package org.Aayush.dungeon.heuristic;

/**
 * Supported corridor-search heuristic modes.
 *
 * <p>{@code NONE} disables guidance (pure Dijkstra behavior).</p>
 * <p>{@code EUCLIDEAN} is the straight-line distance used for planar layouts.</p>
 * <p>{@code STAIR_AWARE} weights the vertical axis more heavily than the horizontal plane and is
 * tuned rather than proven admissible.</p>
 */
public enum HeuristicType {
    NONE,
    EUCLIDEAN,
    STAIR_AWARE
}
