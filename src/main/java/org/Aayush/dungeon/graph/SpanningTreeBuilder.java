package org.Aayush.dungeon.graph;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dungeon.room.Room;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Selects corridor edges: Prim's minimum spanning tree over the candidates, a repair pass that
 * guarantees one connected component, and random extra edges for loops.
 */
@Slf4j
public final class SpanningTreeBuilder {
    private final double extraEdgeProbability;

    /**
     * @param extraEdgeProbability chance in {@code [0, 1]} that a non-tree candidate is kept.
     */
    public SpanningTreeBuilder(double extraEdgeProbability) {
        if (!(extraEdgeProbability >= 0.0d && extraEdgeProbability <= 1.0d)) {
            throw new IllegalArgumentException("extraEdgeProbability must be in [0, 1], got " + extraEdgeProbability);
        }
        this.extraEdgeProbability = extraEdgeProbability;
    }

    /**
     * Builds the edge selection for {@code rooms}.
     *
     * @param rooms placed rooms; {@code rooms.get(i).index() == i}.
     * @param candidates candidate edges in tie-break order.
     * @param random shared run stream, consumed only by cycle injection.
     */
    public SpanningTree build(List<Room> rooms, List<RoomEdge> candidates, Random random) {
        Objects.requireNonNull(rooms, "rooms");
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(random, "random");
        int n = rooms.size();
        for (RoomEdge edge : candidates) {
            if (edge.u() >= n || edge.v() >= n) {
                throw new IllegalArgumentException("candidate " + edge + " references a room outside [0, " + n + ")");
            }
        }
        if (n == 0) {
            return new SpanningTree(List.of(), List.of(), List.of());
        }

        boolean[] inTree = new boolean[n];
        List<Integer> joinOrder = new ArrayList<>(n);
        int root = candidates.isEmpty() ? 0 : candidates.get(0).u();
        inTree[root] = true;
        joinOrder.add(root);

        List<RoomEdge> tree = prim(candidates, inTree, joinOrder);
        List<RoomEdge> repairs = repair(rooms, inTree, joinOrder);

        Set<RoomEdge> selected = new HashSet<>(tree);
        selected.addAll(repairs);
        List<RoomEdge> cycles = new ArrayList<>();
        for (RoomEdge edge : candidates) {
            if (selected.contains(edge)) {
                continue;
            }
            if (random.nextDouble() < extraEdgeProbability) {
                cycles.add(edge);
                selected.add(edge);
            }
        }

        log.debug("edge selection: {} tree, {} repair, {} cycle over {} candidates",
                tree.size(), repairs.size(), cycles.size(), candidates.size());
        return new SpanningTree(
                Collections.unmodifiableList(tree),
                Collections.unmodifiableList(repairs),
                Collections.unmodifiableList(cycles)
        );
    }

    private static List<RoomEdge> prim(List<RoomEdge> candidates, boolean[] inTree, List<Integer> joinOrder) {
        List<RoomEdge> tree = new ArrayList<>();
        while (true) {
            RoomEdge best = null;
            for (RoomEdge edge : candidates) {
                if (inTree[edge.u()] == inTree[edge.v()]) {
                    continue;
                }
                if (best == null || edge.weight() < best.weight()) {
                    best = edge;
                }
            }
            if (best == null) {
                return tree;
            }
            int joined = inTree[best.u()] ? best.v() : best.u();
            inTree[joined] = true;
            joinOrder.add(joined);
            tree.add(best);
        }
    }

    private static List<RoomEdge> repair(List<Room> rooms, boolean[] inTree, List<Integer> joinOrder) {
        List<RoomEdge> repairs = new ArrayList<>();
        for (int i = 0; i < rooms.size(); i++) {
            if (inTree[i]) {
                continue;
            }
            int nearest = -1;
            double nearestDistance = Double.MAX_VALUE;
            for (int member : joinOrder) {
                double distance = rooms.get(i).centerDistance(rooms.get(member));
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearest = member;
                }
            }
            RoomEdge edge = new RoomEdge(i, nearest, nearestDistance);
            repairs.add(edge);
            inTree[i] = true;
            joinOrder.add(i);
            log.warn("room {} unreachable through candidate edges, joined to room {} (distance {})",
                    i, nearest, nearestDistance);
        }
        return repairs;
    }
}
