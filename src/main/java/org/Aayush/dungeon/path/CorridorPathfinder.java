package org.Aayush.dungeon.path;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;
import org.Aayush.dungeon.heuristic.GoalBoundHeuristic;
import org.Aayush.dungeon.heuristic.HeuristicProvider;
import org.Aayush.dungeon.search.ClosedSet;
import org.Aayush.dungeon.search.SearchQueue;
import org.Aayush.dungeon.search.TrailSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Constrained A* that carves one corridor between two anchor cells.
 *
 * <p>Per-cell search state lives in flat arrays indexed by linear cell index and is invalidated in
 * O(1) per search through a generation stamp, so one instance serves every edge of a run.</p>
 *
 * <p>Each node carries the trail of cells its partial path has consumed (a persistent
 * {@link TrailSet}); a move is illegal when its destination, or any cell of a staircase
 * footprint, is already on that trail. Everything else is decided by the {@link CostPolicy}
 * passed into {@link #findPath}.</p>
 *
 * <p><strong>Thread Safety:</strong> NOT thread-safe. One instance per run.</p>
 */
@Slf4j
public final class CorridorPathfinder {
    private static final byte FLAG_ROOM = 1;
    private static final byte FLAG_CORRIDOR = 1 << 1;
    private static final byte FLAG_STAIRS = 1 << 2;

    private static final double STAIR_PREFERENCE = 1.2d;
    private static final double CLOSE_RANGE = 3.0d;

    private final GridView layout;
    private final HeuristicProvider heuristics;
    private final SearchBudget budget;
    private final double roomTransitionMultiplier;

    private final SearchQueue queue;
    private final ClosedSet closed;

    // Generation-tagged node arena.
    private final int[] generation;
    private final double[] cost;
    private final int[] parent;
    private final byte[] flags;
    private final TrailSet[] trail;
    private final StairStructure[] arrivalStair;
    private int currentGeneration;

    /**
     * Creates a pathfinder for grids with the extents of {@code layout}.
     *
     * @param layout grid whose extents bound every search.
     * @param heuristics heuristic provider bound once per search.
     * @param budget settled-node bound per search.
     * @param roomTransitionMultiplier multiple of the step cost charged when crossing between room and corridor.
     */
    public CorridorPathfinder(
            GridView layout,
            HeuristicProvider heuristics,
            SearchBudget budget,
            double roomTransitionMultiplier
    ) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.heuristics = Objects.requireNonNull(heuristics, "heuristics");
        this.budget = Objects.requireNonNull(budget, "budget");
        if (!Double.isFinite(roomTransitionMultiplier) || roomTransitionMultiplier < 0.0d) {
            throw new IllegalArgumentException(
                    "roomTransitionMultiplier must be finite and >= 0, got " + roomTransitionMultiplier
            );
        }
        this.roomTransitionMultiplier = roomTransitionMultiplier;

        int cells = layout.cellCount();
        this.queue = new SearchQueue(cells);
        this.closed = new ClosedSet(cells);
        this.generation = new int[cells];
        this.cost = new double[cells];
        this.parent = new int[cells];
        this.flags = new byte[cells];
        this.trail = new TrailSet[cells];
        this.arrivalStair = new StairStructure[cells];
    }

    /**
     * Searches a corridor from {@code start} to {@code goal}.
     *
     * @param start anchor in the source room.
     * @param goal anchor in the destination room.
     * @param policy movement rules for this edge.
     * @return reachable result with path and staircases, or an unreachable result.
     * @throws IllegalArgumentException when an endpoint is out of bounds.
     */
    public PathSearchResult findPath(GridCoordinate start, GridCoordinate goal, CostPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        requireInBounds(start, "start");
        requireInBounds(goal, "goal");

        beginSearch();
        GoalBoundHeuristic heuristic = heuristics.bindGoal(goal);
        int startIndex = layout.index(start);
        int goalIndex = layout.index(goal);

        touch(startIndex, 0.0d, -1, (byte) 0, TrailSet.empty(), null);
        queue.enqueue(startIndex, heuristic.estimate(start));

        int settled = 0;
        while (!queue.isEmpty()) {
            int index = queue.dequeue();
            if (index == goalIndex) {
                PathSearchResult result = reconstruct(goalIndex, settled);
                log.debug("corridor {} -> {}: {} cells, {} stairs, cost {}, settled {}",
                        start, goal, result.getPath().size(), result.getStairs().size(),
                        result.getTotalCost(), settled);
                return result;
            }
            if (!closed.close(index)) {
                continue;
            }
            settled++;
            if (budget.isExceeded(settled)) {
                log.debug("corridor {} -> {}: budget exhausted after {} settled nodes", start, goal, settled);
                return PathSearchResult.unreachable(settled, true);
            }
            expand(index, goal, policy, heuristic);
        }

        log.debug("corridor {} -> {}: unreachable, settled {}", start, goal, settled);
        return PathSearchResult.unreachable(settled, false);
    }

    private void expand(int index, GridCoordinate goal, CostPolicy policy, GoalBoundHeuristic heuristic) {
        GridCoordinate current = layout.coordinateOf(index);
        byte currentFlags = flags[index];
        PathNode node = new PathNode(
                current,
                cost[index],
                (currentFlags & FLAG_ROOM) != 0,
                (currentFlags & FLAG_CORRIDOR) != 0,
                (currentFlags & FLAG_STAIRS) != 0
        );
        TrailSet currentTrail = trail[index];

        for (GridCoordinate offset : orderedOffsets(current, goal)) {
            GridCoordinate next = current.plus(offset);
            if (!layout.inBounds(next)) {
                continue;
            }
            int nextIndex = layout.index(next);
            if (closed.isClosed(nextIndex) || currentTrail.contains(nextIndex)) {
                continue;
            }

            PathMove move;
            if (offset.y() != 0) {
                StairStructure stair = StairStructure.of(current, offset);
                if (!footprintIsFree(stair, currentTrail)) {
                    continue;
                }
                move = PathMove.stair(stair);
            } else {
                move = PathMove.flat(current, next);
            }

            PathCost verdict = policy.evaluate(node, move);
            if (!verdict.traversable()) {
                continue;
            }
            double penalty = 0.0d;
            if ((verdict.room() && node.corridor()) || (verdict.corridor() && node.room())) {
                penalty = verdict.cost() * roomTransitionMultiplier;
            }
            double newCost = node.cost() + verdict.cost() + penalty;

            boolean queued = queue.contains(nextIndex);
            if (queued && newCost >= cost[nextIndex]) {
                continue;
            }

            TrailSet childTrail = currentTrail.with(index);
            if (move.isStair()) {
                for (GridCoordinate cell : move.stair().intermediates()) {
                    childTrail = childTrail.with(layout.index(cell));
                }
            }
            byte childFlags = (byte) ((verdict.room() ? FLAG_ROOM : 0)
                    | (verdict.corridor() ? FLAG_CORRIDOR : 0)
                    | (verdict.stairs() ? FLAG_STAIRS : 0));
            touch(nextIndex, newCost, index, childFlags, childTrail, move.stair());

            double priority = newCost + heuristic.estimate(next);
            if (queued) {
                queue.updatePriority(nextIndex, priority);
            } else {
                queue.enqueue(nextIndex, priority);
            }
        }
    }

    private boolean footprintIsFree(StairStructure stair, TrailSet currentTrail) {
        for (GridCoordinate cell : stair.footprint()) {
            if (!layout.inBounds(cell) || currentTrail.contains(layout.index(cell))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders candidate offsets by descending alignment with the preferred heading.
     */
    List<GridCoordinate> orderedOffsets(GridCoordinate current, GridCoordinate goal) {
        List<GridCoordinate> candidates = MoveSet.candidates(current, goal);
        boolean stairsNeeded = MoveSet.needsStairs(current, goal);

        double px = goal.x() - current.x();
        double py = goal.y() - current.y();
        double pz = goal.z() - current.z();
        if (stairsNeeded) {
            py *= 2.0d;
            if (Math.sqrt(px * px + pz * pz) < CLOSE_RANGE) {
                py *= 2.0d;
            }
        }
        double length = Math.sqrt(px * px + py * py + pz * pz);
        if (length > 0.0d) {
            px /= length;
            py /= length;
            pz /= length;
        }

        List<ScoredOffset> scored = new ArrayList<>(candidates.size());
        for (GridCoordinate offset : candidates) {
            double norm = offset.length();
            double dot = (offset.x() * px + offset.y() * py + offset.z() * pz) / norm;
            if (stairsNeeded && offset.y() != 0) {
                dot *= STAIR_PREFERENCE;
            }
            scored.add(new ScoredOffset(offset, dot));
        }
        // List.sort is stable: equal scores keep canonical order.
        scored.sort(Comparator.comparingDouble(ScoredOffset::score).reversed());

        List<GridCoordinate> ordered = new ArrayList<>(scored.size());
        for (ScoredOffset entry : scored) {
            ordered.add(entry.offset());
        }
        return ordered;
    }

    /**
     * Best known cost of a cell in the most recent search, {@code +INF} when it was never reached.
     */
    double lastCostOf(GridCoordinate coordinate) {
        int index = layout.index(coordinate);
        return generation[index] == currentGeneration ? cost[index] : Double.POSITIVE_INFINITY;
    }

    private PathSearchResult reconstruct(int goalIndex, int settled) {
        List<GridCoordinate> cells = new ArrayList<>();
        List<StairStructure> stairs = new ArrayList<>();
        for (int index = goalIndex; index != -1; index = parent[index]) {
            cells.add(layout.coordinateOf(index));
            if (arrivalStair[index] != null) {
                stairs.add(arrivalStair[index]);
            }
        }
        Collections.reverse(cells);
        Collections.reverse(stairs);
        return PathSearchResult.builder()
                .reachable(true)
                .totalCost(cost[goalIndex])
                .settledNodes(settled)
                .path(cells)
                .stairs(stairs)
                .build();
    }

    private void beginSearch() {
        queue.clear();
        closed.clear();
        currentGeneration++;
        if (currentGeneration == 0) {
            // Wrapped: stale stamps could collide, wipe them.
            Arrays.fill(generation, 0);
            currentGeneration = 1;
        }
    }

    private void touch(int index, double nodeCost, int parentIndex, byte nodeFlags, TrailSet nodeTrail,
                       StairStructure stair) {
        generation[index] = currentGeneration;
        cost[index] = nodeCost;
        parent[index] = parentIndex;
        flags[index] = nodeFlags;
        trail[index] = nodeTrail;
        arrivalStair[index] = stair;
    }

    private void requireInBounds(GridCoordinate coordinate, String name) {
        Objects.requireNonNull(coordinate, name);
        if (!layout.inBounds(coordinate)) {
            throw new IllegalArgumentException(name + " out of bounds: " + coordinate);
        }
    }

    private record ScoredOffset(GridCoordinate offset, double score) {
    }
}
