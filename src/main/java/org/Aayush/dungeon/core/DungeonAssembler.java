package org.Aayush.dungeon.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dungeon.graph.CandidateGraph;
import org.Aayush.dungeon.graph.CompleteCandidateGraph;
import org.Aayush.dungeon.graph.RoomEdge;
import org.Aayush.dungeon.graph.SpanningTree;
import org.Aayush.dungeon.graph.SpanningTreeBuilder;
import org.Aayush.dungeon.grid.CellState;
import org.Aayush.dungeon.grid.DungeonGrid;
import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.heuristic.HeuristicFactory;
import org.Aayush.dungeon.heuristic.HeuristicProvider;
import org.Aayush.dungeon.heuristic.HeuristicType;
import org.Aayush.dungeon.path.CorridorPathfinder;
import org.Aayush.dungeon.path.PathSearchResult;
import org.Aayush.dungeon.path.StairStructure;
import org.Aayush.dungeon.room.PlacementResult;
import org.Aayush.dungeon.room.Room;
import org.Aayush.dungeon.room.RoomCell;
import org.Aayush.dungeon.room.RoomPlacer;
import org.Aayush.dungeon.room.RoomProperties;
import org.Aayush.dungeon.room.RoomPropertyAssigner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Runs the whole generation pipeline for one configuration.
 *
 * <p>Order: room placement, candidate edges, spanning tree with repair and cycle edges, one
 * corridor search per selected edge (stamped before the next search starts), entrance analysis,
 * then room feature rolls. Every call owns a fresh grid, RNG and pathfinder, so one assembler
 * may be reused for many runs; it is not meant to be shared across threads mid-run.</p>
 */
@Slf4j
public final class DungeonAssembler {
    private final DungeonConfig config;
    private final CandidateGraph candidateGraph;
    private final CostPolicyFactory costPolicyFactory;

    /**
     * Creates an assembler with the complete candidate graph and the default corridor rules.
     */
    public DungeonAssembler(DungeonConfig config) {
        this(config, new CompleteCandidateGraph(), null);
    }

    /**
     * Creates an assembler with explicit collaborators.
     *
     * @param costPolicyFactory per-edge rules; {@code null} uses {@link CostPolicyFactory#corridors}.
     */
    public DungeonAssembler(DungeonConfig config, CandidateGraph candidateGraph, CostPolicyFactory costPolicyFactory) {
        if (config == null) {
            throw new DungeonGenerationException(DungeonGenerationException.REASON_CONFIG_REQUIRED, "config must be provided");
        }
        config.validate();
        this.config = config;
        this.candidateGraph = Objects.requireNonNull(candidateGraph, "candidateGraph");
        this.costPolicyFactory = costPolicyFactory != null
                ? costPolicyFactory
                : CostPolicyFactory.corridors(config.getCostWeights());
    }

    /**
     * Generates a dungeon from the configured seed.
     */
    public DungeonLayout generate() {
        long started = System.nanoTime();
        Random random = new Random(config.getSeed());
        DungeonGrid grid = new DungeonGrid(config.getSizeX(), config.getSizeY(), config.getSizeZ());
        GenerationDiagnostics.GenerationDiagnosticsBuilder diagnostics = GenerationDiagnostics.builder()
                .requestedRooms(config.getRoomCount());

        PlacementResult placement = new RoomPlacer(config.placementOptions()).place(grid, random);
        diagnostics.placementAttempts(placement.getAttempts());
        if (placement.isShortfall()) {
            diagnostics.warning(new GenerationWarning(
                    GenerationWarning.Kind.ROOM_SHORTFALL,
                    "placed " + placement.getRooms().size() + " of " + placement.getRequested() + " rooms"
            ));
        }
        return connect(grid, placement.getRooms(), random, diagnostics, started);
    }

    /**
     * Carves corridors between caller-supplied rooms instead of sampled ones.
     *
     * <p>Boxes keep their list order as room indices. The RNG is still seeded from the config and
     * drives cycle edges and feature rolls.</p>
     *
     * @throws DungeonGenerationException when a box leaves the grid or two boxes overlap.
     */
    public DungeonLayout assemble(List<GridBox> roomBoxes) {
        Objects.requireNonNull(roomBoxes, "roomBoxes");
        long started = System.nanoTime();
        Random random = new Random(config.getSeed());
        DungeonGrid grid = new DungeonGrid(config.getSizeX(), config.getSizeY(), config.getSizeZ());

        List<Room> rooms = new ArrayList<>(roomBoxes.size());
        for (GridBox box : roomBoxes) {
            if (!box.fitsWithin(grid.sizeX(), grid.sizeY(), grid.sizeZ())) {
                throw new DungeonGenerationException(
                        DungeonGenerationException.REASON_ROOM_LAYOUT,
                        "room " + rooms.size() + " " + box + " leaves the grid"
                );
            }
            for (Room placed : rooms) {
                if (placed.bounds().intersects(box)) {
                    throw new DungeonGenerationException(
                            DungeonGenerationException.REASON_ROOM_LAYOUT,
                            "room " + rooms.size() + " " + box + " overlaps room " + placed.index()
                    );
                }
            }
            rooms.add(new Room(rooms.size(), box));
            for (GridCoordinate cell : box.cells()) {
                grid.set(cell, CellState.ROOM);
            }
        }
        GenerationDiagnostics.GenerationDiagnosticsBuilder diagnostics = GenerationDiagnostics.builder()
                .requestedRooms(rooms.size());
        return connect(grid, Collections.unmodifiableList(rooms), random, diagnostics, started);
    }

    private DungeonLayout connect(
            DungeonGrid grid,
            List<Room> rooms,
            Random random,
            GenerationDiagnostics.GenerationDiagnosticsBuilder diagnostics,
            long started
    ) {
        List<RoomEdge> candidates = candidateGraph.edges(rooms);
        SpanningTree tree = new SpanningTreeBuilder(config.getExtraEdgeProbability()).build(rooms, candidates, random);
        for (RoomEdge repair : tree.getRepairEdges()) {
            diagnostics.warning(new GenerationWarning(
                    GenerationWarning.Kind.CONNECTIVITY_REPAIR,
                    "room " + repair.u() + " joined to room " + repair.v() + " by a synthetic edge"
            ));
        }

        HeuristicType heuristicType = config.getHeuristicType() != null
                ? config.getHeuristicType()
                : HeuristicFactory.defaultTypeFor(grid);
        HeuristicProvider heuristics = HeuristicFactory.create(heuristicType, grid);
        CorridorPathfinder pathfinder = new CorridorPathfinder(
                grid,
                heuristics,
                config.searchBudget(),
                config.getCostWeights().getRoomTransitionMultiplier()
        );

        DirectionMap directions = new DirectionMap(grid);
        List<CorridorPath> corridors = new ArrayList<>();
        long settled = 0L;
        for (RoomEdge edge : tree.selectedEdges()) {
            Room from = rooms.get(edge.u());
            Room to = rooms.get(edge.v());
            GridCoordinate start = RoomAnchors.start(from, to);
            GridCoordinate goal = RoomAnchors.end(to, from);

            PathSearchResult result = pathfinder.findPath(start, goal, costPolicyFactory.create(grid.snapshot(), goal));
            settled += result.getSettledNodes();
            if (!result.isReachable()) {
                log.warn("no corridor for {} ({} -> {}), settled {}{}", edge, start, goal,
                        result.getSettledNodes(), result.isBudgetExhausted() ? ", budget exhausted" : "");
                diagnostics.unreachableEdge(edge);
                diagnostics.warning(new GenerationWarning(
                        GenerationWarning.Kind.PATH_NOT_FOUND,
                        "no corridor between room " + edge.u() + " and room " + edge.v()
                ));
                continue;
            }

            CorridorPath corridor = truncate(edge, result, to);
            stamp(grid, corridor);
            List<GridCoordinate> cells = corridor.getCells();
            for (int i = 1; i < cells.size(); i++) {
                directions.link(cells.get(i - 1), cells.get(i));
            }
            corridors.add(corridor);
        }

        List<List<RoomCell>> roomCells = new ArrayList<>(rooms.size());
        for (Room room : rooms) {
            roomCells.add(EntranceAnalyzer.analyze(room, grid, directions));
        }
        List<RoomProperties> properties = new RoomPropertyAssigner(config.getFeatures()).assign(rooms, random);

        int stairCount = 0;
        for (CorridorPath corridor : corridors) {
            stairCount += corridor.getStairs().size();
        }
        GenerationDiagnostics report = diagnostics
                .stairCount(stairCount)
                .settledNodes(settled)
                .elapsedNanos(System.nanoTime() - started)
                .build();
        log.info("dungeon seed={} {}x{}x{}: {} rooms, {} corridors, {} stairs, {} warnings",
                config.getSeed(), grid.sizeX(), grid.sizeY(), grid.sizeZ(),
                rooms.size(), corridors.size(), report.getStairCount(), report.getWarnings().size());

        return new DungeonLayout(
                config.getSeed(),
                grid.snapshot(),
                rooms,
                properties,
                Collections.unmodifiableList(roomCells),
                tree,
                Collections.unmodifiableList(corridors),
                directions,
                report
        );
    }

    /**
     * Cuts the path after its first cell inside {@code destination}.
     */
    static CorridorPath truncate(RoomEdge edge, PathSearchResult result, Room destination) {
        List<GridCoordinate> path = result.getPath();
        int end = path.size();
        for (int i = 0; i < path.size(); i++) {
            if (destination.contains(path.get(i))) {
                end = i + 1;
                break;
            }
        }
        List<GridCoordinate> cells = List.copyOf(path.subList(0, end));
        List<StairStructure> stairs = new ArrayList<>();
        for (StairStructure stair : result.getStairs()) {
            if (cells.contains(stair.destination())) {
                stairs.add(stair);
            }
        }
        return new CorridorPath(edge, cells, Collections.unmodifiableList(stairs), result.getTotalCost());
    }

    /**
     * Marks empty path cells as corridor and reserves staircase intermediates.
     *
     * @throws DungeonGenerationException when a staircase cell is already occupied.
     */
    static void stamp(DungeonGrid grid, CorridorPath corridor) {
        for (GridCoordinate cell : corridor.getCells()) {
            if (grid.get(cell) == CellState.EMPTY) {
                grid.set(cell, CellState.CORRIDOR);
            }
        }
        for (StairStructure stair : corridor.getStairs()) {
            for (GridCoordinate cell : stair.intermediates()) {
                CellState state = grid.get(cell);
                if (state != CellState.EMPTY) {
                    throw new DungeonGenerationException(
                            DungeonGenerationException.REASON_STAIR_OVERLAP,
                            "staircase " + stair + " needs " + cell + " but it is already " + state
                    );
                }
                grid.set(cell, CellState.STAIR);
            }
        }
    }
}
