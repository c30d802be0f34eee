package org.Aayush.dungeon.path;

import org.Aayush.dungeon.grid.CellState;
import org.Aayush.dungeon.grid.DungeonGrid;
import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridSnapshot;
import org.Aayush.dungeon.heuristic.HeuristicFactory;
import org.Aayush.dungeon.heuristic.HeuristicType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Corridor Pathfinder Tests")
class CorridorPathfinderTest {

    private static CorridorPathfinder pathfinder(DungeonGrid grid, SearchBudget budget) {
        return new CorridorPathfinder(
                grid,
                HeuristicFactory.create(HeuristicFactory.defaultTypeFor(grid), grid),
                budget,
                2.0
        );
    }

    private static CostPolicy uniform() {
        return (from, move) -> PathCost.flat(1.0, false, false);
    }

    private static void assertWellFormed(PathSearchResult result) {
        List<GridCoordinate> path = result.getPath();
        assertEquals(path.size(), new HashSet<>(path).size(), "Path must not revisit a cell");

        Set<GridCoordinate> stairCells = new HashSet<>();
        int stairMoves = 0;
        for (int i = 1; i < path.size(); i++) {
            GridCoordinate offset = path.get(i).minus(path.get(i - 1));
            assertTrue(MoveSet.isFlatOffset(offset) || MoveSet.isStairOffset(offset),
                    "Illegal step " + path.get(i - 1) + " -> " + path.get(i));
            if (MoveSet.isStairOffset(offset)) {
                stairMoves++;
            }
        }
        assertEquals(stairMoves, result.getStairs().size(), "One structure per staircase move");

        for (StairStructure stair : result.getStairs()) {
            List<GridCoordinate> footprint = stair.footprint();
            assertEquals(6, new HashSet<>(footprint).size(), "Footprint must be six distinct cells");
            for (GridCoordinate cell : stair.intermediates()) {
                assertFalse(path.contains(cell), "Stair cell " + cell + " reused by the path");
                assertTrue(stairCells.add(cell), "Stair cell " + cell + " shared by two staircases");
            }
        }
    }

    @Nested
    @DisplayName("Planar searches")
    class PlanarTests {

        @Test
        @DisplayName("Open grid: path connects start and goal with unit steps")
        void testOpenGrid() {
            DungeonGrid grid = DungeonGrid.planar(10, 10);
            GridCoordinate start = GridCoordinate.planar(1, 1);
            GridCoordinate goal = GridCoordinate.planar(7, 4);

            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded()).findPath(start, goal, uniform());

            assertTrue(result.isReachable());
            assertEquals(start, result.getPath().get(0));
            assertEquals(goal, result.getPath().get(result.getPath().size() - 1));
            assertEquals(9, result.getPath().size() - 1, "Uniform unit costs give a Manhattan-length path");
            assertEquals(9.0, result.getTotalCost(), 1e-9);
            assertTrue(result.getStairs().isEmpty());
            assertWellFormed(result);
        }

        @Test
        @DisplayName("Start equal to goal yields a single-cell path")
        void testTrivialPath() {
            DungeonGrid grid = DungeonGrid.planar(4, 4);
            GridCoordinate cell = GridCoordinate.planar(2, 2);
            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded()).findPath(cell, cell, uniform());

            assertTrue(result.isReachable());
            assertEquals(List.of(cell), result.getPath());
            assertEquals(0.0, result.getTotalCost());
        }

        @Test
        @DisplayName("Walled-off goal is reported unreachable, not thrown")
        void testUnreachable() {
            DungeonGrid grid = DungeonGrid.planar(9, 9);
            CostPolicy wall = (from, move) -> move.to().x() == 4
                    ? PathCost.blocked()
                    : PathCost.flat(1.0, false, false);

            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded())
                    .findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(8, 8), wall);

            assertFalse(result.isReachable());
            assertFalse(result.isBudgetExhausted());
            assertTrue(result.getPath().isEmpty());
            assertEquals(Double.POSITIVE_INFINITY, result.getTotalCost());
            assertEquals(36, result.getSettledNodes(), "Every cell left of the wall is settled once");
        }

        @Test
        @DisplayName("Settled-node budget ends the search as unreachable")
        void testBudget() {
            DungeonGrid grid = DungeonGrid.planar(30, 30);
            PathSearchResult result = pathfinder(grid, SearchBudget.of(5))
                    .findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(29, 29), uniform());

            assertFalse(result.isReachable());
            assertTrue(result.isBudgetExhausted());
            assertEquals(6, result.getSettledNodes());
        }

        @Test
        @DisplayName("Room-corridor transitions cost extra")
        void testTransitionPenalty() {
            DungeonGrid grid = DungeonGrid.planar(3, 1);
            // corridor at x=1, room at x=2
            CostPolicy policy = (from, move) -> move.to().x() == 1
                    ? PathCost.flat(1.0, false, true)
                    : PathCost.flat(1.0, true, false);

            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded())
                    .findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(2, 0), policy);

            assertTrue(result.isReachable());
            // 1 (into corridor) + 1 + 1 * 2.0 (corridor -> room)
            assertEquals(4.0, result.getTotalCost(), 1e-9);
        }

        @Test
        @DisplayName("Out-of-bounds endpoints are rejected")
        void testBounds() {
            DungeonGrid grid = DungeonGrid.planar(4, 4);
            CorridorPathfinder finder = pathfinder(grid, SearchBudget.unbounded());
            assertThrows(IllegalArgumentException.class,
                    () -> finder.findPath(GridCoordinate.planar(-1, 0), GridCoordinate.planar(1, 1), uniform()));
            assertThrows(IllegalArgumentException.class,
                    () -> finder.findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(4, 1), uniform()));
        }

        @Test
        @DisplayName("Reused instance forgets the previous search")
        void testGenerationReset() {
            DungeonGrid grid = DungeonGrid.planar(10, 10);
            CorridorPathfinder finder = pathfinder(grid, SearchBudget.unbounded());

            PathSearchResult first = finder.findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(9, 0), uniform());
            assertEquals(9.0, finder.lastCostOf(GridCoordinate.planar(9, 0)), 1e-9);

            finder.findPath(GridCoordinate.planar(0, 9), GridCoordinate.planar(1, 9), uniform());
            assertEquals(Double.POSITIVE_INFINITY, finder.lastCostOf(GridCoordinate.planar(9, 0)));

            PathSearchResult again = finder.findPath(GridCoordinate.planar(0, 0), GridCoordinate.planar(9, 0), uniform());
            assertEquals(first, again, "Same inputs must give the same result");
        }
    }

    @Nested
    @DisplayName("Volumetric searches")
    class VolumetricTests {

        @Test
        @DisplayName("One level change produces exactly one staircase")
        void testSingleStair() {
            DungeonGrid grid = new DungeonGrid(12, 2, 3);
            GridCoordinate start = new GridCoordinate(0, 0, 1);
            GridCoordinate goal = new GridCoordinate(9, 1, 1);
            CostPolicy policy = new CorridorCostPolicy(grid.snapshot(), goal, CostWeights.volumetric());

            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded()).findPath(start, goal, policy);

            assertTrue(result.isReachable());
            assertEquals(1, result.getStairs().size());
            StairStructure stair = result.getStairs().get(0);
            assertEquals(0, stair.origin().y());
            assertEquals(1, stair.destination().y());
            assertWellFormed(result);
        }

        @Test
        @DisplayName("Goal on another level with no room for a staircase is unreachable")
        void testNoStairSpace() {
            DungeonGrid grid = new DungeonGrid(3, 2, 3);
            GridCoordinate goal = new GridCoordinate(2, 1, 2);
            CostPolicy policy = new CorridorCostPolicy(grid.snapshot(), goal, CostWeights.volumetric());

            PathSearchResult result = pathfinder(grid, SearchBudget.unbounded())
                    .findPath(new GridCoordinate(0, 0, 0), goal, policy);

            assertFalse(result.isReachable());
        }

        @Test
        @DisplayName("Neighbor ordering favours the staircase when the goal is above and close")
        void testOrdering() {
            DungeonGrid grid = new DungeonGrid(10, 3, 10);
            CorridorPathfinder finder = pathfinder(grid, SearchBudget.unbounded());

            List<GridCoordinate> up = finder.orderedOffsets(new GridCoordinate(2, 0, 2), new GridCoordinate(3, 1, 2));
            assertEquals(new GridCoordinate(3, 1, 0), up.get(0));
            assertEquals(8, up.size());

            List<GridCoordinate> flat = finder.orderedOffsets(new GridCoordinate(2, 0, 2), new GridCoordinate(2, 0, 7));
            assertEquals(new GridCoordinate(0, 0, 1), flat.get(0));
            assertEquals(4, flat.size(), "No staircases once the goal level is reached");
        }

        @Test
        @Timeout(value = 20, unit = TimeUnit.SECONDS)
        @DisplayName("Randomized grids: every found path is well formed")
        void testRandomizedInvariants() {
            Random random = new Random(2024L);
            for (int round = 0; round < 40; round++) {
                DungeonGrid grid = new DungeonGrid(16, 3, 16);
                for (int block = 0; block < 4; block++) {
                    GridBox box = new GridBox(
                            new GridCoordinate(random.nextInt(13), random.nextInt(3), random.nextInt(13)),
                            new GridCoordinate(1 + random.nextInt(3), 1, 1 + random.nextInt(3))
                    );
                    for (GridCoordinate cell : box.cells()) {
                        grid.set(cell, CellState.ROOM);
                    }
                }
                GridCoordinate start = new GridCoordinate(random.nextInt(16), random.nextInt(3), random.nextInt(16));
                GridCoordinate goal = new GridCoordinate(random.nextInt(16), random.nextInt(3), random.nextInt(16));
                GridSnapshot snapshot = grid.snapshot();

                PathSearchResult result = pathfinder(grid, SearchBudget.unbounded())
                        .findPath(start, goal, new CorridorCostPolicy(snapshot, goal, CostWeights.volumetric()));

                if (result.isReachable()) {
                    assertEquals(start, result.getPath().get(0));
                    assertEquals(goal, result.getPath().get(result.getPath().size() - 1));
                    assertEquals(Math.abs(goal.y() - start.y()), result.getStairs().size(),
                            "Only staircases toward the goal level are ever offered");
                    assertWellFormed(result);
                } else {
                    assertTrue(result.getPath().isEmpty());
                }
            }
        }
    }
}
