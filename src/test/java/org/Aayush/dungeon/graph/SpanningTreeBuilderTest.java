package org.Aayush.dungeon.graph;

import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.room.Room;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Spanning Tree Builder Tests")
class SpanningTreeBuilderTest {

    private static List<Room> scatteredRooms(int count, long seed) {
        Random random = new Random(seed);
        List<Room> rooms = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            GridCoordinate origin = new GridCoordinate(random.nextInt(100), 0, random.nextInt(100));
            rooms.add(new Room(i, new GridBox(origin, new GridCoordinate(3, 1, 3))));
        }
        return rooms;
    }

    private static Room roomAt(int index, int x, int z) {
        return new Room(index, new GridBox(new GridCoordinate(x, 0, z), new GridCoordinate(2, 1, 2)));
    }

    private static boolean connected(int n, List<RoomEdge> edges) {
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (RoomEdge edge : edges) {
            parent[find(parent, edge.u())] = find(parent, edge.v());
        }
        for (int i = 1; i < n; i++) {
            if (find(parent, i) != find(parent, 0)) {
                return false;
            }
        }
        return true;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    @Nested
    @DisplayName("Tree selection")
    class TreeTests {

        @ParameterizedTest(name = "{0} rooms")
        @ValueSource(ints = {1, 2, 5, 20})
        @DisplayName("Complete candidates give a spanning tree of n-1 edges")
        void testSpanning(int count) {
            List<Room> rooms = scatteredRooms(count, count * 31L);
            List<RoomEdge> candidates = new CompleteCandidateGraph().edges(rooms);

            SpanningTree tree = new SpanningTreeBuilder(0.0).build(rooms, candidates, new Random(1L));

            assertEquals(count - 1, tree.getTreeEdges().size());
            assertFalse(tree.isRepaired());
            assertTrue(tree.getCycleEdges().isEmpty());
            assertTrue(connected(count, tree.selectedEdges()));
        }

        @Test
        @DisplayName("Tree weight matches a brute-force minimum on a small layout")
        void testMinimumWeight() {
            List<Room> rooms = List.of(roomAt(0, 0, 0), roomAt(1, 10, 0), roomAt(2, 10, 4), roomAt(3, 30, 0));
            List<RoomEdge> candidates = new CompleteCandidateGraph().edges(rooms);

            SpanningTree tree = new SpanningTreeBuilder(0.0).build(rooms, candidates, new Random(1L));

            Set<RoomEdge> expected = Set.of(new RoomEdge(0, 1, 10), new RoomEdge(1, 2, 4), new RoomEdge(1, 3, 20));
            assertEquals(expected, new HashSet<>(tree.getTreeEdges()));
        }

        @Test
        @DisplayName("Empty room list yields nothing")
        void testEmpty() {
            SpanningTree tree = new SpanningTreeBuilder(0.5).build(List.of(), List.of(), new Random(1L));
            assertTrue(tree.selectedEdges().isEmpty());
        }
    }

    @Nested
    @DisplayName("Connectivity repair")
    class RepairTests {

        @Test
        @DisplayName("No candidates at all still connects every room")
        void testNoCandidates() {
            List<Room> rooms = scatteredRooms(6, 4L);

            SpanningTree tree = new SpanningTreeBuilder(0.0).build(rooms, List.of(), new Random(1L));

            assertTrue(tree.getTreeEdges().isEmpty());
            assertEquals(5, tree.getRepairEdges().size());
            assertTrue(tree.isRepaired());
            assertTrue(connected(6, tree.selectedEdges()));
        }

        @Test
        @DisplayName("Disconnected candidate graph is joined to the nearest tree room")
        void testDisconnectedCandidates() {
            List<Room> rooms = List.of(roomAt(0, 0, 0), roomAt(1, 5, 0), roomAt(2, 40, 0), roomAt(3, 45, 0));
            List<RoomEdge> candidates = List.of(
                    new RoomEdge(0, 1, rooms.get(0).centerDistance(rooms.get(1))),
                    new RoomEdge(2, 3, rooms.get(2).centerDistance(rooms.get(3)))
            );

            SpanningTree tree = new SpanningTreeBuilder(0.0).build(rooms, candidates, new Random(1L));

            assertEquals(List.of(new RoomEdge(0, 1, 5)), tree.getTreeEdges());
            assertEquals(List.of(new RoomEdge(2, 1, 35), new RoomEdge(3, 2, 5)), tree.getRepairEdges());
            assertTrue(connected(4, tree.selectedEdges()));
        }

        @Test
        @DisplayName("Candidates naming unknown rooms are rejected")
        void testInvalidCandidate() {
            List<Room> rooms = scatteredRooms(2, 1L);
            List<RoomEdge> candidates = List.of(new RoomEdge(0, 5, 1.0));
            assertThrows(IllegalArgumentException.class,
                    () -> new SpanningTreeBuilder(0.0).build(rooms, candidates, new Random(1L)));
        }
    }

    @Nested
    @DisplayName("Cycle injection")
    class CycleTests {

        @Test
        @DisplayName("Probability one keeps every candidate")
        void testAllCycles() {
            List<Room> rooms = scatteredRooms(6, 8L);
            List<RoomEdge> candidates = new CompleteCandidateGraph().edges(rooms);

            SpanningTree tree = new SpanningTreeBuilder(1.0).build(rooms, candidates, new Random(1L));

            assertEquals(candidates.size(), tree.selectedEdges().size());
            assertEquals(candidates.size() - 5, tree.getCycleEdges().size());
            assertEquals(new HashSet<>(candidates), new HashSet<>(tree.selectedEdges()));
        }

        @Test
        @DisplayName("Same seed gives the same cycles")
        void testDeterminism() {
            List<Room> rooms = scatteredRooms(12, 21L);
            List<RoomEdge> candidates = new CompleteCandidateGraph().edges(rooms);

            SpanningTree a = new SpanningTreeBuilder(0.3).build(rooms, candidates, new Random(99L));
            SpanningTree b = new SpanningTreeBuilder(0.3).build(rooms, candidates, new Random(99L));

            assertEquals(a.selectedEdges(), b.selectedEdges());
        }

        @Test
        @DisplayName("Probability outside [0, 1] is rejected")
        void testProbabilityBounds() {
            assertThrows(IllegalArgumentException.class, () -> new SpanningTreeBuilder(-0.1));
            assertThrows(IllegalArgumentException.class, () -> new SpanningTreeBuilder(1.5));
            assertThrows(IllegalArgumentException.class, () -> new SpanningTreeBuilder(Double.NaN));
        }
    }

    @Test
    @DisplayName("Edges are undirected for equality")
    void testRoomEdge() {
        RoomEdge edge = new RoomEdge(2, 7, 3.5);

        assertEquals(new RoomEdge(7, 2, 1.0), edge);
        assertEquals(new RoomEdge(7, 2, 1.0).hashCode(), edge.hashCode());
        assertEquals(7, edge.other(2));
        assertTrue(edge.touches(7));
        assertThrows(IllegalArgumentException.class, () -> edge.other(3));
        assertThrows(IllegalArgumentException.class, () -> new RoomEdge(1, 1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new RoomEdge(0, 1, -1.0));
    }
}
