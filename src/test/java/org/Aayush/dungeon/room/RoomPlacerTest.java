package org.Aayush.dungeon.room;

import org.Aayush.dungeon.grid.CellState;
import org.Aayush.dungeon.grid.DungeonGrid;
import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Room Placer Tests")
class RoomPlacerTest {

    private static PlacementOptions planarOptions(int count, int attempts) {
        return PlacementOptions.builder()
                .roomCount(count)
                .maxAttempts(attempts)
                .minRoomSize(new GridCoordinate(3, 1, 3))
                .maxRoomSize(new GridCoordinate(6, 1, 6))
                .bufferMargin(new GridCoordinate(1, 0, 1))
                .build();
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 42L, 1234L, 99999L})
    @DisplayName("Accepted rooms stay inside the grid and keep their buffer")
    void testPlacementInvariants(long seed) {
        DungeonGrid grid = DungeonGrid.planar(30, 30);
        GridCoordinate margin = new GridCoordinate(1, 0, 1);
        PlacementResult result = new RoomPlacer(planarOptions(8, 500)).place(grid, new Random(seed));

        List<Room> rooms = result.getRooms();
        assertFalse(rooms.isEmpty());
        int roomCells = 0;
        for (int i = 0; i < rooms.size(); i++) {
            Room room = rooms.get(i);
            assertEquals(i, room.index());
            assertTrue(room.bounds().fitsWithin(30, 1, 30), "room out of bounds: " + room);
            GridCoordinate size = room.bounds().size();
            assertTrue(size.x() >= 3 && size.x() <= 6);
            assertTrue(size.z() >= 3 && size.z() <= 6);
            assertEquals(1, size.y());
            for (int j = 0; j < i; j++) {
                assertFalse(rooms.get(j).bounds().intersects(room.bounds().inflate(margin)),
                        "rooms " + j + " and " + i + " too close");
            }
            for (GridCoordinate cell : room.bounds().cells()) {
                assertEquals(CellState.ROOM, grid.get(cell));
            }
            roomCells += room.bounds().volume();
        }
        assertEquals(roomCells, grid.count(CellState.ROOM));
        assertTrue(result.getAttempts() <= 500);
    }

    /**
     * Cells strictly between two boxes along one axis; negative when they overlap on it.
     */
    private static int gap(int minA, int maxA, int minB, int maxB) {
        return Math.max(minB - maxA, minA - maxB);
    }

    private static boolean separatedByMargin(GridBox a, GridBox b, GridCoordinate margin) {
        return gap(a.minX(), a.maxX(), b.minX(), b.maxX()) >= margin.x()
                || gap(a.minY(), a.maxY(), b.minY(), b.maxY()) >= margin.y()
                || gap(a.minZ(), a.maxZ(), b.minZ(), b.maxZ()) >= margin.z();
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {3L, 42L, 777L, 2024L, 31337L})
    @DisplayName("Every pair of rooms keeps at least a margin-wide gap on some axis")
    void testMarginGap(long seed) {
        PlacementOptions planar = planarOptions(10, 800);
        PlacementOptions volumetric = PlacementOptions.builder()
                .roomCount(8)
                .maxAttempts(800)
                .minRoomSize(new GridCoordinate(3, 1, 3))
                .maxRoomSize(new GridCoordinate(6, 2, 6))
                .bufferMargin(new GridCoordinate(2, 2, 2))
                .build();

        List<Room> flat = new RoomPlacer(planar).place(DungeonGrid.planar(30, 30), new Random(seed)).getRooms();
        List<Room> stacked = new RoomPlacer(volumetric).place(new DungeonGrid(30, 5, 30), new Random(seed)).getRooms();

        for (int i = 0; i < flat.size(); i++) {
            for (int j = i + 1; j < flat.size(); j++) {
                assertTrue(separatedByMargin(flat.get(i).bounds(), flat.get(j).bounds(), planar.getBufferMargin()),
                        "planar rooms " + i + " and " + j + " are closer than the margin");
            }
        }
        for (int i = 0; i < stacked.size(); i++) {
            for (int j = i + 1; j < stacked.size(); j++) {
                assertTrue(separatedByMargin(stacked.get(i).bounds(), stacked.get(j).bounds(),
                                volumetric.getBufferMargin()),
                        "volumetric rooms " + i + " and " + j + " are closer than the margin");
            }
        }
    }

    @Test
    @DisplayName("Candidate buffer is tested against room boxes, not against other buffers")
    void testBufferAgainstBoxes() {
        GridCoordinate margin = new GridCoordinate(1, 0, 1);
        List<Room> accepted = List.of(
                new Room(0, new GridBox(new GridCoordinate(0, 0, 0), new GridCoordinate(4, 1, 4))));

        GridBox oneCellGap = new GridBox(new GridCoordinate(5, 0, 0), new GridCoordinate(3, 1, 3));
        GridBox touching = new GridBox(new GridCoordinate(4, 0, 0), new GridCoordinate(3, 1, 3));

        assertFalse(RoomPlacer.collides(oneCellGap.inflate(margin), accepted));
        assertTrue(oneCellGap.inflate(margin).intersects(accepted.get(0).bounds().inflate(margin)),
                "buffers may overlap once the gap is a single margin");
        assertTrue(RoomPlacer.collides(touching.inflate(margin), accepted));
    }

    @Test
    @DisplayName("Same seed gives the same rooms")
    void testDeterminism() {
        DungeonGrid first = DungeonGrid.planar(30, 30);
        DungeonGrid second = DungeonGrid.planar(30, 30);

        PlacementResult a = new RoomPlacer(planarOptions(8, 500)).place(first, new Random(77L));
        PlacementResult b = new RoomPlacer(planarOptions(8, 500)).place(second, new Random(77L));

        assertEquals(a.getRooms(), b.getRooms());
        assertEquals(a.getAttempts(), b.getAttempts());
        assertEquals(first.snapshot(), second.snapshot());
    }

    @Test
    @DisplayName("Crowded grid reports a shortfall after exhausting its attempts")
    void testShortfall() {
        DungeonGrid grid = DungeonGrid.planar(5, 5);
        PlacementOptions options = PlacementOptions.builder()
                .roomCount(3)
                .maxAttempts(200)
                .minRoomSize(new GridCoordinate(4, 1, 4))
                .maxRoomSize(new GridCoordinate(4, 1, 4))
                .bufferMargin(GridCoordinate.ORIGIN)
                .build();

        PlacementResult result = new RoomPlacer(options).place(grid, new Random(7L));

        assertTrue(result.isShortfall());
        assertEquals(3, result.getRequested());
        assertEquals(200, result.getAttempts());
        assertTrue(result.getRooms().size() <= 1);
    }

    @Test
    @DisplayName("Placement stops as soon as the requested count is reached")
    void testStopsEarly() {
        DungeonGrid grid = DungeonGrid.planar(40, 40);
        PlacementResult result = new RoomPlacer(planarOptions(1, 500)).place(grid, new Random(3L));

        assertEquals(1, result.getRooms().size());
        assertFalse(result.isShortfall());
        assertTrue(result.getAttempts() < 500);
    }

    @Test
    @DisplayName("Room geometry helpers")
    void testRoomGeometry() {
        Room room = new Room(0, new GridBox(new GridCoordinate(2, 1, 2), new GridCoordinate(2, 1, 2)));

        assertEquals(1, room.floorLevel());
        assertTrue(room.contains(new GridCoordinate(3, 1, 3)));
        assertFalse(room.contains(new GridCoordinate(4, 1, 3)));
        assertEquals(Math.sqrt(3.0 * 3.0 + 1.5 * 1.5 + 3.0 * 3.0), room.distanceFromOrigin(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> new Room(-1, room.bounds()));
    }
}
