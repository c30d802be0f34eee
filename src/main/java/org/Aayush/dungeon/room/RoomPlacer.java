package org.Aayush.dungeon.room;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dungeon.grid.CellState;
import org.Aayush.dungeon.grid.DungeonGrid;
import org.Aayush.dungeon.grid.GridBox;
import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Places non-overlapping rooms by rejection sampling and stamps them into the grid.
 *
 * <p>Each attempt draws an origin uniformly in {@code [0, size)} per axis (x, y, z order), then
 * an extent uniformly in {@code [min, max]} per axis. The candidate is rejected when its box
 * inflated by the buffer margin intersects an accepted room, or when the box leaves the grid.</p>
 */
@Slf4j
public final class RoomPlacer {
    private final PlacementOptions options;

    public RoomPlacer(PlacementOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Runs placement against {@code grid}, drawing from the shared {@code random} stream.
     */
    public PlacementResult place(DungeonGrid grid, Random random) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(random, "random");

        GridCoordinate min = options.getMinRoomSize();
        GridCoordinate max = options.getMaxRoomSize();
        GridCoordinate margin = options.getBufferMargin();
        List<Room> rooms = new ArrayList<>(options.getRoomCount());

        int attempts = 0;
        while (attempts < options.getMaxAttempts() && rooms.size() < options.getRoomCount()) {
            attempts++;
            GridCoordinate origin = new GridCoordinate(
                    random.nextInt(grid.sizeX()),
                    random.nextInt(grid.sizeY()),
                    random.nextInt(grid.sizeZ())
            );
            GridCoordinate size = new GridCoordinate(
                    draw(random, min.x(), max.x()),
                    draw(random, min.y(), max.y()),
                    draw(random, min.z(), max.z())
            );
            GridBox candidate = new GridBox(origin, size);
            if (!candidate.fitsWithin(grid.sizeX(), grid.sizeY(), grid.sizeZ())) {
                continue;
            }
            if (collides(candidate.inflate(margin), rooms)) {
                continue;
            }

            Room room = new Room(rooms.size(), candidate);
            rooms.add(room);
            for (GridCoordinate cell : candidate.cells()) {
                grid.set(cell, CellState.ROOM);
            }
            log.debug("placed room {} at {} after {} attempts", room.index(), candidate, attempts);
        }

        PlacementResult result = new PlacementResult(
                Collections.unmodifiableList(rooms),
                options.getRoomCount(),
                attempts
        );
        if (result.isShortfall()) {
            log.warn("placed {} of {} requested rooms within {} attempts",
                    rooms.size(), options.getRoomCount(), options.getMaxAttempts());
        }
        return result;
    }

    private static int draw(Random random, int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    /**
     * True when {@code buffer} overlaps an accepted room's box. Buffers are never tested against
     * each other, so two accepted rooms keep a gap of at least one margin, not two.
     */
    static boolean collides(GridBox buffer, List<Room> rooms) {
        for (Room room : rooms) {
            if (room.bounds().intersects(buffer)) {
                return true;
            }
        }
        return false;
    }
}
