package org.Aayush.dungeon.room;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dungeon.grid.GridCoordinate;

/**
 * Rejection-sampling parameters for {@link RoomPlacer}.
 */
@Value
@Builder(toBuilder = true)
public class PlacementOptions {
    /** Number of rooms wanted. */
    int roomCount;
    /** Upper bound on sampled candidates. */
    int maxAttempts;
    /** Smallest room extent per axis. */
    GridCoordinate minRoomSize;
    /** Largest room extent per axis (inclusive). */
    GridCoordinate maxRoomSize;
    /** Gap kept around each room, per axis. */
    GridCoordinate bufferMargin;
}
