package org.Aayush.dungeon.room;

import org.Aayush.dungeon.grid.DirectionSet;
import org.Aayush.dungeon.grid.GridCoordinate;

/**
 * Per-cell room metadata.
 *
 * @param coordinate cell inside the room.
 * @param boundary directions whose neighbor lies outside the room or the grid.
 * @param entrances directions in which a corridor opens into this cell.
 */
public record RoomCell(GridCoordinate coordinate, DirectionSet boundary, DirectionSet entrances) {

    public boolean isEntrance() {
        return !entrances.isEmpty();
    }

    /** True for cells not touching the room's outer shell. */
    public boolean isInterior() {
        return boundary.isEmpty();
    }
}
