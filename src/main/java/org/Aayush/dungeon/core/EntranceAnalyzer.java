package org.Aayush.dungeon.core;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.grid.Direction;
import org.Aayush.dungeon.grid.DirectionSet;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;
import org.Aayush.dungeon.room.Room;
import org.Aayush.dungeon.room.RoomCell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives per-cell boundary and entrance metadata for a room once all corridors are carved.
 *
 * <p>A room cell is an entrance in direction {@code d} when its neighbor along {@code d} is a
 * corridor or stair cell whose recorded directions contain the reverse of {@code d}.</p>
 */
@UtilityClass
class EntranceAnalyzer {

    static List<RoomCell> analyze(Room room, GridView grid, DirectionMap directions) {
        List<RoomCell> cells = new ArrayList<>(room.bounds().volume());
        for (GridCoordinate cell : room.bounds().cells()) {
            DirectionSet boundary = DirectionSet.empty();
            DirectionSet entrances = DirectionSet.empty();
            for (Direction direction : Direction.values()) {
                GridCoordinate neighbor = cell.plus(direction.offset());
                boolean inside = grid.inBounds(neighbor);
                if (!inside || !room.contains(neighbor)) {
                    boundary = boundary.with(direction);
                }
                if (inside
                        && grid.get(neighbor).isPassage()
                        && directions.at(neighbor).contains(direction.opposite())) {
                    entrances = entrances.with(direction);
                }
            }
            cells.add(new RoomCell(cell, boundary, entrances));
        }
        return Collections.unmodifiableList(cells);
    }
}
