package org.Aayush.dungeon.core;

import lombok.Value;
import org.Aayush.dungeon.graph.RoomEdge;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.path.StairStructure;

import java.util.List;

/**
 * Carved corridor for one selected edge, truncated at the first cell inside the destination room.
 */
@Value
public class CorridorPath {
    RoomEdge edge;
    List<GridCoordinate> cells;
    List<StairStructure> stairs;
    double cost;

    public GridCoordinate first() {
        return cells.get(0);
    }

    public GridCoordinate last() {
        return cells.get(cells.size() - 1);
    }
}
