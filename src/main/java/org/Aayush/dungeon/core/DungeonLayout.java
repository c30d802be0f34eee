package org.Aayush.dungeon.core;

import lombok.Value;
import org.Aayush.dungeon.graph.SpanningTree;
import org.Aayush.dungeon.grid.GridSnapshot;
import org.Aayush.dungeon.path.StairStructure;
import org.Aayush.dungeon.room.Room;
import org.Aayush.dungeon.room.RoomCell;
import org.Aayush.dungeon.room.RoomProperties;
import org.Aayush.dungeon.room.RoomType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Final artifact of a generation run.
 *
 * <p>{@code rooms}, {@code roomProperties} and {@code roomCells} are aligned by room index.</p>
 */
@Value
public class DungeonLayout {
    long seed;
    GridSnapshot grid;
    List<Room> rooms;
    List<RoomProperties> roomProperties;
    List<List<RoomCell>> roomCells;
    SpanningTree edges;
    List<CorridorPath> corridors;
    DirectionMap directions;
    GenerationDiagnostics diagnostics;

    public Optional<Room> roomOfType(RoomType type) {
        for (int i = 0; i < rooms.size(); i++) {
            if (roomProperties.get(i).getType() == type) {
                return Optional.of(rooms.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Every staircase in corridor order.
     */
    public List<StairStructure> stairs() {
        List<StairStructure> all = new ArrayList<>();
        for (CorridorPath corridor : corridors) {
            all.addAll(corridor.getStairs());
        }
        return all;
    }

    public List<RoomCell> entrances(int roomIndex) {
        List<RoomCell> result = new ArrayList<>();
        for (RoomCell cell : roomCells.get(roomIndex)) {
            if (cell.isEntrance()) {
                result.add(cell);
            }
        }
        return result;
    }
}
