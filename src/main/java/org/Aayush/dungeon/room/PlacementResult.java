package org.Aayush.dungeon.room;

import lombok.Value;

import java.util.List;

/**
 * Rooms accepted by one placement pass.
 */
@Value
public class PlacementResult {
    List<Room> rooms;
    int requested;
    int attempts;

    public boolean isShortfall() {
        return rooms.size() < requested;
    }
}
