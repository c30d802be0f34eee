package org.Aayush.dungeon.room;

/**
 * Gameplay role of a room.
 */
public enum RoomType {
    START,
    EXIT,
    NORMAL
}
