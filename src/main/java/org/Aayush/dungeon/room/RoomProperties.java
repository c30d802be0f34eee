package org.Aayush.dungeon.room;

import lombok.Builder;
import lombok.Value;

/**
 * Gameplay metadata attached to a room after corridors are carved.
 */
@Value
@Builder(toBuilder = true)
public class RoomProperties {
    @Builder.Default
    RoomType type = RoomType.NORMAL;
    boolean enemies;
    boolean itemChest;
    boolean merchant;
    boolean boss;

    public static RoomProperties normal() {
        return RoomProperties.builder().build();
    }
}
