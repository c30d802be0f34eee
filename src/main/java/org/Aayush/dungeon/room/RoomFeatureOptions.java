package org.Aayush.dungeon.room;

import lombok.Builder;
import lombok.Value;

/**
 * Spawn chances (percent, clamped to 0..100) and toggles for {@link RoomPropertyAssigner}.
 */
@Value
@Builder(toBuilder = true)
public class RoomFeatureOptions {
    @Builder.Default
    int enemyChance = 50;
    @Builder.Default
    int itemChestChance = 30;
    boolean merchant;
    boolean boss;

    public static RoomFeatureOptions defaults() {
        return RoomFeatureOptions.builder().build();
    }

    int clampedEnemyChance() {
        return clamp(enemyChance);
    }

    int clampedItemChestChance() {
        return clamp(itemChestChance);
    }

    private static int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }
}
