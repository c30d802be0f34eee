package org.Aayush.dungeon.room;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Assigns start/exit roles and spawn features to placed rooms.
 *
 * <p>Draw order on the shared stream: start room rolls (enemies, chest), exit room rolls,
 * merchant room index when enabled, then enemies and chest for every remaining room in index
 * order. The start room is the one whose center lies closest to the origin; the exit room is
 * the one farthest from the start room. Ties keep the lower index.</p>
 */
@Slf4j
public final class RoomPropertyAssigner {
    private final RoomFeatureOptions options;

    public RoomPropertyAssigner(RoomFeatureOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @return properties aligned with {@code rooms} by index.
     */
    public List<RoomProperties> assign(List<Room> rooms, Random random) {
        Objects.requireNonNull(rooms, "rooms");
        Objects.requireNonNull(random, "random");
        if (rooms.isEmpty()) {
            return List.of();
        }

        List<RoomProperties.RoomPropertiesBuilder> builders = new ArrayList<>(rooms.size());
        for (int i = 0; i < rooms.size(); i++) {
            builders.add(RoomProperties.builder());
        }

        int start = closestToOrigin(rooms);
        builders.get(start).type(RoomType.START);
        roll(builders.get(start), random);

        int exit = farthestFrom(rooms, start);
        if (exit >= 0) {
            RoomProperties.RoomPropertiesBuilder exitRoom = builders.get(exit);
            exitRoom.type(RoomType.EXIT);
            roll(exitRoom, random);
            if (options.isBoss()) {
                exitRoom.boss(true).enemies(true);
            }
        }

        if (options.isMerchant()) {
            int merchant = random.nextInt(rooms.size());
            builders.get(merchant).merchant(true);
        }

        for (int i = 0; i < rooms.size(); i++) {
            if (i == start || i == exit) {
                continue;
            }
            roll(builders.get(i), random);
        }

        List<RoomProperties> result = new ArrayList<>(rooms.size());
        for (RoomProperties.RoomPropertiesBuilder builder : builders) {
            result.add(builder.build());
        }
        log.debug("room roles: start={}, exit={}", start, exit);
        return Collections.unmodifiableList(result);
    }

    private void roll(RoomProperties.RoomPropertiesBuilder builder, Random random) {
        builder.enemies(random.nextInt(100) < options.clampedEnemyChance());
        builder.itemChest(random.nextInt(100) < options.clampedItemChestChance());
    }

    private static int closestToOrigin(List<Room> rooms) {
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < rooms.size(); i++) {
            double distance = rooms.get(i).distanceFromOrigin();
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    /**
     * @return index of the room farthest from {@code start}, or -1 when there is no other room.
     */
    private static int farthestFrom(List<Room> rooms, int start) {
        int best = -1;
        double bestDistance = -1.0d;
        for (int i = 0; i < rooms.size(); i++) {
            if (i == start) {
                continue;
            }
            double distance = rooms.get(i).centerDistance(rooms.get(start));
            if (distance > bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }
}
