package org.Aayush.dungeon.core;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.room.Room;

/**
 * Picks the floor-level boundary cells a corridor starts and ends on.
 *
 * <p>Room centers are truncated to integers and placed on the room's floor level.</p>
 */
@UtilityClass
class RoomAnchors {

    /**
     * Boundary cell of {@code room} on the face pointing at {@code target} along the dominant
     * horizontal axis. Ties go to the z faces.
     */
    static GridCoordinate start(Room room, Room target) {
        GridCoordinate center = anchorCenter(room);
        GridCoordinate toward = anchorCenter(target).minus(center);
        int floor = room.floorLevel();
        if (Math.abs(toward.x()) > Math.abs(toward.z())) {
            int x = toward.x() > 0 ? room.bounds().maxX() - 1 : room.bounds().minX();
            return new GridCoordinate(x, floor, center.z());
        }
        int z = toward.z() > 0 ? room.bounds().maxZ() - 1 : room.bounds().minZ();
        return new GridCoordinate(center.x(), floor, z);
    }

    /**
     * Floor-level boundary cell of {@code room} closest to {@code other}'s anchor center.
     * The x faces are scanned before the z faces; the first minimum wins.
     */
    static GridCoordinate end(Room room, Room other) {
        GridCoordinate target = anchorCenter(other);
        int floor = room.floorLevel();
        GridCoordinate best = null;
        double bestDistance = Double.MAX_VALUE;

        int[] xFaces = {room.bounds().minX(), room.bounds().maxX() - 1};
        for (int x : xFaces) {
            for (int z = room.bounds().minZ(); z < room.bounds().maxZ(); z++) {
                GridCoordinate cell = new GridCoordinate(x, floor, z);
                double distance = cell.distanceTo(target);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = cell;
                }
            }
        }
        int[] zFaces = {room.bounds().minZ(), room.bounds().maxZ() - 1};
        for (int z : zFaces) {
            for (int x = room.bounds().minX(); x < room.bounds().maxX(); x++) {
                GridCoordinate cell = new GridCoordinate(x, floor, z);
                double distance = cell.distanceTo(target);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = cell;
                }
            }
        }
        return best;
    }

    static GridCoordinate anchorCenter(Room room) {
        return new GridCoordinate(
                (int) room.bounds().centerX(),
                room.floorLevel(),
                (int) room.bounds().centerZ()
        );
    }
}
