package org.Aayush.dungeon.path;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate step offsets.
 *
 * <p>Flat moves are the four horizontal unit steps. Staircase moves advance three cells
 * horizontally while changing one level; only the ones heading toward the goal level are offered.</p>
 */
@UtilityClass
public final class MoveSet {
    public static final int STAIR_RUN = 3;

    static final GridCoordinate[] FLAT = {
            new GridCoordinate(1, 0, 0),
            new GridCoordinate(-1, 0, 0),
            new GridCoordinate(0, 0, 1),
            new GridCoordinate(0, 0, -1)
    };

    static final GridCoordinate[] STAIRS_UP = {
            new GridCoordinate(STAIR_RUN, 1, 0),
            new GridCoordinate(-STAIR_RUN, 1, 0),
            new GridCoordinate(0, 1, STAIR_RUN),
            new GridCoordinate(0, 1, -STAIR_RUN)
    };

    static final GridCoordinate[] STAIRS_DOWN = {
            new GridCoordinate(STAIR_RUN, -1, 0),
            new GridCoordinate(-STAIR_RUN, -1, 0),
            new GridCoordinate(0, -1, STAIR_RUN),
            new GridCoordinate(0, -1, -STAIR_RUN)
    };

    /**
     * Offsets available at {@code current} when heading for {@code goal}, in canonical order:
     * flat moves first, then the staircases toward the goal level.
     */
    public static List<GridCoordinate> candidates(GridCoordinate current, GridCoordinate goal) {
        List<GridCoordinate> result = new ArrayList<>(FLAT.length + STAIRS_UP.length);
        for (GridCoordinate offset : FLAT) {
            result.add(offset);
        }
        if (current.y() < goal.y()) {
            for (GridCoordinate offset : STAIRS_UP) {
                result.add(offset);
            }
        } else if (current.y() > goal.y()) {
            for (GridCoordinate offset : STAIRS_DOWN) {
                result.add(offset);
            }
        }
        return result;
    }

    /**
     * True when a level change is still outstanding.
     */
    public static boolean needsStairs(GridCoordinate current, GridCoordinate goal) {
        return current.y() != goal.y();
    }

    public static boolean isStairOffset(GridCoordinate offset) {
        if (Math.abs(offset.y()) != 1) {
            return false;
        }
        int ax = Math.abs(offset.x());
        int az = Math.abs(offset.z());
        return (ax == STAIR_RUN && az == 0) || (ax == 0 && az == STAIR_RUN);
    }

    public static boolean isFlatOffset(GridCoordinate offset) {
        return offset.y() == 0 && Math.abs(offset.x()) + Math.abs(offset.z()) == 1;
    }
}
