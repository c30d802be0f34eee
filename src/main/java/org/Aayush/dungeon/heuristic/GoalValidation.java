package org.Aayush.dungeon.heuristic;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Objects;

/**
 * Shared goal bound checks for heuristic providers.
 */
@UtilityClass
class GoalValidation {

    static void requireInside(GridView grid, GridCoordinate goal) {
        Objects.requireNonNull(goal, "goal");
        if (!grid.inBounds(goal)) {
            throw new IllegalArgumentException(
                    "goal out of bounds: " + goal + " [" + grid.sizeX() + "x" + grid.sizeY() + "x" + grid.sizeZ() + "]"
            );
        }
    }
}
