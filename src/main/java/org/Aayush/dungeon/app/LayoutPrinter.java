package org.Aayush.dungeon.app;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.core.DungeonLayout;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridSnapshot;

/**
 * Plain-text floor plans of a generated layout.
 *
 * <p>{@code .} empty, {@code #} room, {@code +} corridor, {@code =} stair. Rows are z, columns x.</p>
 */
@UtilityClass
public class LayoutPrinter {

    public static String renderLevel(DungeonLayout layout, int level) {
        GridSnapshot grid = layout.getGrid();
        if (level < 0 || level >= grid.sizeY()) {
            throw new IllegalArgumentException("level " + level + " outside [0, " + grid.sizeY() + ")");
        }
        StringBuilder out = new StringBuilder((grid.sizeX() + 1) * grid.sizeZ());
        for (int z = 0; z < grid.sizeZ(); z++) {
            for (int x = 0; x < grid.sizeX(); x++) {
                out.append(symbol(grid, new GridCoordinate(x, level, z)));
            }
            out.append('\n');
        }
        return out.toString();
    }

    public static String renderAll(DungeonLayout layout) {
        StringBuilder out = new StringBuilder();
        for (int y = 0; y < layout.getGrid().sizeY(); y++) {
            out.append("level ").append(y).append('\n').append(renderLevel(layout, y));
        }
        return out.toString();
    }

    private static char symbol(GridSnapshot grid, GridCoordinate cell) {
        return switch (grid.get(cell)) {
            case EMPTY -> '.';
            case ROOM -> '#';
            case CORRIDOR -> '+';
            case STAIR -> '=';
        };
    }
}
