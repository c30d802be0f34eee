package org.Aayush.dungeon.core;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.Aayush.dungeon.grid.Direction;
import org.Aayush.dungeon.grid.DirectionSet;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridView;

import java.util.Map;
import java.util.TreeMap;

/**
 * Open directions recorded on every path cell, keyed by linear cell index.
 *
 * <p>A step from {@code a} to {@code b} opens its heading at {@code a} and the opposite heading
 * at {@code b}, so two cells are linked only when both sides agree.</p>
 */
public final class DirectionMap {
    private final GridView layout;
    private final Int2IntOpenHashMap masks = new Int2IntOpenHashMap();

    DirectionMap(GridView layout) {
        this.layout = layout;
        masks.defaultReturnValue(0);
    }

    void open(GridCoordinate cell, Direction direction) {
        int index = layout.index(cell);
        masks.put(index, DirectionSet.fromMask(masks.get(index)).with(direction).mask());
    }

    /**
     * Records the step {@code from -> to} on both cells. Pure vertical steps are ignored.
     */
    void link(GridCoordinate from, GridCoordinate to) {
        Direction heading = Direction.headingOf(from, to);
        if (heading == null) {
            return;
        }
        open(from, heading);
        open(to, heading.opposite());
    }

    public DirectionSet at(GridCoordinate cell) {
        if (!layout.inBounds(cell)) {
            return DirectionSet.empty();
        }
        return DirectionSet.fromMask(masks.get(layout.index(cell)));
    }

    public boolean isLinked(GridCoordinate from, GridCoordinate to) {
        Direction heading = Direction.headingOf(from, to);
        return heading != null && at(from).contains(heading) && at(to).contains(heading.opposite());
    }

    public int size() {
        return masks.size();
    }

    /**
     * Sorted copy for reporting and equality checks.
     */
    public Map<GridCoordinate, DirectionSet> asMap() {
        Map<GridCoordinate, DirectionSet> result = new TreeMap<>();
        for (Int2IntMap.Entry entry : masks.int2IntEntrySet()) {
            result.put(layout.coordinateOf(entry.getIntKey()), DirectionSet.fromMask(entry.getIntValue()));
        }
        return result;
    }
}
