package org.Aayush.dungeon.graph;

import org.Aayush.dungeon.room.Room;

import java.util.ArrayList;
import java.util.List;

/**
 * Every pair of rooms, {@code (i, j)} with {@code i < j} in lexicographic order, weighted by
 * center distance.
 */
public final class CompleteCandidateGraph implements CandidateGraph {

    @Override
    public List<RoomEdge> edges(List<Room> rooms) {
        int n = rooms.size();
        List<RoomEdge> edges = new ArrayList<>(n * (n - 1) / 2);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                edges.add(new RoomEdge(
                        rooms.get(i).index(),
                        rooms.get(j).index(),
                        rooms.get(i).centerDistance(rooms.get(j))
                ));
            }
        }
        return edges;
    }
}
