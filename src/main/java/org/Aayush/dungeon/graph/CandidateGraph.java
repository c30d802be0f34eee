package org.Aayush.dungeon.graph;

import org.Aayush.dungeon.room.Room;

import java.util.List;

/**
 * Proposes the edges the spanning tree may choose from.
 *
 * <p>Implementations must be deterministic for a fixed room list: the returned order is the
 * tie-break order for tree selection and the iteration order for cycle injection.</p>
 */
@FunctionalInterface
public interface CandidateGraph {

    List<RoomEdge> edges(List<Room> rooms);
}
