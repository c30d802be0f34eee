package org.Aayush.dungeon.graph;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Edges selected for carving, grouped by how they were chosen.
 */
@Value
public class SpanningTree {
    /** Minimum spanning tree edges in selection order. */
    List<RoomEdge> treeEdges;
    /** Synthetic edges that joined rooms the candidate graph left disconnected. */
    List<RoomEdge> repairEdges;
    /** Extra non-tree edges kept to form loops. */
    List<RoomEdge> cycleEdges;

    /**
     * Carving order: tree edges, then repairs, then cycle edges.
     */
    public List<RoomEdge> selectedEdges() {
        List<RoomEdge> all = new ArrayList<>(treeEdges.size() + repairEdges.size() + cycleEdges.size());
        all.addAll(treeEdges);
        all.addAll(repairEdges);
        all.addAll(cycleEdges);
        return Collections.unmodifiableList(all);
    }

    public boolean isRepaired() {
        return !repairEdges.isEmpty();
    }
}
