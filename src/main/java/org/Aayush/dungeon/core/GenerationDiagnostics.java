package org.Aayush.dungeon.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.dungeon.graph.RoomEdge;

import java.util.List;

/**
 * Run statistics and every non-fatal warning raised.
 */
@Value
@Builder
public class GenerationDiagnostics {
    @Singular
    List<GenerationWarning> warnings;
    /** Selected edges for which no corridor was found. */
    @Singular
    List<RoomEdge> unreachableEdges;
    int requestedRooms;
    int placementAttempts;
    /** Staircases carved across all corridors. */
    int stairCount;
    /** Settled nodes summed over every corridor search. */
    long settledNodes;
    long elapsedNanos;

    public long count(GenerationWarning.Kind kind) {
        return warnings.stream().filter(w -> w.kind() == kind).count();
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
