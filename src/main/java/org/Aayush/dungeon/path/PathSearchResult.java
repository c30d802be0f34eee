package org.Aayush.dungeon.path;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.dungeon.grid.GridCoordinate;

import java.util.List;

/**
 * Outcome of one corridor search.
 *
 * <p>When {@code reachable=false}, {@code path} and {@code stairs} are empty and
 * {@code totalCost} is {@code +INF}.</p>
 */
@Value
@Builder
public class PathSearchResult {
    /** Whether the goal was settled. */
    boolean reachable;
    /** Accumulated cost at the goal. */
    double totalCost;
    /** Number of nodes settled before the search stopped. */
    int settledNodes;
    /** Whether the search stopped because the settled-node budget ran out. */
    boolean budgetExhausted;
    /** Cells from start to goal inclusive; consecutive cells differ by one legal move. */
    @Singular("pathCell")
    List<GridCoordinate> path;
    /** Staircases built along the path, in path order. */
    @Singular
    List<StairStructure> stairs;

    static PathSearchResult unreachable(int settledNodes, boolean budgetExhausted) {
        return PathSearchResult.builder()
                .reachable(false)
                .totalCost(Double.POSITIVE_INFINITY)
                .settledNodes(settledNodes)
                .budgetExhausted(budgetExhausted)
                .build();
    }
}
