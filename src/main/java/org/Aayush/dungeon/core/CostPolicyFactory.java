package org.Aayush.dungeon.core;

import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.grid.GridSnapshot;
import org.Aayush.dungeon.path.CorridorCostPolicy;
import org.Aayush.dungeon.path.CostPolicy;
import org.Aayush.dungeon.path.CostWeights;

/**
 * Builds the movement rules for one corridor search.
 */
@FunctionalInterface
public interface CostPolicyFactory {

    /**
     * @param snapshot cells carved before this edge.
     * @param goal search goal of this edge.
     */
    CostPolicy create(GridSnapshot snapshot, GridCoordinate goal);

    static CostPolicyFactory corridors(CostWeights weights) {
        return (snapshot, goal) -> new CorridorCostPolicy(snapshot, goal, weights);
    }
}
