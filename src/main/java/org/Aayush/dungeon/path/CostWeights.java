package org.Aayush.dungeon.path;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for {@link CorridorCostPolicy} and the pathfinder's transition penalty.
 */
@Value
@Builder(toBuilder = true)
public class CostWeights {
    /** Added when the destination is a room cell. */
    double roomCost;
    /** Added when the destination is empty space. */
    double emptyCost;
    /** Added when the destination is an existing corridor. */
    double corridorCost;
    /** Base price of one staircase. */
    double stairCost;
    /** Whether a staircase landing needs empty space one step beyond it. */
    boolean stairClearance;
    /** Room-corridor transition penalty as a multiple of the step cost. */
    double roomTransitionMultiplier;

    /**
     * Single-level defaults: rooms are expensive to cross, existing corridors cheap to reuse.
     */
    public static CostWeights planar() {
        return CostWeights.builder()
                .roomCost(10.0d)
                .emptyCost(5.0d)
                .corridorCost(1.0d)
                .stairCost(100.0d)
                .stairClearance(true)
                .roomTransitionMultiplier(2.0d)
                .build();
    }

    /**
     * Multi-level defaults.
     */
    public static CostWeights volumetric() {
        return CostWeights.builder()
                .roomCost(5.0d)
                .emptyCost(1.0d)
                .corridorCost(0.0d)
                .stairCost(100.0d)
                .stairClearance(true)
                .roomTransitionMultiplier(2.0d)
                .build();
    }

    /**
     * Returns the reason a weight is invalid, or {@code null} when all are usable.
     */
    public String validationError() {
        if (!nonNegative(roomCost)) return "roomCost must be finite and >= 0, got " + roomCost;
        if (!nonNegative(emptyCost)) return "emptyCost must be finite and >= 0, got " + emptyCost;
        if (!nonNegative(corridorCost)) return "corridorCost must be finite and >= 0, got " + corridorCost;
        if (!nonNegative(stairCost)) return "stairCost must be finite and >= 0, got " + stairCost;
        if (!nonNegative(roomTransitionMultiplier)) {
            return "roomTransitionMultiplier must be finite and >= 0, got " + roomTransitionMultiplier;
        }
        return null;
    }

    private static boolean nonNegative(double value) {
        return Double.isFinite(value) && value >= 0.0d;
    }
}
