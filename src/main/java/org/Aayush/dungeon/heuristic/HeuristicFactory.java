package org.Aayush.dungeon.heuristic;

import lombok.experimental.UtilityClass;
import org.Aayush.dungeon.grid.GridView;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes validation so every provider is created against a grid with the
 * same deterministic failure reason codes.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "DG_HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_GRID_REQUIRED = "DG_HEURISTIC_GRID_REQUIRED";
    public static final String REASON_VERTICAL_WEIGHT_INVALID = "DG_HEURISTIC_VERTICAL_WEIGHT_INVALID";
    public static final String REASON_LEVEL_MULTIPLIER_INVALID = "DG_HEURISTIC_LEVEL_MULTIPLIER_INVALID";

    /**
     * Creates a provider with default stair weighting.
     */
    public static HeuristicProvider create(HeuristicType type, GridView grid) {
        return create(
                type,
                grid,
                StairAwareHeuristicProvider.DEFAULT_VERTICAL_WEIGHT,
                StairAwareHeuristicProvider.DEFAULT_LEVEL_CHANGE_MULTIPLIER
        );
    }

    /**
     * Creates a heuristic provider.
     *
     * @param type requested heuristic type.
     * @param grid grid the searches run on.
     * @param verticalWeight per-level weight (STAIR_AWARE only).
     * @param levelChangeMultiplier outstanding-level multiplier (STAIR_AWARE only).
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(
            HeuristicType type,
            GridView grid,
            double verticalWeight,
            double levelChangeMultiplier
    ) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, EUCLIDEAN, STAIR_AWARE)"
            );
        }
        if (grid == null) {
            throw new HeuristicConfigurationException(REASON_GRID_REQUIRED, type, "grid must be provided");
        }

        return switch (type) {
            case NONE -> new NullHeuristicProvider(grid);
            case EUCLIDEAN -> new EuclideanHeuristicProvider(grid);
            case STAIR_AWARE -> createStairAware(grid, verticalWeight, levelChangeMultiplier);
        };
    }

    /**
     * Picks the default mode for a grid: Euclidean on one level, stair-aware otherwise.
     */
    public static HeuristicType defaultTypeFor(GridView grid) {
        return grid.isPlanar() ? HeuristicType.EUCLIDEAN : HeuristicType.STAIR_AWARE;
    }

    private static HeuristicProvider createStairAware(GridView grid, double verticalWeight, double levelChangeMultiplier) {
        if (!Double.isFinite(verticalWeight) || verticalWeight < 0.0d) {
            throw new HeuristicConfigurationException(
                    REASON_VERTICAL_WEIGHT_INVALID,
                    HeuristicType.STAIR_AWARE,
                    "verticalWeight must be finite and >= 0, got " + verticalWeight
            );
        }
        if (!Double.isFinite(levelChangeMultiplier) || levelChangeMultiplier < 1.0d) {
            throw new HeuristicConfigurationException(
                    REASON_LEVEL_MULTIPLIER_INVALID,
                    HeuristicType.STAIR_AWARE,
                    "levelChangeMultiplier must be finite and >= 1, got " + levelChangeMultiplier
            );
        }
        return new StairAwareHeuristicProvider(grid, verticalWeight, levelChangeMultiplier);
    }
}
