package org.Aayush.dungeon.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dungeon.grid.GridCoordinate;
import org.Aayush.dungeon.heuristic.HeuristicType;
import org.Aayush.dungeon.path.CostWeights;
import org.Aayush.dungeon.path.SearchBudget;
import org.Aayush.dungeon.room.PlacementOptions;
import org.Aayush.dungeon.room.RoomFeatureOptions;

import java.util.Locale;

/**
 * Immutable input of one generation run.
 *
 * <p>Planar dungeons are configs with {@code sizeY == 1} and room height 1.</p>
 */
@Value
@Builder(toBuilder = true)
public class DungeonConfig {
    public static final String PROP_SEED = "dungeon.seed";
    public static final String PROP_SIZE = "dungeon.size";
    public static final String PROP_ROOM_COUNT = "dungeon.roomCount";
    public static final String PROP_MAX_ATTEMPTS = "dungeon.maxAttempts";
    public static final String PROP_EXTRA_EDGE_PROBABILITY = "dungeon.extraEdgeProbability";
    public static final String PROP_HEURISTIC = "dungeon.heuristic";
    public static final String PROP_MAX_SETTLED = "dungeon.search.maxSettledNodes";

    int sizeX;
    int sizeY;
    int sizeZ;
    int roomCount;
    int maxAttempts;
    GridCoordinate minRoomSize;
    GridCoordinate maxRoomSize;
    GridCoordinate bufferMargin;
    long seed;
    /** Chance that a non-tree candidate edge is also carved. */
    double extraEdgeProbability;
    CostWeights costWeights;
    /** {@code null} selects Euclidean for planar grids and stair-aware otherwise. */
    HeuristicType heuristicType;
    /** Settled-node bound per corridor search; non-positive means unbounded. */
    int maxSettledNodes;
    @Builder.Default
    RoomFeatureOptions features = RoomFeatureOptions.defaults();

    /**
     * Single-level defaults.
     */
    public static DungeonConfig planar() {
        return DungeonConfig.builder()
                .sizeX(30).sizeY(1).sizeZ(30)
                .roomCount(8)
                .maxAttempts(500)
                .minRoomSize(new GridCoordinate(3, 1, 3))
                .maxRoomSize(new GridCoordinate(6, 1, 6))
                .bufferMargin(new GridCoordinate(1, 0, 1))
                .seed(0L)
                .extraEdgeProbability(0.125d)
                .costWeights(CostWeights.planar())
                .build();
    }

    /**
     * Multi-level defaults.
     */
    public static DungeonConfig volumetric() {
        return DungeonConfig.builder()
                .sizeX(30).sizeY(5).sizeZ(30)
                .roomCount(6)
                .maxAttempts(500)
                .minRoomSize(new GridCoordinate(3, 1, 3))
                .maxRoomSize(new GridCoordinate(6, 2, 6))
                .bufferMargin(new GridCoordinate(2, 2, 2))
                .seed(0L)
                .extraEdgeProbability(0.05d)
                .costWeights(CostWeights.volumetric())
                .build();
    }

    public boolean isPlanar() {
        return sizeY == 1;
    }

    public PlacementOptions placementOptions() {
        return PlacementOptions.builder()
                .roomCount(roomCount)
                .maxAttempts(maxAttempts)
                .minRoomSize(minRoomSize)
                .maxRoomSize(maxRoomSize)
                .bufferMargin(bufferMargin)
                .build();
    }

    public SearchBudget searchBudget() {
        return SearchBudget.of(maxSettledNodes);
    }

    /**
     * Applies {@code dungeon.*} system properties on top of this config.
     *
     * @throws DungeonGenerationException when a set property cannot be parsed.
     */
    public DungeonConfig withSystemOverrides() {
        DungeonConfigBuilder builder = toBuilder();
        String seedValue = read(PROP_SEED);
        if (seedValue != null) {
            builder.seed(parseLong(PROP_SEED, seedValue));
        }
        String size = read(PROP_SIZE);
        if (size != null) {
            String[] parts = size.toLowerCase(Locale.ROOT).split("x");
            if (parts.length != 3) {
                throw invalidProperty(PROP_SIZE, size, "expected <x>x<y>x<z>");
            }
            builder.sizeX(parseInt(PROP_SIZE, parts[0]))
                    .sizeY(parseInt(PROP_SIZE, parts[1]))
                    .sizeZ(parseInt(PROP_SIZE, parts[2]));
        }
        String rooms = read(PROP_ROOM_COUNT);
        if (rooms != null) {
            builder.roomCount(parseInt(PROP_ROOM_COUNT, rooms));
        }
        String attempts = read(PROP_MAX_ATTEMPTS);
        if (attempts != null) {
            builder.maxAttempts(parseInt(PROP_MAX_ATTEMPTS, attempts));
        }
        String probability = read(PROP_EXTRA_EDGE_PROBABILITY);
        if (probability != null) {
            try {
                builder.extraEdgeProbability(Double.parseDouble(probability));
            } catch (NumberFormatException ex) {
                throw invalidProperty(PROP_EXTRA_EDGE_PROBABILITY, probability, ex.getMessage());
            }
        }
        String heuristic = read(PROP_HEURISTIC);
        if (heuristic != null) {
            try {
                builder.heuristicType(HeuristicType.valueOf(heuristic.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                throw invalidProperty(PROP_HEURISTIC, heuristic, "expected NONE, EUCLIDEAN or STAIR_AWARE");
            }
        }
        String settled = read(PROP_MAX_SETTLED);
        if (settled != null) {
            builder.maxSettledNodes(parseInt(PROP_MAX_SETTLED, settled));
        }
        return builder.build();
    }

    /**
     * Checks every field before any work is done.
     *
     * @throws DungeonGenerationException with a {@code DG_CONFIG_*} reason code.
     */
    public void validate() {
        if (minRoomSize == null || maxRoomSize == null || bufferMargin == null
                || costWeights == null || features == null) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_REQUIRED,
                    "minRoomSize, maxRoomSize, bufferMargin, costWeights and features must be set"
            );
        }
        if (sizeX <= 0 || sizeY <= 0 || sizeZ <= 0) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_EXTENT,
                    "grid extents must be positive: " + sizeX + "x" + sizeY + "x" + sizeZ
            );
        }
        if ((long) sizeX * sizeY * sizeZ > Integer.MAX_VALUE) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_EXTENT,
                    "grid too large: " + sizeX + "x" + sizeY + "x" + sizeZ
            );
        }
        if (roomCount < 0) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_ROOM_COUNT,
                    "roomCount must be >= 0, got " + roomCount
            );
        }
        if (maxAttempts < 0) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_ATTEMPTS,
                    "maxAttempts must be >= 0, got " + maxAttempts
            );
        }
        if (minRoomSize.x() < 1 || minRoomSize.y() < 1 || minRoomSize.z() < 1
                || maxRoomSize.x() < minRoomSize.x()
                || maxRoomSize.y() < minRoomSize.y()
                || maxRoomSize.z() < minRoomSize.z()) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_ROOM_SIZE,
                    "room sizes must satisfy 1 <= min <= max per axis, got " + minRoomSize + " .. " + maxRoomSize
            );
        }
        if (bufferMargin.x() < 0 || bufferMargin.y() < 0 || bufferMargin.z() < 0) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_MARGIN,
                    "bufferMargin must be >= 0 per axis, got " + bufferMargin
            );
        }
        if (!(extraEdgeProbability >= 0.0d && extraEdgeProbability <= 1.0d)) {
            throw new DungeonGenerationException(
                    DungeonGenerationException.REASON_CONFIG_PROBABILITY,
                    "extraEdgeProbability must be in [0, 1], got " + extraEdgeProbability
            );
        }
        String weightError = costWeights.validationError();
        if (weightError != null) {
            throw new DungeonGenerationException(DungeonGenerationException.REASON_CONFIG_WEIGHTS, weightError);
        }
    }

    private static String read(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    private static int parseInt(String property, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw invalidProperty(property, raw, ex.getMessage());
        }
    }

    private static long parseLong(String property, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw invalidProperty(property, raw, ex.getMessage());
        }
    }

    private static DungeonGenerationException invalidProperty(String property, String raw, String detail) {
        return new DungeonGenerationException(
                DungeonGenerationException.REASON_CONFIG_PROPERTY,
                property + "=" + raw + " is invalid: " + detail
        );
    }
}
