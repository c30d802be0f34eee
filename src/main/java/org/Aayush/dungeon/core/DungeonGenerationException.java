package org.Aayush.dungeon.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Fatal generation failure: invalid configuration or a broken carving invariant.
 *
 * <p>Messages start with {@code [REASON]}; callers branch on {@link #reasonCode()}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DungeonGenerationException extends RuntimeException {
    public static final String REASON_CONFIG_REQUIRED = "DG_CONFIG_REQUIRED";
    public static final String REASON_CONFIG_EXTENT = "DG_CONFIG_EXTENT";
    public static final String REASON_CONFIG_ROOM_COUNT = "DG_CONFIG_ROOM_COUNT";
    public static final String REASON_CONFIG_ATTEMPTS = "DG_CONFIG_ATTEMPTS";
    public static final String REASON_CONFIG_ROOM_SIZE = "DG_CONFIG_ROOM_SIZE";
    public static final String REASON_CONFIG_MARGIN = "DG_CONFIG_MARGIN";
    public static final String REASON_CONFIG_PROBABILITY = "DG_CONFIG_PROBABILITY";
    public static final String REASON_CONFIG_WEIGHTS = "DG_CONFIG_WEIGHTS";
    public static final String REASON_CONFIG_PROPERTY = "DG_CONFIG_PROPERTY";
    public static final String REASON_ROOM_LAYOUT = "DG_ROOM_LAYOUT_INVALID";
    public static final String REASON_STAIR_OVERLAP = "DG_STAIR_OVERLAP";

    private final String reasonCode;

    public DungeonGenerationException(String reasonCode, String message) {
        super(prefixed(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    public DungeonGenerationException(String reasonCode, String message, Throwable cause) {
        super(prefixed(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    private static String prefixed(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }
}
