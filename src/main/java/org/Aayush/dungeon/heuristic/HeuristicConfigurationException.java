package org.Aayush.dungeon.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised by {@link HeuristicFactory} when a provider cannot be built.
 *
 * <p>The message reads {@code [REASON] detail}. {@link #heuristicType()} names the mode being
 * configured, or is {@code null} when the type itself was missing.</p>
 */
@Getter
@Accessors(fluent = true)
public final class HeuristicConfigurationException extends RuntimeException {
    private final String reasonCode;
    private final HeuristicType heuristicType;

    public HeuristicConfigurationException(String reasonCode, String message) {
        this(reasonCode, null, message);
    }

    /**
     * @param reasonCode non-blank {@code DG_HEURISTIC_*} code.
     * @param heuristicType mode that failed, may be {@code null}.
     * @param message detail appended after the code.
     */
    public HeuristicConfigurationException(String reasonCode, HeuristicType heuristicType, String message) {
        super(prefixed(reasonCode, message));
        this.reasonCode = reasonCode;
        this.heuristicType = heuristicType;
    }

    private static String prefixed(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }
}
