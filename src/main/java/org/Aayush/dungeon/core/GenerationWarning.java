package org.Aayush.dungeon.core;

/**
 * Non-fatal condition reported by a run.
 *
 * @param kind category.
 * @param message human readable detail.
 */
public record GenerationWarning(Kind kind, String message) {

    public enum Kind {
        /** Fewer rooms placed than requested. */
        ROOM_SHORTFALL,
        /** A room had to be joined by a synthetic edge. */
        CONNECTIVITY_REPAIR,
        /** No corridor could be carved for a selected edge. */
        PATH_NOT_FOUND
    }
}
