package org.Aayush.dungeon.search;

/**
 * Thrown when attempting to dequeue from an empty SearchQueue.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
