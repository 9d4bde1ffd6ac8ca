package org.Aayush.astar.search;

/**
 * Thrown when reading or removing the minimum of an empty {@link SearchQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
