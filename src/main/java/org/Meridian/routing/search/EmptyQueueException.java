package org.Meridian.routing.search;

/**
 * Thrown when attempting to extract from an empty {@link MinNodeQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
