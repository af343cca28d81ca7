package org.Aayush.graphlab.search;

import java.util.NoSuchElementException;

/**
 * Thrown when peeking at or dequeuing from an empty {@link MinPriorityQueue}.
 */
public class EmptyQueueException extends NoSuchElementException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
