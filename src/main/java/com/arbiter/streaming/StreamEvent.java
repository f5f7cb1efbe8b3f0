package com.arbiter.streaming;

/**
 * One record of the newline-delimited stream. Every stream ends with exactly one
 * {@link CompleteEvent} or {@link ErrorEvent}.
 */
public interface StreamEvent {
    String type();

    default boolean terminal() {
        return false;
    }
}
