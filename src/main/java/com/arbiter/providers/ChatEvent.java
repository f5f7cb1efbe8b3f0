package com.arbiter.providers;

/**
 * A content-bearing delta observed on a backend stream.
 *
 * @param delta      text appended by this chunk
 * @param firstToken true for the first content-bearing chunk of the call
 * @param elapsedMs  wall-clock time since dispatch
 */
public record ChatEvent(String delta, boolean firstToken, long elapsedMs) {}
