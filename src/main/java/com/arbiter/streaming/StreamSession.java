package com.arbiter.streaming;

/**
 * Per-request state machine: OPEN, then any number of tokens, then exactly one
 * terminal event. Nothing may be emitted after the terminal event.
 *
 * <p>A sink that throws ends the session in ERROR and the failure propagates; no
 * further event is attempted on it.
 *
 * <p>Each {@link TokenEvent} carries an advisory {@code progress}: tokens so far over
 * {@code assumedResponseTokens}, capped at {@link #MAX_PROGRESS}. In-process sinks
 * can read it from the event; it is not part of the NDJSON or WebSocket wire format.
 */
public class StreamSession {

    public enum State { OPEN, STREAMING, COMPLETE, ERROR }

    static final double MAX_PROGRESS = 0.95;

    private final StreamEventSink sink;
    private final int assumedResponseTokens;
    private State state = State.OPEN;
    private int tokenCount;

    public StreamSession(StreamEventSink sink, int assumedResponseTokens) {
        this.sink = sink;
        this.assumedResponseTokens = Math.max(1, assumedResponseTokens);
    }

    public synchronized State state() {
        return state;
    }

    public synchronized int tokenCount() {
        return tokenCount;
    }

    public synchronized void token(String delta, long elapsedMs) {
        requireOpen("token");
        state = State.STREAMING;
        tokenCount++;
        double progress = Math.min(MAX_PROGRESS, (double) tokenCount / assumedResponseTokens);
        emit(new TokenEvent(delta, tokenCount, elapsedMs, progress));
    }

    /** {@code content} is the full accumulated answer, not a join of the deltas sent. */
    public synchronized void complete(String content, int inputTokens, int outputTokens, long latencyMs, double cost) {
        requireOpen("complete");
        state = State.COMPLETE;
        emit(new CompleteEvent(content, inputTokens, outputTokens, latencyMs, cost));
    }

    public synchronized void fail(String error) {
        requireOpen("error");
        state = State.ERROR;
        emit(new ErrorEvent(error));
    }

    public synchronized boolean isTerminated() {
        return state == State.COMPLETE || state == State.ERROR;
    }

    private void emit(StreamEvent event) {
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            state = State.ERROR;
            throw e;
        }
    }

    private void requireOpen(String event) {
        if (isTerminated()) {
            throw new IllegalStateException("Cannot emit " + event + " after " + state);
        }
    }
}
