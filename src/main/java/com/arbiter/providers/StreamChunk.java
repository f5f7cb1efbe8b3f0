package com.arbiter.providers;

/**
 * Normalized view of one decoded stream event. Usage fields are null unless the
 * backend reported them in this event.
 */
public record StreamChunk(String delta, Integer inputTokens, Integer outputTokens) {

    public static final StreamChunk EMPTY = new StreamChunk("", null, null);

    public static StreamChunk text(String delta) {
        return new StreamChunk(delta, null, null);
    }

    public boolean hasContent() {
        return delta != null && !delta.isEmpty();
    }
}
