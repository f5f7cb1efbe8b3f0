package com.arbiter.streaming;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Incremental delta. {@code progress} is advisory only: the running count over an
 * assumed response length, capped below 1 until the stream completes. It is for
 * in-process sinks and is never serialized.
 */
@JsonPropertyOrder({"type", "content", "tokenCount", "elapsed"})
public record TokenEvent(String content, int tokenCount, long elapsed, @JsonIgnore double progress)
        implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "token";
    }
}
