package com.arbiter.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "content", "inputTokens", "outputTokens", "latency", "cost"})
public record CompleteEvent(String content, int inputTokens, int outputTokens, long latency, double cost)
        implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "complete";
    }

    @Override
    public boolean terminal() {
        return true;
    }
}
