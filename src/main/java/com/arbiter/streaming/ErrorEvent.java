package com.arbiter.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "error"})
public record ErrorEvent(String error) implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "error";
    }

    @Override
    public boolean terminal() {
        return true;
    }
}
