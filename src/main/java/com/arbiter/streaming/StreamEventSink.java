package com.arbiter.streaming;

@FunctionalInterface
public interface StreamEventSink {
    void emit(StreamEvent event);
}
