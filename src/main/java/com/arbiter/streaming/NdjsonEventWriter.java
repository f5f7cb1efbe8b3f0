package com.arbiter.streaming;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes one JSON object per line and flushes after each, so the caller sees
 * tokens as they arrive.
 */
public class NdjsonEventWriter implements StreamEventSink {

    private static final byte[] NEWLINE = {'\n'};

    private final OutputStream out;
    private final ObjectMapper mapper;

    public NdjsonEventWriter(OutputStream out, ObjectMapper mapper) {
        this.out = out;
        this.mapper = mapper;
    }

    @Override
    public void emit(StreamEvent event) {
        try {
            out.write(mapper.writeValueAsBytes(event));
            out.write(NEWLINE);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + event.type() + " event", e);
        }
    }
}
