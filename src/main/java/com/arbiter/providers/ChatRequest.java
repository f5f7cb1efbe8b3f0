package com.arbiter.providers;

import com.arbiter.shared.model.Message;

import java.time.Duration;
import java.util.List;

/**
 * One adapter invocation. {@code model} is the backend-native model name.
 */
public record ChatRequest(
    String model,
    List<Message> messages,
    int maxTokens,
    Duration timeout
) {
    public ChatRequest {
        messages = List.copyOf(messages);
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens must be positive");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
