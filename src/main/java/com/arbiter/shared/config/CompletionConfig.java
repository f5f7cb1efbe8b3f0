package com.arbiter.shared.config;

import java.time.Duration;

public record CompletionConfig(int defaultMaxTokens, Duration defaultTimeout, int contextBudget) {

    public static CompletionConfig defaults() {
        return new CompletionConfig(4096, Duration.ofSeconds(90), 8000);
    }
}
