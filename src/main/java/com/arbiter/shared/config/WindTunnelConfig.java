package com.arbiter.shared.config;

import java.time.Duration;

/**
 * Limits for the single-model wind tunnel path. {@code assumedResponseTokens}
 * only feeds the advisory progress estimate.
 */
public record WindTunnelConfig(int maxTokens, Duration timeout, int assumedResponseTokens) {

    public static WindTunnelConfig defaults() {
        return new WindTunnelConfig(1024, Duration.ofSeconds(60), 400);
    }
}
