package com.arbiter.providers;

/**
 * Uniform result of one adapter call. Token counts are estimates unless the
 * backend reported exact usage.
 */
public record CompletionResult(
    String content,
    int inputTokens,
    int outputTokens,
    long ttftMs,
    long totalMs,
    double tokensPerSecond
) {
    public static double throughput(int outputTokens, long totalMs) {
        return totalMs > 0 ? Math.round(outputTokens / (totalMs / 1000.0)) : 0;
    }
}
