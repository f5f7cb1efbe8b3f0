package com.arbiter.observability;

/**
 * Per-call cost figures. {@code saved} compares against running the same token
 * counts on the baseline model.
 */
public record CostStats(
    int inputTokens,
    int outputTokens,
    long ttftMs,
    long totalMs,
    double tokensPerSecond,
    double cost,
    double baselineCost,
    double saved,
    double savedPercent
) {}
