package com.arbiter.orchestration;

import com.arbiter.observability.CostStats;
import com.arbiter.providers.CompletionResult;
import com.arbiter.providers.CompletionTimeoutException;
import com.arbiter.providers.FailureKind;

/**
 * One roster slot of a fan-out batch. Exactly one of {@code result} and
 * {@code error} is non-null.
 */
public record FanOutEntry(
    String backendId,
    String modelName,
    CompletionResult result,
    CostStats costStats,
    String error,
    FailureKind failureKind
) {
    public static FanOutEntry success(String backendId, String modelName, CompletionResult result, CostStats costStats) {
        return new FanOutEntry(backendId, modelName, result, costStats, null, null);
    }

    public static FanOutEntry failure(String backendId, String modelName, String error, FailureKind kind) {
        return new FanOutEntry(backendId, modelName, null, null, error, kind);
    }

    public boolean succeeded() {
        return result != null;
    }

    public String displayContent() {
        if (succeeded()) return result.content();
        if (failureKind == FailureKind.TIMEOUT) return CompletionTimeoutException.USER_MESSAGE;
        return "Error: " + error;
    }
}
