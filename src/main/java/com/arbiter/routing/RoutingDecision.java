package com.arbiter.routing;

import java.util.List;

/**
 * Outcome of classifying one query. {@code signals} follow evaluation order.
 */
public record RoutingDecision(
    String modelId,
    String modelName,
    Route route,
    String routeLabel,
    int score,
    List<String> signals
) {
    public RoutingDecision {
        signals = List.copyOf(signals);
    }
}
