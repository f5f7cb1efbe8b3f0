package com.arbiter.orchestration;

import com.arbiter.observability.CostStats;
import com.arbiter.routing.RoutingDecision;
import com.fasterxml.jackson.annotation.JsonInclude;

public record CompletionResponse(
    String content,
    String modelId,
    String modelName,
    CostStats costStats,
    boolean wasTrimmed,
    @JsonInclude(JsonInclude.Include.NON_NULL) RoutingDecision routingDecision
) {}
