package com.arbiter.routing;

import com.arbiter.providers.ModelCatalog;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class RouteTable {

    private static final Map<Route, String> MODELS = new EnumMap<>(Route.class);

    static {
        MODELS.put(Route.ULTRA_FAST, "meta-llama/llama-4-maverick:groq");
        MODELS.put(Route.FAST, "moonshotai/kimi-k2");
        MODELS.put(Route.PREMIUM, "anthropic/claude-sonnet-4.5");
        MODELS.put(Route.CODE, "deepseek/deepseek-chat");
    }

    private RouteTable() {}

    public static String modelFor(Route route) {
        return MODELS.get(route);
    }

    public static Route forScore(int score) {
        if (score <= 0) return Route.ULTRA_FAST;
        if (score <= 2) return Route.FAST;
        return Route.PREMIUM;
    }

    static RoutingDecision decide(Route route, int score, List<String> signals) {
        var modelId = modelFor(route);
        return new RoutingDecision(modelId, ModelCatalog.displayName(modelId), route, route.label(), score, signals);
    }
}
