package com.arbiter.observability;

import com.arbiter.providers.CompletionResult;

import java.util.Map;

public final class CostCalculator {

    public static final String BASELINE_MODEL = "anthropic/claude-sonnet-4.5";

    // price per 1M tokens (USD): {input, output}
    private static final Map<String, double[]> PRICING = Map.ofEntries(
            Map.entry("anthropic/claude-sonnet-4.5", new double[]{3.0, 15.0}),
            Map.entry("meta-llama/llama-3.3-70b-instruct:cerebras", new double[]{0.6, 0.6}),
            Map.entry("meta-llama/llama-4-maverick:groq", new double[]{0.11, 0.34}),
            Map.entry("deepseek/deepseek-chat", new double[]{0.14, 0.56}),
            Map.entry("minimax/minimax-m2", new double[]{0.30, 1.20}),
            Map.entry("moonshotai/kimi-k2", new double[]{0.14, 2.49}),
            Map.entry("qwen/qwen-2.5-72b-instruct", new double[]{0.27, 0.27}),
            Map.entry("z-ai/glm-4-32b", new double[]{0.10, 0.10}),
            Map.entry("together/qwen-2.5-3b-instruct", new double[]{0.06, 0.06}),
            Map.entry("together/qwen-2.5-7b-instruct-turbo", new double[]{0.30, 0.30}),
            Map.entry("together/qwen-2.5-14b-instruct", new double[]{0.18, 0.18}),
            Map.entry("together/deepseek-r1-distill-llama-70b", new double[]{2.0, 2.0}),
            Map.entry("together/deepseek-r1", new double[]{3.0, 7.0}),
            Map.entry("together/qwq-32b", new double[]{1.2, 1.2})
    );

    private static final double[] FREE = {0, 0};

    private CostCalculator() {}

    public static double cost(String modelId, int inputTokens, int outputTokens) {
        var prices = modelId == null ? FREE : PRICING.getOrDefault(modelId, FREE);
        return inputTokens * prices[0] / 1_000_000.0 + outputTokens * prices[1] / 1_000_000.0;
    }

    public static double baselineCost(int inputTokens, int outputTokens) {
        return cost(BASELINE_MODEL, inputTokens, outputTokens);
    }

    public static CostStats stats(String modelId, CompletionResult result) {
        double cost = cost(modelId, result.inputTokens(), result.outputTokens());
        double baseline = baselineCost(result.inputTokens(), result.outputTokens());
        double saved = baseline - cost;
        double savedPercent = baseline > 0 ? saved / baseline * 100.0 : 0;
        return new CostStats(result.inputTokens(), result.outputTokens(), result.ttftMs(), result.totalMs(),
                result.tokensPerSecond(), cost, baseline, saved, savedPercent);
    }
}
