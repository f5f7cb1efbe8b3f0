package com.arbiter.observability;

import com.arbiter.providers.CompletionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    @Test
    void pricesPerMillionTokens() {
        assertEquals(0.45, CostCalculator.cost("meta-llama/llama-4-maverick:groq", 1_000_000, 1_000_000), 1e-9);
        assertEquals(18.0, CostCalculator.cost("anthropic/claude-sonnet-4.5", 1_000_000, 1_000_000), 1e-9);
    }

    @Test
    void unpricedModelsAreFree() {
        assertEquals(0.0, CostCalculator.cost("together/Qwen/Qwen3-4B", 5000, 5000));
        assertEquals(0.0, CostCalculator.cost(null, 5000, 5000));
    }

    @Test
    void statsCompareAgainstBaseline() {
        var result = new CompletionResult("answer", 1000, 2000, 120, 800, 2500.0);

        var stats = CostCalculator.stats("deepseek/deepseek-chat", result);

        assertEquals(1000, stats.inputTokens());
        assertEquals(2000, stats.outputTokens());
        assertEquals(120, stats.ttftMs());
        assertEquals(0.00126, stats.cost(), 1e-9);
        assertEquals(0.033, stats.baselineCost(), 1e-9);
        assertEquals(stats.baselineCost() - stats.cost(), stats.saved(), 1e-12);
        assertTrue(stats.savedPercent() > 96 && stats.savedPercent() < 97);
    }

    @Test
    void baselineModelSavesNothing() {
        var stats = CostCalculator.stats(CostCalculator.BASELINE_MODEL, new CompletionResult("a", 10, 10, 1, 2, 5000.0));
        assertEquals(0.0, stats.saved(), 1e-12);
        assertEquals(0.0, stats.savedPercent(), 1e-9);
    }
}
