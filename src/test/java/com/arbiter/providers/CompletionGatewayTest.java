package com.arbiter.providers;

import com.arbiter.observability.MetricsConfig;
import com.arbiter.shared.config.CompletionConfig;
import com.arbiter.shared.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompletionGatewayTest {

    private final MetricsConfig metrics = new MetricsConfig();
    private final CompletionGateway gateway = new CompletionGateway(CompletionConfig.defaults(), metrics);

    @Test
    void mapsLogicalIdToAdapterAndNativeName() {
        var groq = ScriptedProvider.answering("groq", "fast answer");
        gateway.register(AdapterKind.GROQ, groq);

        var result = gateway.dispatch("meta-llama/llama-4-maverick:groq", List.of(Message.user("hi")));

        assertEquals("fast answer", result.content());
        var sent = groq.requests.get(0);
        assertEquals("llama-3.3-70b-versatile", sent.model());
        assertEquals(4096, sent.maxTokens());
        assertEquals(Duration.ofSeconds(90), sent.timeout());
        assertEquals(1.0, metrics.completionCalls("groq").count());
        assertEquals(1, metrics.completionLatency("groq").count());
    }

    @Test
    void explicitLimitsOverrideDefaults() {
        var together = ScriptedProvider.answering("together", "ok");
        gateway.register(AdapterKind.TOGETHER, together);

        gateway.dispatch("z-ai/glm-4-32b", List.of(Message.user("hi")), 100, Duration.ofSeconds(5));

        var sent = together.requests.get(0);
        assertEquals("zai-org/GLM-4.6", sent.model());
        assertEquals(100, sent.maxTokens());
        assertEquals(Duration.ofSeconds(5), sent.timeout());
    }

    @Test
    void unknownModelFailsHardWithoutCallingAnyAdapter() {
        var groq = ScriptedProvider.answering("groq", "should not be used");
        for (var kind : AdapterKind.values()) gateway.register(kind, groq);

        var ex = assertThrows(UnknownModelException.class,
                () -> gateway.dispatch("gpt-imaginary", List.of(Message.user("hi"))));
        assertEquals("gpt-imaginary", ex.modelId());
        assertTrue(groq.requests.isEmpty());
    }

    @Test
    void countsFailuresByKind() {
        gateway.register(AdapterKind.DEEPSEEK,
                ScriptedProvider.failing("deepseek", new CompletionTimeoutException("deepseek", Duration.ofSeconds(1))));

        assertThrows(CompletionTimeoutException.class,
                () -> gateway.dispatch("deepseek/deepseek-chat", List.of(Message.user("hi"))));
        assertEquals(1.0, metrics.completionFailures(FailureKind.TIMEOUT).count());
        assertEquals(0.0, metrics.completionFailures(FailureKind.BACKEND).count());
    }

    @Test
    void missingAdapterRegistrationIsAnError() {
        assertThrows(IllegalStateException.class,
                () -> gateway.dispatch("minimax/minimax-m2", List.of(Message.user("hi"))));
    }

    @Test
    void streamsDeltasToListener() {
        gateway.register(AdapterKind.ANTHROPIC, ScriptedProvider.answering("anthropic", "one two three"));
        var sb = new StringBuilder();

        var result = gateway.dispatchStream("anthropic/claude-sonnet-4.5", List.of(Message.user("count")),
                null, null, e -> sb.append(e.delta()));

        assertEquals(result.content(), sb.toString());
    }
}
