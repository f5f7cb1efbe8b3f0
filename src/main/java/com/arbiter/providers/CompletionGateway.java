package com.arbiter.providers;

import com.arbiter.observability.MetricsConfig;
import com.arbiter.shared.config.CompletionConfig;
import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single dispatch point for every higher-level feature. Looks the logical model id
 * up in {@link ModelCatalog} and calls the adapter registered for its kind.
 */
public class CompletionGateway {

    private static final Logger log = LoggerFactory.getLogger(CompletionGateway.class);

    private final Map<AdapterKind, ModelProvider> providers = new EnumMap<>(AdapterKind.class);
    private final CompletionConfig defaults;
    private final MetricsConfig metrics;

    public CompletionGateway(CompletionConfig defaults, MetricsConfig metrics) {
        this.defaults = defaults;
        this.metrics = metrics;
    }

    public CompletionGateway register(AdapterKind kind, ModelProvider provider) {
        providers.put(kind, provider);
        return this;
    }

    public ModelRoute resolve(String modelId) {
        return ModelCatalog.resolve(modelId);
    }

    public CompletionConfig defaults() {
        return defaults;
    }

    public CompletionResult dispatch(String modelId, List<Message> messages) {
        return dispatch(modelId, messages, null, null);
    }

    /** Null {@code maxTokens} or {@code timeout} fall back to the configured defaults. */
    public CompletionResult dispatch(String modelId, List<Message> messages, Integer maxTokens, Duration timeout) {
        return dispatchStream(modelId, messages, maxTokens, timeout, event -> {});
    }

    public CompletionResult dispatchStream(String modelId, List<Message> messages, Integer maxTokens,
                                           Duration timeout, Consumer<ChatEvent> listener) {
        var route = resolve(modelId);
        var provider = providers.get(route.adapter());
        if (provider == null) {
            throw new IllegalStateException("No adapter registered for " + route.adapter().id());
        }
        var request = new ChatRequest(route.nativeModel(), messages,
                maxTokens != null ? maxTokens : defaults.defaultMaxTokens(),
                timeout != null ? timeout : defaults.defaultTimeout());

        log.info("Dispatching {} -> {} ({})", modelId, route.adapter().id(), route.nativeModel());
        metrics.completionCalls(route.adapter().id()).increment();
        long start = System.nanoTime();
        try {
            return provider.chatStream(request, listener);
        } catch (ProviderException e) {
            metrics.completionFailures(e.kind()).increment();
            throw e;
        } finally {
            metrics.completionLatency(route.adapter().id()).record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }
}
