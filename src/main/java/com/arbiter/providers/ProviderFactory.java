package com.arbiter.providers;

import com.arbiter.shared.config.ArbiterConfig;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds one adapter per kind from configuration. Missing keys are not an error
 * here; they surface as {@link MissingCredentialException} on first use.
 */
public final class ProviderFactory {

    private ProviderFactory() {}

    public static Map<AdapterKind, StreamingProvider> createAll(ArbiterConfig config) {
        var all = new EnumMap<AdapterKind, StreamingProvider>(AdapterKind.class);
        all.put(AdapterKind.ANTHROPIC, new AnthropicProvider(config.apiKey("anthropic"), url(config, AdapterKind.ANTHROPIC)));
        all.put(AdapterKind.GROQ, new GroqProvider(config.apiKey("groq"), url(config, AdapterKind.GROQ)));
        all.put(AdapterKind.CEREBRAS, new CerebrasProvider(config.apiKey("cerebras"), url(config, AdapterKind.CEREBRAS)));
        all.put(AdapterKind.DEEPSEEK, new DeepSeekProvider(config.apiKey("deepseek"), url(config, AdapterKind.DEEPSEEK)));
        all.put(AdapterKind.MINIMAX, new MiniMaxProvider(config.apiKey("minimax"), config.apiKey("minimax-group-id"),
                url(config, AdapterKind.MINIMAX)));
        all.put(AdapterKind.OPENROUTER, new OpenRouterProvider(config.apiKey("openrouter"), url(config, AdapterKind.OPENROUTER)));
        all.put(AdapterKind.TOGETHER, new TogetherProvider(config.apiKey("together"), url(config, AdapterKind.TOGETHER)));
        return all;
    }

    private static String url(ArbiterConfig config, AdapterKind kind) {
        return config.baseUrl(kind.id(), kind.defaultBaseUrl());
    }
}
