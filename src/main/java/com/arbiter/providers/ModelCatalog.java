package com.arbiter.providers;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of every supported logical model id. This is the only place that
 * knows which adapter serves which model.
 */
public final class ModelCatalog {

    public static final String AUTO_ROUTER = "auto-router";

    private static final Map<String, ModelRoute> ROUTES = new LinkedHashMap<>();

    static {
        add("anthropic/claude-sonnet-4.5", AdapterKind.ANTHROPIC, "claude-sonnet-4-5-20250929", "Claude Sonnet 4.5");
        add("meta-llama/llama-4-maverick:groq", AdapterKind.GROQ, "llama-3.3-70b-versatile", "Groq: Llama 4 Maverick");
        add("meta-llama/llama-3.3-70b-instruct:cerebras", AdapterKind.CEREBRAS, "llama-3.3-70b", "Cerebras: Llama 3.3 70B");
        add("together/llama-4-maverick-17b", AdapterKind.TOGETHER,
                "meta-llama/Llama-4-Maverick-17B-128E-Instruct-FP8", "Together: Llama 4 Maverick 17B");
        add("deepseek/deepseek-chat", AdapterKind.DEEPSEEK, "deepseek-chat", "DeepSeek-V3");
        add("minimax/minimax-m2", AdapterKind.MINIMAX, "MiniMax-Text-01", "MiniMax M2");
        add("moonshotai/kimi-k2", AdapterKind.OPENROUTER, "moonshotai/kimi-k2", "Kimi K2 (Moonshot)");
        add("qwen/qwen-2.5-72b-instruct", AdapterKind.TOGETHER, "Qwen/Qwen2.5-72B-Instruct-Turbo", "Qwen 2.5 72B (Alibaba)");
        add("z-ai/glm-4-32b", AdapterKind.TOGETHER, "zai-org/GLM-4.6", "GLM-4-32B (Zhipu)");
        add("together/llama-3.2-3b-instruct-turbo", AdapterKind.TOGETHER,
                "meta-llama/Llama-3.2-3B-Instruct-Turbo", "Llama 3.2 3B Turbo");
        add("together/qwen-2.5-7b-instruct-turbo", AdapterKind.TOGETHER,
                "Qwen/Qwen2.5-7B-Instruct-Turbo", "Qwen 2.5 7B Turbo");
        add("together/deepseek-r1-distill-llama-70b", AdapterKind.TOGETHER,
                "deepseek-ai/DeepSeek-R1-Distill-Llama-70B", "DeepSeek R1 Distill Llama 70B");
        add("together/deepseek-r1", AdapterKind.TOGETHER, "deepseek-ai/DeepSeek-R1", "DeepSeek R1");
        add("together/qwq-32b", AdapterKind.TOGETHER, "Qwen/QwQ-32B", "QwQ 32B");
        add("together/Qwen/Qwen3-4B", AdapterKind.TOGETHER, "Qwen/Qwen3-4B", "Qwen3 4B");
        add("together/Qwen/Qwen3-Next-80B-A3B-Instruct", AdapterKind.TOGETHER,
                "Qwen/Qwen3-Next-80B-A3B-Instruct", "Qwen3 Next 80B A3B");
        add("openrouter/qwen/qwen2.5-vl-3b-instruct", AdapterKind.OPENROUTER,
                "qwen/qwen2.5-vl-3b-instruct:free", "Qwen 2.5 VL 3B");
    }

    private ModelCatalog() {}

    private static void add(String id, AdapterKind adapter, String nativeModel, String displayName) {
        ROUTES.put(id, new ModelRoute(id, adapter, nativeModel, displayName));
    }

    /** Fails hard on an unknown id; never substitutes a default backend. */
    public static ModelRoute resolve(String modelId) {
        var route = modelId == null ? null : ROUTES.get(modelId);
        if (route == null) throw new UnknownModelException(modelId);
        return route;
    }

    public static Optional<ModelRoute> find(String modelId) {
        return Optional.ofNullable(modelId == null ? null : ROUTES.get(modelId));
    }

    public static String displayName(String modelId) {
        return find(modelId).map(ModelRoute::displayName).orElse(modelId);
    }

    /** Matches a logical id first, then a display name. */
    public static Optional<ModelRoute> findByIdOrDisplayName(String idOrName) {
        var byId = find(idOrName);
        if (byId.isPresent()) return byId;
        return ROUTES.values().stream().filter(r -> r.displayName().equals(idOrName)).findFirst();
    }

    public static Collection<ModelRoute> all() {
        return Collections.unmodifiableCollection(ROUTES.values());
    }
}
