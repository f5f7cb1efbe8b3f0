package com.arbiter.providers;

public enum AdapterKind {
    ANTHROPIC("anthropic", "https://api.anthropic.com/v1"),
    GROQ("groq", "https://api.groq.com/openai/v1"),
    CEREBRAS("cerebras", "https://api.cerebras.ai/v1"),
    DEEPSEEK("deepseek", "https://api.deepseek.com"),
    MINIMAX("minimax", "https://api.minimax.io/v1"),
    OPENROUTER("openrouter", "https://openrouter.ai/api/v1"),
    TOGETHER("together", "https://api.together.xyz/v1");

    private final String id;
    private final String defaultBaseUrl;

    AdapterKind(String id, String defaultBaseUrl) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
    }

    public String id() {
        return id;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }
}
