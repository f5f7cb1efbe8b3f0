package com.arbiter.providers;

public class DeepSeekProvider extends OpenAiCompatibleProvider {

    public DeepSeekProvider(String apiKey) {
        this(apiKey, AdapterKind.DEEPSEEK.defaultBaseUrl());
    }

    public DeepSeekProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "deepseek";
    }

    @Override
    protected String credentialName() {
        return "DEEPSEEK_API_KEY";
    }
}
