package com.arbiter.providers;

import java.net.http.HttpRequest;

public class OpenRouterProvider extends OpenAiCompatibleProvider {

    public OpenRouterProvider(String apiKey) {
        this(apiKey, AdapterKind.OPENROUTER.defaultBaseUrl());
    }

    public OpenRouterProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "openrouter";
    }

    @Override
    protected String credentialName() {
        return "OPENROUTER_API_KEY";
    }

    @Override
    protected HttpRequest.Builder newRequest(String baseUrl, String apiKey) {
        return super.newRequest(baseUrl, apiKey)
                .header("X-Title", "model-arbiter");
    }
}
