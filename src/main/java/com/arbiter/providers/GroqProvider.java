package com.arbiter.providers;

public class GroqProvider extends OpenAiCompatibleProvider {

    public GroqProvider(String apiKey) {
        this(apiKey, AdapterKind.GROQ.defaultBaseUrl());
    }

    public GroqProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "groq";
    }

    @Override
    protected String credentialName() {
        return "GROQ_API_KEY";
    }
}
