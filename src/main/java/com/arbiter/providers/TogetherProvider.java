package com.arbiter.providers;

public class TogetherProvider extends OpenAiCompatibleProvider {

    public TogetherProvider(String apiKey) {
        this(apiKey, AdapterKind.TOGETHER.defaultBaseUrl());
    }

    public TogetherProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "together";
    }

    @Override
    protected String credentialName() {
        return "TOGETHER_API_KEY";
    }
}
