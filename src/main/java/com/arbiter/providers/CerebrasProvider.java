package com.arbiter.providers;

public class CerebrasProvider extends OpenAiCompatibleProvider {

    public CerebrasProvider(String apiKey) {
        this(apiKey, AdapterKind.CEREBRAS.defaultBaseUrl());
    }

    public CerebrasProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "cerebras";
    }

    @Override
    protected String credentialName() {
        return "CEREBRAS_API_KEY";
    }
}
