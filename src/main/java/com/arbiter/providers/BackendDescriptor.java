package com.arbiter.providers;

public record BackendDescriptor(String id, String displayName, AdapterKind adapterKind) {

    public static BackendDescriptor of(String modelId) {
        var route = ModelCatalog.resolve(modelId);
        return new BackendDescriptor(route.modelId(), route.displayName(), route.adapter());
    }
}
