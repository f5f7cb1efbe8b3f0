package com.arbiter.providers;

/**
 * Raised for a logical model id that is not in {@link ModelCatalog}. Never
 * substituted with a default backend.
 */
public class UnknownModelException extends RuntimeException {

    private final String modelId;

    public UnknownModelException(String modelId) {
        super("Unknown model: " + modelId);
        this.modelId = modelId;
    }

    public String modelId() {
        return modelId;
    }
}
