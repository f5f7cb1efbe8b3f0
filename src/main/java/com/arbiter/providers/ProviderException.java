package com.arbiter.providers;

/**
 * Failure of a single backend call. Subclasses map one-to-one onto {@link FailureKind}.
 */
public abstract class ProviderException extends RuntimeException {

    private final String providerId;

    protected ProviderException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    protected ProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String providerId() {
        return providerId;
    }

    public abstract FailureKind kind();
}
