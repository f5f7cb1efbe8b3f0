package com.arbiter.providers;

/**
 * The backend answered with an error status, an in-stream error event, or the
 * connection failed. {@code status} is 0 when no HTTP status was received.
 */
public class BackendException extends ProviderException {

    private final int status;

    public BackendException(String providerId, int status, String body) {
        super(providerId, providerId + " API error: " + status + " - " + body);
        this.status = status;
    }

    public BackendException(String providerId, String message, Throwable cause) {
        super(providerId, "Failed to get " + providerId + " response: " + message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.BACKEND;
    }
}
