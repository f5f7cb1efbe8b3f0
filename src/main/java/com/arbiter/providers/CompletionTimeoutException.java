package com.arbiter.providers;

import java.time.Duration;

public class CompletionTimeoutException extends ProviderException {

    public static final String USER_MESSAGE = "Response timed out (query too complex)";

    private final Duration timeout;

    public CompletionTimeoutException(String providerId, Duration timeout) {
        super(providerId, USER_MESSAGE);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
