package com.arbiter.providers;

public class StreamProtocolException extends ProviderException {

    public StreamProtocolException(String providerId, String message) {
        super(providerId, message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PROTOCOL;
    }
}
