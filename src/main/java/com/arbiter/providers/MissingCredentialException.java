package com.arbiter.providers;

public class MissingCredentialException extends ProviderException {

    public MissingCredentialException(String providerId, String credential) {
        super(providerId, credential + " not configured");
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CONFIG;
    }
}
