package io.fleetdrain.provider;

public class ProviderException extends RuntimeException {
    private final ProviderError error;

    public ProviderException(ProviderError error, String message) {
        super(message);
        this.error = error;
    }

    public ProviderError error() {
        return error;
    }
}
