package io.fleetdrain.provider;

public record ProviderResult(boolean success, ProviderError error, String message) {
    public static ProviderResult ok(String message) {
        return new ProviderResult(true, null, message);
    }

    public static ProviderResult failed(ProviderError error, String message) {
        return new ProviderResult(false, error, message);
    }

    public boolean transientFailure() {
        return !success && error == ProviderError.TRANSIENT;
    }
}
