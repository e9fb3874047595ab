package io.fleetdrain.provider;

public enum ProviderError {
    TRANSIENT,
    PERMANENT
}
