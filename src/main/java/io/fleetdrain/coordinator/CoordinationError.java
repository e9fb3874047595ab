package io.fleetdrain.coordinator;

public enum CoordinationError {
    DRAIN_TIMEOUT,
    PARTIAL_FLEET_FAILURE,
    DRAIN_SIGNAL_FAILED,
    CANCELLED
}
