package io.fleetdrain.safety;

public enum SafetyViolation {
    AMBIGUOUS_STATE,
    CONCURRENT_STOP_ATTEMPT
}
