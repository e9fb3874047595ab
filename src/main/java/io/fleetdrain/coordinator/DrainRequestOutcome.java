package io.fleetdrain.coordinator;

import io.fleetdrain.model.LifecyclePhase;

public record DrainRequestOutcome(Status status, int attempts, LifecyclePhase phase, String detail) {
    public enum Status {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    public boolean delivered() {
        return status == Status.DELIVERED;
    }
}
