package io.fleetdrain.coordinator;

import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;

public record PollOutcome(
        boolean success,
        CoordinationError error,
        LifecyclePhase phase,
        ObservedState last,
        int polls,
        long elapsedMs
) {
}
