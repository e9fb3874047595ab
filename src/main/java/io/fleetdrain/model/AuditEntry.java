package io.fleetdrain.model;

import java.time.Instant;

public record AuditEntry(
        long seq,
        Instant timestamp,
        Kind kind,
        String workerId,
        LifecyclePhase priorPhase,
        LifecyclePhase newPhase,
        String actor,
        String reason,
        ObservedState observation
) {
    public enum Kind {
        TRANSITION,
        RESET,
        OBSERVATION
    }

    public boolean changesPhase() {
        return kind == Kind.TRANSITION || kind == Kind.RESET;
    }
}
