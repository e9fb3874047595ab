package io.fleetdrain.ledger;

import io.fleetdrain.model.AuditEntry;
import io.fleetdrain.model.LifecyclePhase;

public record TransitionResult(boolean applied, LifecyclePhase current, AuditEntry entry) {
    static TransitionResult applied(AuditEntry entry) {
        return new TransitionResult(true, entry.newPhase(), entry);
    }

    static TransitionResult rejected(LifecyclePhase current) {
        return new TransitionResult(false, current, null);
    }
}
