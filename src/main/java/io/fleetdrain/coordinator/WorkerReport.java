package io.fleetdrain.coordinator;

import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.Worker;

public record WorkerReport(
        String workerId,
        String address,
        Outcome outcome,
        LifecyclePhase phase,
        String errorCode,
        String detail,
        ObservedState lastObservation
) {
    public enum Severity {
        OK,
        FAILED,
        HARD
    }

    public enum Outcome {
        PAUSED(Severity.OK),
        STOPPED(Severity.OK),
        RESUMED(Severity.OK),
        DRAIN_SIGNAL_FAILED(Severity.FAILED),
        DRAIN_TIMEOUT(Severity.FAILED),
        REFUSED(Severity.FAILED),
        POWER_STATE_UNKNOWN(Severity.FAILED),
        PROVIDER_FAILED(Severity.FAILED),
        STOP_UNCONFIRMED(Severity.FAILED),
        CANCELLED(Severity.FAILED),
        RESUME_FAILED(Severity.FAILED),
        ERROR(Severity.HARD);

        private final Severity severity;

        Outcome(Severity severity) {
            this.severity = severity;
        }

        public Severity severity() {
            return severity;
        }
    }

    static WorkerReport of(Worker worker, Outcome outcome, LifecyclePhase phase, String errorCode, String detail,
                           ObservedState last) {
        return new WorkerReport(worker.id(), worker.address(), outcome, phase, errorCode, detail, last);
    }

    public Severity severity() {
        return outcome.severity();
    }

    public String statusLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-28s %-16s %-20s %-18s", workerId, address, outcome, phase));
        if (errorCode != null) {
            sb.append(' ').append(errorCode);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append("  ").append(detail);
        }
        return sb.toString();
    }
}
