package io.fleetdrain.safety;

public record StopDecision(boolean authorized, Reason reason, SafetyViolation violation, String detail) {
    public enum Reason {
        AUTHORIZED,
        CONCURRENT_STOP_ATTEMPT,
        PHASE_NOT_ELIGIBLE,
        NO_OBSERVATION,
        AMBIGUOUS_STATE,
        NOT_PAUSED,
        STATE_CHANGED,
        CANCELLED
    }

    static StopDecision authorized(String detail) {
        return new StopDecision(true, Reason.AUTHORIZED, null, detail);
    }

    static StopDecision refused(Reason reason, String detail) {
        return new StopDecision(false, reason, null, detail);
    }

    static StopDecision violation(SafetyViolation violation, String detail) {
        Reason reason = violation == SafetyViolation.AMBIGUOUS_STATE
                ? Reason.AMBIGUOUS_STATE
                : Reason.CONCURRENT_STOP_ATTEMPT;
        return new StopDecision(false, reason, violation, detail);
    }
}
