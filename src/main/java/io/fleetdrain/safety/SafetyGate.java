package io.fleetdrain.safety;

import io.fleetdrain.ledger.StateLedger;
import io.fleetdrain.ledger.TransitionResult;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.Worker;
import io.fleetdrain.probe.StatusProbe;
import io.fleetdrain.util.CancellationToken;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public final class SafetyGate {
    private static final Logger LOG = LoggerFactory.getLogger(SafetyGate.class);
    static final String ACTOR = "safety-gate";

    private final StatusProbe probe;
    private final StateLedger ledger;
    private final Ticker ticker;
    private final long settleDelayMs;
    private final long connectTimeoutMs;

    public SafetyGate(StatusProbe probe, StateLedger ledger, Ticker ticker, long settleDelayMs, long connectTimeoutMs) {
        this.probe = probe;
        this.ledger = ledger;
        this.ticker = ticker;
        this.settleDelayMs = Math.max(0L, settleDelayMs);
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public StopDecision authorizeStop(Worker worker) {
        return authorizeStop(worker, CancellationToken.none());
    }

    public StopDecision authorizeStop(Worker worker, CancellationToken token) {
        StopDecision decision = evaluate(worker, token);
        if (decision.authorized()) {
            LOG.info("[{}] stop authorized: {}", worker.id(), decision.detail());
        } else {
            LOG.warn("[{}] stop refused ({}): {}", worker.id(), decision.reason(), decision.detail());
        }
        return decision;
    }

    private StopDecision evaluate(Worker worker, CancellationToken token) {
        String id = worker.id();
        LifecyclePhase phase = ledger.phase(id);
        if (phase.stopOutstanding()) {
            return StopDecision.violation(SafetyViolation.CONCURRENT_STOP_ATTEMPT,
                    "a stop is already outstanding (phase " + phase + ")");
        }
        if (phase != LifecyclePhase.DRAINING && phase != LifecyclePhase.PAUSED_CONFIRMED) {
            return StopDecision.refused(StopDecision.Reason.PHASE_NOT_ELIGIBLE, "phase is " + phase);
        }

        Optional<ObservedState> latest = ledger.latestObservation(id);
        if (latest.isEmpty()) {
            return StopDecision.refused(StopDecision.Reason.NO_OBSERVATION, "no probe reading recorded");
        }
        StopDecision first = judge(latest.get(), StopDecision.Reason.NOT_PAUSED, "latest reading");
        if (first != null) {
            return first;
        }

        try {
            ticker.sleep(settleDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StopDecision.refused(StopDecision.Reason.CANCELLED, "interrupted during settle delay");
        }
        if (token.isCancelled()) {
            return StopDecision.refused(StopDecision.Reason.CANCELLED, "session cancelled: " + token.reason());
        }

        ObservedState recheck;
        try {
            recheck = probe.probe(worker, connectTimeoutMs);
        } catch (RuntimeException e) {
            recheck = ObservedState.unknown(id, ticker.now(), null, "re-probe failed: " + e.getMessage());
        }
        ledger.recordObservation(recheck);
        StopDecision second = judge(recheck, StopDecision.Reason.STATE_CHANGED, "settle re-probe");
        if (second != null) {
            return second;
        }
        if (token.isCancelled()) {
            return StopDecision.refused(StopDecision.Reason.CANCELLED, "session cancelled: " + token.reason());
        }

        if (ledger.phase(id) == LifecyclePhase.DRAINING) {
            TransitionResult confirmed = ledger.transition(id, LifecyclePhase.DRAINING, LifecyclePhase.PAUSED_CONFIRMED,
                    ACTOR, "paused and idle across settle delay");
            if (!confirmed.applied() && confirmed.current() != LifecyclePhase.PAUSED_CONFIRMED) {
                return lostRace(confirmed.current());
            }
        }
        TransitionResult authorized = ledger.transition(id, LifecyclePhase.PAUSED_CONFIRMED, LifecyclePhase.STOP_AUTHORIZED,
                ACTOR, "paused and idle, confirmed after " + settleDelayMs + "ms settle");
        if (!authorized.applied()) {
            return lostRace(authorized.current());
        }
        return StopDecision.authorized("paused with 0 units on two readings " + settleDelayMs + "ms apart");
    }

    private static StopDecision judge(ObservedState state, StopDecision.Reason notPausedReason, String label) {
        if (!state.reachable()) {
            return StopDecision.violation(SafetyViolation.AMBIGUOUS_STATE,
                    label + " unreachable" + (state.probeError() == null ? "" : " (" + state.probeError() + ")"));
        }
        if (!state.pausedAndIdle()) {
            return StopDecision.refused(notPausedReason,
                    label + " client=" + state.clientState() + " units=" + state.unitsInFlight());
        }
        return null;
    }

    private static StopDecision lostRace(LifecyclePhase current) {
        if (current.stopOutstanding() || current == LifecyclePhase.STOPPED) {
            return StopDecision.violation(SafetyViolation.CONCURRENT_STOP_ATTEMPT,
                    "another authorization won the race (phase " + current + ")");
        }
        return StopDecision.refused(StopDecision.Reason.PHASE_NOT_ELIGIBLE, "phase changed to " + current);
    }
}
