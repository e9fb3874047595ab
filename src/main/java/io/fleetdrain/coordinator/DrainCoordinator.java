package io.fleetdrain.coordinator;

import io.fleetdrain.config.DrainSettings;
import io.fleetdrain.ledger.StateLedger;
import io.fleetdrain.ledger.TransitionResult;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.PowerState;
import io.fleetdrain.model.Worker;
import io.fleetdrain.probe.StatusProbe;
import io.fleetdrain.provider.ProviderAdapter;
import io.fleetdrain.provider.ProviderAdapters;
import io.fleetdrain.provider.ProviderResult;
import io.fleetdrain.remote.RemoteResult;
import io.fleetdrain.remote.RemoteShell;
import io.fleetdrain.safety.SafetyGate;
import io.fleetdrain.safety.StopDecision;
import io.fleetdrain.util.Backoff;
import io.fleetdrain.util.CancellationToken;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public final class DrainCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(DrainCoordinator.class);
    static final String ACTOR = "coordinator";

    private final StateLedger ledger;
    private final StatusProbe probe;
    private final SafetyGate gate;
    private final ProviderAdapters adapters;
    private final RemoteShell shell;
    private final DrainSettings settings;
    private final Ticker ticker;
    private final CancellationToken token;
    private final Backoff backoff;
    private final Map<String, ProviderAdapter> boundAdapters;

    public DrainCoordinator(
            StateLedger ledger,
            StatusProbe probe,
            SafetyGate gate,
            ProviderAdapters adapters,
            RemoteShell shell,
            DrainSettings settings,
            Ticker ticker,
            CancellationToken token
    ) {
        this.ledger = ledger;
        this.probe = probe;
        this.gate = gate;
        this.adapters = adapters;
        this.shell = shell;
        this.settings = settings;
        this.ticker = ticker;
        this.token = token;
        this.backoff = new Backoff(settings.baseBackoffMs(), settings.maxBackoffMs(), settings.baseBackoffMs() / 2L);
        this.boundAdapters = new ConcurrentHashMap<>();
    }

    public DrainRequestOutcome requestDrain(Worker worker) {
        String id = worker.id();
        LifecyclePhase phase = ledger.phase(id);
        if (phase.isAtLeast(LifecyclePhase.PAUSED_CONFIRMED)) {
            return new DrainRequestOutcome(DrainRequestOutcome.Status.SKIPPED, 0, phase,
                    "already " + phase);
        }
        // DRAIN_REQUESTED is on disk before the signal goes out.
        if (phase == LifecyclePhase.ACTIVE) {
            TransitionResult requested = ledger.transition(id, LifecyclePhase.ACTIVE, LifecyclePhase.DRAIN_REQUESTED,
                    ACTOR, "finish signal requested");
            phase = requested.current();
            if (!requested.applied() && phase.isAtLeast(LifecyclePhase.PAUSED_CONFIRMED)) {
                return new DrainRequestOutcome(DrainRequestOutcome.Status.SKIPPED, 0, phase,
                        "already " + phase);
            }
        }

        Retrier.RetryResult<RemoteResult> sent = send(worker, settings.finishCommand());
        RemoteResult last = sent.last();
        if (last == null || !last.ok()) {
            String detail = sent.cancelled()
                    ? "cancelled: " + token.reason()
                    : describeSendFailure(last) + " after " + sent.attempts() + " attempt(s)";
            LOG.warn("[{}] finish signal not delivered: {}", id, detail);
            return new DrainRequestOutcome(DrainRequestOutcome.Status.FAILED, sent.attempts(), ledger.phase(id), detail);
        }

        if (ledger.phase(id) == LifecyclePhase.DRAIN_REQUESTED) {
            ledger.transition(id, LifecyclePhase.DRAIN_REQUESTED, LifecyclePhase.DRAINING,
                    ACTOR, "finish signal delivered");
        } else {
            LOG.info("[{}] finish signal re-sent at {}", id, ledger.phase(id));
        }
        return new DrainRequestOutcome(DrainRequestOutcome.Status.DELIVERED, sent.attempts(), ledger.phase(id), null);
    }

    /**
     * Probes every {@code intervalMs} until the client is paused with no units, or
     * {@code timeoutMs} elapses. Returns no later than {@code timeoutMs + intervalMs}.
     * The worker must be at {@code DRAINING} or later; a client that was never told to
     * finish is refused with {@link IllegalStateException}.
     */
    public PollOutcome pollUntilPausedOrTimeout(Worker worker, long intervalMs, long timeoutMs) {
        String id = worker.id();
        LifecyclePhase before = ledger.phase(id);
        if (before.isBefore(LifecyclePhase.DRAINING)) {
            throw new IllegalStateException("worker " + id + " is " + before + "; finish signal not delivered");
        }
        Poller.PollResult<ObservedState> result = Poller.poll(ticker, intervalMs, timeoutMs, token,
                budgetMs -> observe(worker, budgetMs),
                ObservedState::pausedAndIdle);
        switch (result.status()) {
            case SATISFIED -> {
                LifecyclePhase phase = ledger.phase(id);
                if (phase == LifecyclePhase.DRAINING) {
                    phase = ledger.transition(id, LifecyclePhase.DRAINING, LifecyclePhase.PAUSED_CONFIRMED,
                            ACTOR, "paused with 0 units after " + result.attempts() + " poll(s)").current();
                }
                return new PollOutcome(true, null, phase, result.last(), result.attempts(), result.elapsedMs());
            }
            case CANCELLED -> {
                return new PollOutcome(false, CoordinationError.CANCELLED, ledger.phase(id), result.last(),
                        result.attempts(), result.elapsedMs());
            }
            default -> {
                LOG.warn("[{}] not paused after {}ms ({} poll(s))", id, result.elapsedMs(), result.attempts());
                return new PollOutcome(false, CoordinationError.DRAIN_TIMEOUT, ledger.phase(id), result.last(),
                        result.attempts(), result.elapsedMs());
            }
        }
    }

    public WorkerReport resumeWorker(Worker worker, String operator, String reason) {
        String id = worker.id();
        LifecyclePhase before;
        synchronized (ledger) {
            before = ledger.phase(id);
            if (before.isAtLeast(LifecyclePhase.STOP_AUTHORIZED)) {
                LOG.warn("[{}] resume refused at {}", id, before);
                return report(worker, WorkerReport.Outcome.REFUSED, "STOP_IN_PROGRESS",
                        "worker is " + before + "; resume is only possible before a stop is authorized");
            }
            if (before != LifecyclePhase.ACTIVE) {
                ledger.reset(id, LifecyclePhase.ACTIVE, operator, reason);
            }
        }

        Retrier.RetryResult<RemoteResult> sent = send(worker, settings.resumeCommand());
        RemoteResult last = sent.last();
        if (last == null || !last.ok()) {
            String detail = sent.cancelled()
                    ? "cancelled: " + token.reason()
                    : describeSendFailure(last) + " after " + sent.attempts() + " attempt(s)";
            LOG.warn("[{}] resume signal not delivered: {}", id, detail);
            return report(worker, WorkerReport.Outcome.RESUME_FAILED, "RESUME_SIGNAL_FAILED", detail);
        }
        LOG.info("[{}] resumed from {} by {}", id, before, operator);
        return report(worker, WorkerReport.Outcome.RESUMED, null, "resumed from " + before);
    }

    public WorkerReport drainWorker(Worker worker) {
        LifecyclePhase phase = ledger.phase(worker.id());
        if (phase.isAtLeast(LifecyclePhase.PAUSED_CONFIRMED)) {
            WorkerReport.Outcome outcome = phase == LifecyclePhase.STOPPED
                    ? WorkerReport.Outcome.STOPPED
                    : WorkerReport.Outcome.PAUSED;
            return report(worker, outcome, null, "already " + phase);
        }
        if (token.isCancelled()) {
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(), token.reason());
        }

        DrainRequestOutcome request = requestDrain(worker);
        if (!request.delivered()) {
            if (token.isCancelled()) {
                return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                        request.detail());
            }
            return report(worker, WorkerReport.Outcome.DRAIN_SIGNAL_FAILED,
                    CoordinationError.DRAIN_SIGNAL_FAILED.name(), request.detail());
        }

        PollOutcome polled = pollUntilPausedOrTimeout(worker, settings.pollIntervalMs(), settings.drainTimeoutMs());
        if (polled.success()) {
            return report(worker, WorkerReport.Outcome.PAUSED, null,
                    "paused after " + polled.polls() + " poll(s)", polled.last());
        }
        if (polled.error() == CoordinationError.CANCELLED) {
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                    token.reason(), polled.last());
        }
        return report(worker, WorkerReport.Outcome.DRAIN_TIMEOUT, CoordinationError.DRAIN_TIMEOUT.name(),
                "not paused after " + polled.elapsedMs() / 1_000L + "s", polled.last());
    }

    public FleetReport drainFleet(List<Worker> workers, int concurrency) {
        return runFleet("drain", workers, concurrency, this::drainWorker);
    }

    public WorkerReport stopWorker(Worker worker) {
        String id = worker.id();
        LifecyclePhase phase = ledger.phase(id);
        if (phase == LifecyclePhase.STOPPED) {
            return report(worker, WorkerReport.Outcome.STOPPED, null, "already stopped");
        }
        ProviderAdapter adapter = adapterFor(worker);
        // Never a second stop call; only the power state is read.
        if (phase == LifecyclePhase.STOP_REQUESTED) {
            return reconcileRequested(worker, adapter);
        }
        if (phase.isBefore(LifecyclePhase.PAUSED_CONFIRMED)) {
            WorkerReport drained = drainWorker(worker);
            if (drained.outcome() != WorkerReport.Outcome.PAUSED) {
                return drained;
            }
        }
        if (token.isCancelled()) {
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(), token.reason());
        }

        StopDecision decision = gate.authorizeStop(worker, token);
        if (!decision.authorized()) {
            if (decision.reason() == StopDecision.Reason.CANCELLED) {
                return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                        decision.detail());
            }
            String code = decision.violation() != null ? decision.violation().name() : decision.reason().name();
            return report(worker, WorkerReport.Outcome.REFUSED, code, decision.detail());
        }
        if (token.isCancelled()) {
            LOG.warn("[{}] cancelled after authorization; left at {} for operator review", id, ledger.phase(id));
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                    "cancelled before stop call: " + token.reason());
        }

        PowerState power = adapter.queryPowerState(worker.ref());
        LOG.info("[{}] backend reports {} before stop", id, power);
        switch (power) {
            case STOPPED -> {
                if (!requestStop(id, "already stopped at backend")) {
                    return concurrentStop(worker);
                }
                ledger.transition(id, LifecyclePhase.STOP_REQUESTED, LifecyclePhase.STOPPED,
                        ACTOR, "backend reports STOPPED");
                return report(worker, WorkerReport.Outcome.STOPPED, null, "already stopped at backend");
            }
            case STOPPING -> {
                if (!requestStop(id, "backend already stopping")) {
                    return concurrentStop(worker);
                }
                return confirmStopped(worker, adapter);
            }
            case RUNNING -> {
                if (!requestStop(id, "stop requested from " + adapter.backend().cliName())) {
                    return concurrentStop(worker);
                }
                return issueStop(worker, adapter);
            }
            default -> {
                return report(worker, WorkerReport.Outcome.POWER_STATE_UNKNOWN, PowerState.UNKNOWN.name(),
                        "backend power state unknown; no stop issued");
            }
        }
    }

    public FleetReport teardownFleet(List<Worker> workers, int concurrency) {
        return runFleet("teardown", workers, concurrency, this::stopWorker);
    }

    private WorkerReport issueStop(Worker worker, ProviderAdapter adapter) {
        String id = worker.id();
        Retrier.RetryResult<ProviderResult> stop = Retrier.retry(ticker, backoff, settings.providerAttempts(), token,
                () -> adapter.stop(worker.ref()),
                ProviderResult::transientFailure);
        ProviderResult last = stop.last();
        if (last == null || !last.success()) {
            if (stop.cancelled()) {
                return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                        "cancelled between stop attempts: " + token.reason());
            }
            String detail = (stop.exhausted() ? "retries exhausted after " + stop.attempts() + " attempt(s): " : "")
                    + (last == null ? "" : last.message());
            LOG.error("[{}] stop failed ({}); left at STOP_REQUESTED: {}", id,
                    last == null ? null : last.error(), detail);
            return report(worker, WorkerReport.Outcome.PROVIDER_FAILED,
                    last == null ? null : last.error().name(), detail);
        }
        return confirmStopped(worker, adapter);
    }

    private WorkerReport reconcileRequested(Worker worker, ProviderAdapter adapter) {
        PowerState power = adapter.queryPowerState(worker.ref());
        if (power == PowerState.STOPPED || power == PowerState.STOPPING) {
            return confirmStopped(worker, adapter);
        }
        return report(worker, WorkerReport.Outcome.STOP_UNCONFIRMED, power.name(),
                "stop already requested, backend reports " + power + "; operator action required");
    }

    private WorkerReport confirmStopped(Worker worker, ProviderAdapter adapter) {
        String id = worker.id();
        Poller.PollResult<PowerState> result = Poller.poll(ticker,
                settings.stopConfirmIntervalMs(), settings.stopConfirmTimeoutMs(), token,
                budgetMs -> adapter.queryPowerState(worker.ref()),
                state -> state == PowerState.STOPPED);
        if (result.satisfied()) {
            ledger.transition(id, LifecyclePhase.STOP_REQUESTED, LifecyclePhase.STOPPED,
                    ACTOR, "backend confirmed STOPPED");
            return report(worker, WorkerReport.Outcome.STOPPED, null,
                    "confirmed after " + result.attempts() + " check(s)");
        }
        if (result.status() == Poller.PollResult.Status.CANCELLED) {
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(),
                    "cancelled while confirming stop: " + token.reason());
        }
        return report(worker, WorkerReport.Outcome.STOP_UNCONFIRMED, String.valueOf(result.last()),
                "not STOPPED after " + result.elapsedMs() / 1_000L + "s");
    }

    private boolean requestStop(String workerId, String reason) {
        return ledger.transition(workerId, LifecyclePhase.STOP_AUTHORIZED, LifecyclePhase.STOP_REQUESTED,
                ACTOR, reason).applied();
    }

    private WorkerReport concurrentStop(Worker worker) {
        return report(worker, WorkerReport.Outcome.REFUSED, "CONCURRENT_STOP_ATTEMPT",
                "phase moved to " + ledger.phase(worker.id()) + " under us");
    }

    private Retrier.RetryResult<RemoteResult> send(Worker worker, String command) {
        return Retrier.retry(ticker, backoff, settings.drainSignalAttempts(), token,
                () -> shell.execute(worker.address(), command,
                        settings.connectTimeoutMs(), settings.commandTimeoutMs()),
                result -> result.outcome() == RemoteResult.Outcome.CONNECT_FAILED
                        || result.outcome() == RemoteResult.Outcome.COMMAND_FAILED);
    }

    private ObservedState observe(Worker worker, long budgetMs) {
        ObservedState state;
        try {
            state = probe.probe(worker, settings.connectTimeoutMs(), budgetMs);
        } catch (RuntimeException e) {
            LOG.warn("[{}] probe threw: {}", worker.id(), e.getMessage());
            state = ObservedState.unknown(worker.id(), ticker.now(), null, "probe failed: " + e.getMessage());
        }
        ledger.recordObservation(state);
        return state;
    }

    private ProviderAdapter adapterFor(Worker worker) {
        return boundAdapters.computeIfAbsent(worker.id(), ignored -> adapters.forBackend(worker.backend()));
    }

    private FleetReport runFleet(String operation, List<Worker> workers, int concurrency,
                                 Function<Worker, WorkerReport> task) {
        long start = ticker.nowMs();
        if (workers.isEmpty()) {
            return new FleetReport(operation, List.of(), 0L);
        }
        int threads = Math.max(1, Math.min(concurrency, workers.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, namedThreads(operation));
        List<Future<WorkerReport>> futures = new ArrayList<>(workers.size());
        try {
            for (Worker worker : workers) {
                futures.add(pool.submit(() -> isolate(worker, task)));
            }
            List<WorkerReport> reports = new ArrayList<>(workers.size());
            for (int i = 0; i < workers.size(); i++) {
                reports.add(await(workers.get(i), futures.get(i)));
            }
            FleetReport report = new FleetReport(operation, reports, ticker.nowMs() - start);
            LOG.info(report.summaryLine());
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private WorkerReport isolate(Worker worker, Function<Worker, WorkerReport> task) {
        try {
            return task.apply(worker);
        } catch (RuntimeException e) {
            LOG.error("[{}] unexpected failure", worker.id(), e);
            return report(worker, WorkerReport.Outcome.ERROR, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    private WorkerReport await(Worker worker, Future<WorkerReport> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("interrupted");
            future.cancel(true);
            return report(worker, WorkerReport.Outcome.CANCELLED, CoordinationError.CANCELLED.name(), "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("[{}] task failed", worker.id(), cause);
            return report(worker, WorkerReport.Outcome.ERROR, cause.getClass().getSimpleName(), cause.getMessage());
        }
    }

    private WorkerReport report(Worker worker, WorkerReport.Outcome outcome, String errorCode, String detail) {
        return report(worker, outcome, errorCode, detail, ledger.latestObservation(worker.id()).orElse(null));
    }

    private WorkerReport report(Worker worker, WorkerReport.Outcome outcome, String errorCode, String detail,
                                ObservedState last) {
        return WorkerReport.of(worker, outcome, ledger.phase(worker.id()), errorCode, detail, last);
    }

    private static String describeSendFailure(RemoteResult result) {
        if (result == null) {
            return "not sent";
        }
        String error = result.error() == null ? "" : result.error().trim();
        return result.outcome() + (result.exitCode() >= 0 ? " exit=" + result.exitCode() : "")
                + (error.isEmpty() ? "" : " " + error);
    }

    private static ThreadFactory namedThreads(String operation) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fleetdrain-" + operation + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
