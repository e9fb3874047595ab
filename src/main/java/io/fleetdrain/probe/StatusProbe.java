package io.fleetdrain.probe;

import io.fleetdrain.model.ClientState;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.ProbeError;
import io.fleetdrain.model.Worker;
import io.fleetdrain.remote.RemoteResult;
import io.fleetdrain.remote.RemoteShell;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

public class StatusProbe {
    private static final Logger LOG = LoggerFactory.getLogger(StatusProbe.class);
    private static final int MAX_DETAIL_CHARS = 200;
    static final long MIN_COMMAND_BUDGET_MS = 1_000L;

    private final RemoteShell shell;
    private final ProbeCommands commands;
    private final long commandTimeoutMs;
    private final Ticker ticker;

    public StatusProbe(RemoteShell shell, ProbeCommands commands, long commandTimeoutMs, Ticker ticker) {
        this.shell = shell;
        this.commands = commands;
        this.commandTimeoutMs = commandTimeoutMs;
        this.ticker = ticker;
    }

    public ObservedState probe(Worker worker, long connectTimeoutMs) {
        return probe(worker, connectTimeoutMs, Long.MAX_VALUE);
    }

    /**
     * Like {@link #probe(Worker, long)}, but every remote command is cut to what is left of
     * {@code budgetMs}. When the budget runs out between commands the worker is reported
     * unreachable without issuing the rest.
     */
    public ObservedState probe(Worker worker, long connectTimeoutMs, long budgetMs) {
        String id = worker.id();
        String address = worker.address();
        long start = ticker.nowMs();
        long deadline = budgetMs >= Long.MAX_VALUE - start ? Long.MAX_VALUE : start + budgetMs;

        RemoteResult liveness = run(address, commands.liveness(), connectTimeoutMs, deadline);
        if (liveness == null) {
            return exhausted(id, budgetMs);
        }
        if (liveness.transportFailure()) {
            return unreachable(id, liveness);
        }
        if (!liveness.ok()) {
            return ObservedState.unknown(id, now(), null,
                    "liveness exit=" + liveness.exitCode() + " " + brief(liveness.error()));
        }

        RemoteResult state = run(address, commands.state(), connectTimeoutMs, deadline);
        if (state == null) {
            return exhausted(id, budgetMs);
        }
        if (state.transportFailure()) {
            return unreachable(id, state);
        }
        if (!state.ok()) {
            return ObservedState.unknown(id, now(), ProbeError.PARSE_ERROR,
                    "state query exit=" + state.exitCode() + " " + brief(state.error()));
        }
        Optional<ClientState> parsed = ClientStateParser.parseState(state.output());
        if (parsed.isEmpty()) {
            return ObservedState.unknown(id, now(), ProbeError.PARSE_ERROR,
                    "malformed state output: " + brief(state.output()));
        }

        RemoteResult units = run(address, commands.units(), connectTimeoutMs, deadline);
        if (units == null) {
            return exhausted(id, budgetMs);
        }
        if (units.transportFailure()) {
            return unreachable(id, units);
        }
        OptionalInt count = units.ok() ? ClientStateParser.parseUnits(units.output()) : OptionalInt.empty();
        if (count.isEmpty()) {
            return ObservedState.unknown(id, now(), ProbeError.PARSE_ERROR,
                    "unreadable unit count: " + brief(units.output().isBlank() ? units.error() : units.output()));
        }

        ObservedState observed = new ObservedState(id, now(), true, parsed.get(), count.getAsInt(), null, null);
        LOG.debug("[{}] client={} units={}", id, observed.clientState(), observed.unitsInFlight());
        return observed;
    }

    private RemoteResult run(String address, String command, long connectTimeoutMs, long deadline) {
        if (deadline == Long.MAX_VALUE) {
            return shell.execute(address, command, connectTimeoutMs, commandTimeoutMs);
        }
        long remaining = deadline - ticker.nowMs();
        if (remaining < MIN_COMMAND_BUDGET_MS) {
            return null;
        }
        long connect = Math.min(connectTimeoutMs, remaining);
        return shell.execute(address, command, connect, Math.min(commandTimeoutMs, remaining - connect));
    }

    private ObservedState exhausted(String workerId, long budgetMs) {
        LOG.debug("[{}] probe budget of {}ms exhausted", workerId, budgetMs);
        return ObservedState.unreachable(workerId, now(), ProbeError.CONNECT_TIMEOUT,
                "probe budget of " + budgetMs + "ms exhausted");
    }

    private ObservedState unreachable(String workerId, RemoteResult result) {
        ProbeError error = result.outcome() == RemoteResult.Outcome.AUTH_FAILED
                ? ProbeError.AUTH_FAILURE
                : ProbeError.CONNECT_TIMEOUT;
        LOG.debug("[{}] unreachable ({}): {}", workerId, error, brief(result.error()));
        return ObservedState.unreachable(workerId, now(), error, brief(result.error()));
    }

    private Instant now() {
        return ticker.now();
    }

    private static String brief(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_DETAIL_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_DETAIL_CHARS) + "...";
    }
}
