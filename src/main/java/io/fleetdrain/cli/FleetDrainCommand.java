package io.fleetdrain.cli;

import io.fleetdrain.config.DrainSettings;
import io.fleetdrain.config.FleetDrainConfig;
import io.fleetdrain.coordinator.FleetReport;
import io.fleetdrain.coordinator.WorkerReport;
import io.fleetdrain.ledger.StateLedger;
import io.fleetdrain.model.AuditEntry;
import io.fleetdrain.model.Backend;
import io.fleetdrain.model.ClientState;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.PowerState;
import io.fleetdrain.model.Worker;
import io.fleetdrain.model.WorkerRef;
import io.fleetdrain.probe.ProbeCommands;
import io.fleetdrain.probe.StatusProbe;
import io.fleetdrain.provider.ProviderAdapter;
import io.fleetdrain.provider.ProviderAdapters;
import io.fleetdrain.registry.RegistryUnavailableException;
import io.fleetdrain.remote.CommandRunner;
import io.fleetdrain.remote.ProcessCommandRunner;
import io.fleetdrain.remote.SshRemoteShell;
import io.fleetdrain.util.Jsons;
import io.fleetdrain.util.Ticker;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "fleetdrain",
        mixinStandardHelpOptions = true,
        description = "Drain and tear down ephemeral worker fleets without losing in-flight work",
        subcommands = {
                FleetDrainCommand.ListCommand.class,
                FleetDrainCommand.StatusCommand.class,
                FleetDrainCommand.StatusOneCommand.class,
                FleetDrainCommand.WatchCommand.class,
                FleetDrainCommand.DrainCommand.class,
                FleetDrainCommand.TeardownCommand.class,
                FleetDrainCommand.ResumeCommand.class,
                FleetDrainCommand.ResetCommand.class,
                FleetDrainCommand.HistoryCommand.class,
                FleetDrainCommand.VerifyCommand.class
        }
)
public final class FleetDrainCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (settings, fleet state, ledgers)",
            defaultValue = FleetDrainConfig.DEFAULT_ROOT)
    String root;

    CommandRunner runner = new ProcessCommandRunner();
    Ticker ticker = Ticker.system();
    Map<String, String> env = System.getenv();
    boolean installShutdownHook = true;

    @Override
    public void run() {
        System.out.println("Use subcommands: list | status | status-one | watch | drain | teardown | resume | reset | history | verify");
    }

    public static CommandLine commandLine(FleetDrainCommand command) {
        CommandLine cli = new CommandLine(command);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            PrintWriter err = commandLine.getErr();
            err.println("error: " + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
            err.flush();
            return ExitCodes.HARD_FAILURE;
        });
        return cli;
    }

    FleetDrainConfig config() {
        return FleetDrainConfig.fromRoot(root);
    }

    DrainSettings settings() {
        return DrainSettings.load(config().settingsFile(), env);
    }

    FleetSession session(String fleet) {
        return session(fleet, settings());
    }

    FleetSession session(String fleet, DrainSettings settings) {
        return new FleetSession(config(), fleet, settings, runner, ticker);
    }

    @Command(name = "list", description = "List fleet workers with their recorded lifecycle phase")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Option(names = {"--from-backend"}, description = "List instances reported by this backend instead: azure|oci")
        String backend;

        @Override
        public Integer call() {
            try (FleetSession session = parent.session(fleet)) {
                if (backend != null) {
                    ProviderAdapter adapter = session.adapters().forBackend(Backend.fromString(backend));
                    List<WorkerRef> refs = adapter.list(session.fleet());
                    System.out.println(Jsons.toJson(refs));
                    return ExitCodes.OK;
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                for (Worker worker : session.registry().snapshot()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", worker.id());
                    row.put("backend", worker.backend().cliName());
                    row.put("address", worker.address());
                    row.put("resource_id", worker.resourceId());
                    row.put("phase", session.ledger().phase(worker.id()));
                    rows.add(row);
                }
                System.out.println(Jsons.toJson(rows));
                return ExitCodes.OK;
            }
        }
    }

    @Command(name = "status", description = "Probe every worker once and print its client state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print observations as JSON")
        boolean json;

        @Override
        public Integer call() {
            try (FleetSession session = parent.session(fleet)) {
                List<Worker> workers = session.registry().snapshot();
                List<ObservedState> observed = session.probeAll(workers);
                printStatus(session, workers, observed, json);
                return ExitCodes.OK;
            }
        }
    }

    @Command(name = "status-one", description = "Probe a single address, outside any fleet; exits 1 unless the client answered")
    static final class StatusOneCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Worker address")
        String address;

        @Option(names = {"--backend"}, description = "Also query the power state from this backend: azure|oci")
        String backend;

        @Option(names = {"--resource-id"}, description = "Backend instance name or OCID for the power query")
        String resourceId;

        @Override
        public Integer call() {
            DrainSettings settings = parent.settings();
            StatusProbe probe = new StatusProbe(
                    new SshRemoteShell(parent.runner, settings.sshUser(), settings.sshKeyPath()),
                    ProbeCommands.from(settings),
                    settings.commandTimeoutMs(),
                    parent.ticker);
            // Backend only matters for the power query.
            Backend parsed = backend == null ? Backend.AZURE : Backend.fromString(backend);
            Worker worker = new Worker(address, parsed, address, null, resourceId, parent.ticker.now());
            ObservedState observed = probe.probe(worker, settings.connectTimeoutMs());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("observation", observed);
            if (backend != null) {
                ProviderAdapter adapter = ProviderAdapters.standard(parent.runner, settings).forBackend(parsed);
                PowerState power = adapter.queryPowerState(worker.ref());
                out.put("power_state", power);
            }
            System.out.println(Jsons.toJson(out));
            boolean healthy = observed.reachable() && observed.clientState() != ClientState.UNKNOWN;
            return healthy ? ExitCodes.OK : ExitCodes.HARD_FAILURE;
        }
    }

    @Command(name = "watch", description = "Probe the fleet repeatedly and print each round")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Option(names = {"--interval"}, defaultValue = "30", description = "Seconds between rounds")
        long intervalSeconds;

        @Option(names = {"--iterations"}, defaultValue = "0", description = "Rounds to run; 0 runs until interrupted")
        int iterations;

        @Override
        public Integer call() {
            try (FleetSession session = parent.session(fleet)) {
                if (parent.installShutdownHook) {
                    session.installShutdownHook();
                }
                List<Worker> workers = session.registry().snapshot();
                long intervalMs = Math.max(1L, intervalSeconds) * 1_000L;
                for (int round = 1; iterations <= 0 || round <= iterations; round++) {
                    if (session.token().isCancelled()) {
                        break;
                    }
                    System.out.println("-- " + session.ticker().now() + " round " + round);
                    printStatus(session, workers, session.probeAll(workers), false);
                    if (iterations > 0 && round == iterations) {
                        break;
                    }
                    try {
                        session.ticker().sleep(intervalMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
                return ExitCodes.OK;
            }
        }
    }

    abstract static class FleetOperation implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Option(names = {"--timeout"}, description = "Drain timeout per worker in seconds")
        Long timeoutSeconds;

        @Option(names = {"--interval"}, description = "Seconds between status polls")
        Long intervalSeconds;

        @Option(names = {"--concurrency"}, description = "Workers handled in parallel")
        Integer concurrency;

        @Option(names = {"--worker"}, description = "Restrict to these workers (id, name or address); repeatable")
        List<String> only;

        abstract FleetReport execute(FleetSession session, List<Worker> workers);

        @Override
        public Integer call() {
            DrainSettings settings = parent.settings().withDrainWindow(
                    intervalSeconds == null ? null : intervalSeconds * 1_000L,
                    timeoutSeconds == null ? null : timeoutSeconds * 1_000L,
                    concurrency);
            try (FleetSession session = parent.session(fleet, settings)) {
                if (parent.installShutdownHook) {
                    session.installShutdownHook();
                }
                List<Worker> workers = session.workers(only);
                FleetReport report = execute(session, workers);
                for (WorkerReport worker : report.workers()) {
                    System.out.println(worker.statusLine());
                }
                System.out.println(report.summaryLine());
                return report.exitCode();
            }
        }
    }

    @Command(name = "drain", description = "Signal every worker to finish and wait until all are paused")
    static final class DrainCommand extends FleetOperation {
        @Override
        FleetReport execute(FleetSession session, List<Worker> workers) {
            return session.coordinator().drainFleet(workers, session.settings().concurrency());
        }
    }

    @Command(name = "teardown", description = "Drain, then stop every worker that is confirmed paused and idle")
    static final class TeardownCommand extends FleetOperation {
        @Option(names = {"--confirm"}, required = true, description = "Acknowledge that confirmed workers will be stopped")
        boolean confirm;

        @Override
        FleetReport execute(FleetSession session, List<Worker> workers) {
            return session.coordinator().teardownFleet(workers, session.settings().concurrency());
        }
    }

    @Command(name = "resume", description = "Operator undo of a drain: put a worker back to ACTIVE and restart folding")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Parameters(index = "1", description = "Worker id, name or address")
        String worker;

        @Option(names = {"--reason"}, required = true, description = "Why the worker goes back to work")
        String reason;

        @Option(names = {"--operator"}, description = "Operator name; defaults to the OS user")
        String operator;

        @Override
        public Integer call() {
            try (FleetSession session = parent.session(fleet)) {
                Worker target = session.workers(List.of(worker)).get(0);
                WorkerReport report = session.coordinator().resumeWorker(target, operatorName(operator), reason);
                System.out.println(report.statusLine());
                return report.outcome() == WorkerReport.Outcome.RESUMED ? ExitCodes.OK : ExitCodes.HARD_FAILURE;
            }
        }
    }

    @Command(name = "reset", description = "Operator override: move a worker to any phase, with a recorded reason")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Parameters(index = "1", description = "Worker id, name or address")
        String worker;

        @Option(names = {"--to"}, required = true, description = "Target phase, e.g. ACTIVE or DRAINING")
        String target;

        @Option(names = {"--reason"}, required = true, description = "Why the override is needed")
        String reason;

        @Option(names = {"--operator"}, description = "Operator name; defaults to the OS user")
        String operator;

        @Override
        public Integer call() {
            LifecyclePhase phase = LifecyclePhase.fromString(target);
            try (FleetSession session = parent.session(fleet)) {
                String workerId = resolveWorkerId(session, worker);
                AuditEntry entry = session.ledger().reset(workerId, phase, operatorName(operator), reason);
                System.out.println(Jsons.toJson(entry));
                return ExitCodes.OK;
            }
        }
    }

    @Command(name = "history", description = "Print ledger rows, oldest first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Option(names = {"--worker"}, description = "Only rows for this worker id")
        String worker;

        @Override
        public Integer call() {
            StateLedger ledger = new StateLedger(parent.config().ledgerFile(fleet), parent.ticker);
            for (AuditEntry entry : ledger.history(worker)) {
                System.out.println(Jsons.toCompactJson(entry));
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "verify", description = "Check the ledger hash chain")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        FleetDrainCommand parent;

        @Parameters(index = "0", description = "Fleet name")
        String fleet;

        @Override
        public Integer call() {
            StateLedger ledger = new StateLedger(parent.config().ledgerFile(fleet), parent.ticker);
            StateLedger.VerifyOutcome outcome = ledger.verify();
            System.out.println(Jsons.toJson(outcome));
            return outcome.valid() ? ExitCodes.OK : ExitCodes.HARD_FAILURE;
        }
    }

    static String operatorName(String operator) {
        return operator == null || operator.isBlank() ? System.getProperty("user.name", "operator") : operator;
    }

    static String resolveWorkerId(FleetSession session, String ref) {
        try {
            return session.registry().find(ref).map(Worker::id).orElseGet(() -> knownToLedger(session, ref));
        } catch (RegistryUnavailableException e) {
            return knownToLedger(session, ref);
        }
    }

    private static String knownToLedger(FleetSession session, String ref) {
        if (session.ledger().phases().containsKey(ref)) {
            return ref;
        }
        throw new IllegalArgumentException("unknown worker in fleet " + session.fleet() + ": " + ref);
    }

    static void printStatus(FleetSession session, List<Worker> workers, List<ObservedState> observed, boolean json) {
        if (json) {
            System.out.println(Jsons.toJson(observed));
            return;
        }
        for (int i = 0; i < workers.size(); i++) {
            Worker worker = workers.get(i);
            ObservedState state = observed.get(i);
            System.out.println(String.format("%-28s %-16s %-18s %-12s units=%-3s %s",
                    worker.id(),
                    worker.address(),
                    session.ledger().phase(worker.id()),
                    state.clientState(),
                    state.unitsInFlight() < 0 ? "?" : String.valueOf(state.unitsInFlight()),
                    state.probeError() == null ? "" : state.probeError().name()));
        }
    }
}
