package io.fleetdrain.cli;

import io.fleetdrain.config.DrainSettings;
import io.fleetdrain.config.FleetDrainConfig;
import io.fleetdrain.coordinator.DrainCoordinator;
import io.fleetdrain.ledger.StateLedger;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.Worker;
import io.fleetdrain.probe.ProbeCommands;
import io.fleetdrain.probe.StatusProbe;
import io.fleetdrain.provider.ProviderAdapters;
import io.fleetdrain.registry.FileStateSource;
import io.fleetdrain.registry.ProvisioningStateSource;
import io.fleetdrain.registry.TerraformOutputSource;
import io.fleetdrain.registry.WorkerRegistry;
import io.fleetdrain.remote.CommandRunner;
import io.fleetdrain.remote.RemoteShell;
import io.fleetdrain.remote.SshRemoteShell;
import io.fleetdrain.safety.SafetyGate;
import io.fleetdrain.util.CancellationToken;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class FleetSession implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(FleetSession.class);

    private final String fleet;
    private final DrainSettings settings;
    private final Ticker ticker;
    private final CancellationToken token;
    private final WorkerRegistry registry;
    private final StateLedger ledger;
    private final StatusProbe probe;
    private final ProviderAdapters adapters;
    private final DrainCoordinator coordinator;
    private final CountDownLatch finished;
    private Thread shutdownHook;

    FleetSession(FleetDrainConfig config, String fleet, DrainSettings settings, CommandRunner runner, Ticker ticker) {
        this.fleet = FleetDrainConfig.sanitizeFleetName(fleet);
        this.settings = settings;
        this.ticker = ticker;
        this.token = new CancellationToken();
        this.registry = new WorkerRegistry(stateSource(config, this.fleet, settings, runner), ticker);
        this.ledger = new StateLedger(config.ledgerFile(this.fleet), ticker);
        RemoteShell shell = new SshRemoteShell(runner, settings.sshUser(), settings.sshKeyPath());
        this.probe = new StatusProbe(shell, ProbeCommands.from(settings), settings.commandTimeoutMs(), ticker);
        this.adapters = ProviderAdapters.standard(runner, settings);
        SafetyGate gate = new SafetyGate(probe, ledger, ticker, settings.settleDelayMs(), settings.connectTimeoutMs());
        this.coordinator = new DrainCoordinator(ledger, probe, gate, adapters, shell, settings, ticker, token);
        this.finished = new CountDownLatch(1);
    }

    private static ProvisioningStateSource stateSource(
            FleetDrainConfig config,
            String fleet,
            DrainSettings settings,
            CommandRunner runner
    ) {
        if (settings.terraformRoot() != null && !settings.terraformRoot().isBlank()) {
            Path root = Paths.get(settings.terraformRoot());
            Path perFleet = root.resolve(fleet);
            Path dir = Files.isDirectory(perFleet) ? perFleet : root;
            return new TerraformOutputSource(runner, dir, settings.providerTimeoutMs());
        }
        return new FileStateSource(config.fleetStateFile(fleet));
    }

    String fleet() {
        return fleet;
    }

    DrainSettings settings() {
        return settings;
    }

    WorkerRegistry registry() {
        return registry;
    }

    StateLedger ledger() {
        return ledger;
    }

    StatusProbe probe() {
        return probe;
    }

    ProviderAdapters adapters() {
        return adapters;
    }

    DrainCoordinator coordinator() {
        return coordinator;
    }

    CancellationToken token() {
        return token;
    }

    Ticker ticker() {
        return ticker;
    }

    List<Worker> workers(List<String> only) {
        List<Worker> all = registry.snapshot();
        if (only == null || only.isEmpty()) {
            return all;
        }
        List<Worker> out = new ArrayList<>();
        for (String ref : only) {
            Worker worker = registry.find(ref).orElseThrow(() ->
                    new IllegalArgumentException("worker not in fleet " + fleet + ": " + ref));
            if (!out.contains(worker)) {
                out.add(worker);
            }
        }
        return out;
    }

    List<ObservedState> probeAll(List<Worker> workers) {
        if (workers.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(settings.concurrency(), workers.size())));
        try {
            List<Future<ObservedState>> futures = new ArrayList<>();
            for (Worker worker : workers) {
                futures.add(pool.submit(() -> probe.probe(worker, settings.connectTimeoutMs())));
            }
            List<ObservedState> out = new ArrayList<>();
            for (int i = 0; i < workers.size(); i++) {
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    out.add(ObservedState.unknown(workers.get(i).id(), ticker.now(), null,
                            "probe failed: " + cause.getMessage()));
                }
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while probing fleet " + fleet, e);
        } finally {
            pool.shutdownNow();
        }
    }

    void installShutdownHook() {
        long graceMs = settings.connectTimeoutMs() + settings.commandTimeoutMs();
        shutdownHook = new Thread(() -> {
            token.cancel("shutdown signal");
            LOG.warn("Shutdown requested; cancelling fleet {} session", fleet);
            try {
                finished.await(graceMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }, "fleetdrain-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    @Override
    public void close() {
        finished.countDown();
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                LOG.debug("Shutdown already in progress for fleet {}", fleet);
            }
            shutdownHook = null;
        }
    }
}
