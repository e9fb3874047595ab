package io.fleetdrain.probe;

import io.fleetdrain.config.DrainSettings;
import io.fleetdrain.model.Backend;
import io.fleetdrain.model.ClientState;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.ProbeError;
import io.fleetdrain.model.Worker;
import io.fleetdrain.remote.CommandResult;
import io.fleetdrain.remote.ProcessCommandRunner;
import io.fleetdrain.remote.RemoteResult;
import io.fleetdrain.remote.RemoteShell;
import io.fleetdrain.support.ManualTicker;
import io.fleetdrain.support.SimulatedClient;
import io.fleetdrain.support.SimulatedFleetShell;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class StatusProbeTest {
    private static final Worker WORKER = new Worker("fold-1", Backend.AZURE, "10.0.0.4", "fold-1", null, Instant.EPOCH);

    private static StatusProbe probe(SimulatedFleetShell shell) {
        return new StatusProbe(shell, ProbeCommands.from(DrainSettings.defaults()), 30_000L, new ManualTicker());
    }

    @Test
    void reportsRunningClientWithUnits() {
        SimulatedFleetShell shell = new SimulatedFleetShell().with("10.0.0.4", SimulatedClient.neverPauses());
        ObservedState state = probe(shell).probe(WORKER, 10_000L);
        Assertions.assertTrue(state.reachable());
        Assertions.assertEquals(ClientState.RUNNING, state.clientState());
        Assertions.assertEquals(2, state.unitsInFlight());
        Assertions.assertNull(state.probeError());
        Assertions.assertFalse(state.pausedAndIdle());
    }

    @Test
    void reportsPausedAndIdle() {
        SimulatedFleetShell shell = new SimulatedFleetShell().with("10.0.0.4", SimulatedClient.alreadyPaused());
        ObservedState state = probe(shell).probe(WORKER, 10_000L);
        Assertions.assertEquals(ClientState.PAUSED, state.clientState());
        Assertions.assertEquals(0, state.unitsInFlight());
        Assertions.assertTrue(state.pausedAndIdle());
    }

    @Test
    void unreachableHostIsNeverReadAsFinished() {
        SimulatedFleetShell shell = new SimulatedFleetShell().with("10.0.0.4", SimulatedClient.unreachable());
        ObservedState state = probe(shell).probe(WORKER, 10_000L);
        Assertions.assertFalse(state.reachable());
        Assertions.assertEquals(ClientState.UNREACHABLE, state.clientState());
        Assertions.assertEquals(ProbeError.CONNECT_TIMEOUT, state.probeError());
        Assertions.assertEquals(-1, state.unitsInFlight());
        Assertions.assertFalse(state.pausedAndIdle());
    }

    @Test
    void authFailureIsUnreachable() {
        SimulatedClient client = SimulatedClient.alreadyPaused();
        client.setAuthFailure(true);
        ObservedState state = probe(new SimulatedFleetShell().with("10.0.0.4", client)).probe(WORKER, 10_000L);
        Assertions.assertFalse(state.reachable());
        Assertions.assertEquals(ProbeError.AUTH_FAILURE, state.probeError());
    }

    @Test
    void malformedStateIsUnknownWithParseError() {
        SimulatedClient client = SimulatedClient.alreadyPaused();
        client.setStateMalformed(true);
        ObservedState state = probe(new SimulatedFleetShell().with("10.0.0.4", client)).probe(WORKER, 10_000L);
        Assertions.assertTrue(state.reachable());
        Assertions.assertEquals(ClientState.UNKNOWN, state.clientState());
        Assertions.assertEquals(ProbeError.PARSE_ERROR, state.probeError());
    }

    @Test
    void failedLivenessCheckIsUnknownNotUnreachable() {
        StatusProbe probe = new StatusProbe(
                (address, command, connect, timeout) -> "true".equals(command)
                        ? new RemoteResult(RemoteResult.Outcome.COMMAND_FAILED, 1, "", "")
                        : new RemoteResult(RemoteResult.Outcome.OK, 0, "{\"paused\":true}", ""),
                ProbeCommands.from(DrainSettings.defaults()),
                30_000L,
                new ManualTicker());
        ObservedState state = probe.probe(WORKER, 10_000L);
        Assertions.assertTrue(state.reachable());
        Assertions.assertEquals(ClientState.UNKNOWN, state.clientState());
        Assertions.assertNull(state.probeError());
    }

    @Test
    void unreadableUnitCountBlocksPausedReading() {
        StatusProbe probe = new StatusProbe(
                (address, command, connect, timeout) -> command.contains("lufah units")
                        ? new RemoteResult(RemoteResult.Outcome.OK, 0, "ERROR: no client\n", "")
                        : new RemoteResult(RemoteResult.Outcome.OK, 0, "{\"paused\":true}", ""),
                ProbeCommands.from(DrainSettings.defaults()),
                30_000L,
                new ManualTicker());
        ObservedState state = probe.probe(WORKER, 10_000L);
        Assertions.assertEquals(ClientState.UNKNOWN, state.clientState());
        Assertions.assertEquals(ProbeError.PARSE_ERROR, state.probeError());
        Assertions.assertFalse(state.pausedAndIdle());
    }

    @Test
    void remoteCommandsAreCutToTheRemainingBudget() {
        ManualTicker clock = new ManualTicker();
        List<String> calls = new ArrayList<>();
        SimulatedFleetShell fleet = new SimulatedFleetShell().with("10.0.0.4", SimulatedClient.alreadyPaused());
        RemoteShell slow = (address, command, connect, timeout) -> {
            calls.add(command + " " + connect + "/" + timeout);
            long spent = Math.min(30_000L, connect + timeout);
            clock.advance(spent);
            return spent < 30_000L
                    ? new RemoteResult(RemoteResult.Outcome.CONNECT_FAILED, -1, "", "timeout")
                    : fleet.execute(address, command, connect, timeout);
        };
        StatusProbe probe = new StatusProbe(slow, ProbeCommands.from(DrainSettings.defaults()), 30_000L, clock);

        ObservedState state = probe.probe(WORKER, 10_000L, 50_000L);

        Assertions.assertEquals(List.of("true 10000/30000", "lufah state 10000/10000"), calls);
        Assertions.assertEquals(50_000L, clock.nowMs());
        Assertions.assertFalse(state.reachable());
        Assertions.assertEquals(ProbeError.CONNECT_TIMEOUT, state.probeError());
    }

    @Test
    void exhaustedBudgetSkipsRemainingCommands() {
        ManualTicker clock = new ManualTicker();
        List<String> calls = new ArrayList<>();
        RemoteShell shell = (address, command, connect, timeout) -> {
            calls.add(command);
            clock.advance(connect + timeout);
            return new RemoteResult(RemoteResult.Outcome.OK, 0, "", "");
        };
        StatusProbe probe = new StatusProbe(shell, ProbeCommands.from(DrainSettings.defaults()), 30_000L, clock);

        ObservedState state = probe.probe(WORKER, 10_000L, 40_500L);

        Assertions.assertEquals(List.of("true"), calls);
        Assertions.assertFalse(state.reachable());
        Assertions.assertTrue(state.detail().contains("budget"), state.detail());
    }

    @Test
    void defaultUnitsCommandFailsWhenTheClientCliFails(@TempDir Path dir) throws IOException {
        Path cli = fakeCli(dir, "exit 1");
        String command = DrainSettings.DEFAULT_UNITS_COMMAND.replace("lufah", cli.toString());

        CommandResult result = new ProcessCommandRunner().run(List.of("sh", "-c", command), 10_000L);

        Assertions.assertEquals(CommandResult.Status.COMPLETED, result.status());
        Assertions.assertNotEquals(0, result.exitCode());
        Assertions.assertFalse(result.stdout().trim().equals("0"), result.stdout());
    }

    @Test
    void defaultUnitsCommandCountsActiveUnits(@TempDir Path dir) throws IOException {
        Path cli = fakeCli(dir, "printf 'a RUNNING\\nb READY\\nc FINISHED\\n'");
        String command = DrainSettings.DEFAULT_UNITS_COMMAND.replace("lufah", cli.toString());

        CommandResult result = new ProcessCommandRunner().run(List.of("sh", "-c", command), 10_000L);

        Assertions.assertTrue(result.succeeded(), result.combinedOutput());
        Assertions.assertEquals("2", result.stdout().trim());
    }

    @Test
    void failingUnitsCommandIsNeverReadAsIdle(@TempDir Path dir) throws IOException {
        Path cli = fakeCli(dir, "case \"$1\" in state) echo '{\"paused\":true,\"finish\":false}' ;; *) exit 1 ;; esac");
        DrainSettings defaults = DrainSettings.defaults();
        ProbeCommands commands = new ProbeCommands(
                defaults.livenessCommand(),
                defaults.stateCommand().replace("lufah", cli.toString()),
                defaults.unitsCommand().replace("lufah", cli.toString()),
                defaults.finishCommand(),
                defaults.resumeCommand());
        ProcessCommandRunner runner = new ProcessCommandRunner();
        RemoteShell local = (address, command, connect, timeout) -> {
            CommandResult result = runner.run(List.of("sh", "-c", command), connect + timeout);
            return result.succeeded()
                    ? new RemoteResult(RemoteResult.Outcome.OK, 0, result.stdout(), result.stderr())
                    : new RemoteResult(RemoteResult.Outcome.COMMAND_FAILED, result.exitCode(), result.stdout(), result.stderr());
        };

        ObservedState state = new StatusProbe(local, commands, 10_000L, new ManualTicker()).probe(WORKER, 5_000L);

        Assertions.assertEquals(ClientState.UNKNOWN, state.clientState());
        Assertions.assertEquals(ProbeError.PARSE_ERROR, state.probeError());
        Assertions.assertFalse(state.pausedAndIdle());
    }

    private static Path fakeCli(Path dir, String body) throws IOException {
        Path cli = dir.resolve("fake-lufah");
        Files.writeString(cli, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Assertions.assertTrue(cli.toFile().setExecutable(true));
        return cli;
    }
}
