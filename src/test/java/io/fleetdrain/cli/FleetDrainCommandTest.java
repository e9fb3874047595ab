package io.fleetdrain.cli;

import io.fleetdrain.ledger.StateLedger;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.remote.CommandResult;
import io.fleetdrain.remote.RemoteResult;
import io.fleetdrain.support.ManualTicker;
import io.fleetdrain.support.RecordingRunner;
import io.fleetdrain.support.SimulatedClient;
import io.fleetdrain.support.SimulatedFleetShell;
import io.fleetdrain.support.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

final class FleetDrainCommandTest {
    private Path root;
    private PrintStream originalOut;
    private ByteArrayOutputStream out;
    private StringWriter err;
    private final SimulatedFleetShell fleet = new SimulatedFleetShell();
    private final Set<String> deallocated = ConcurrentHashMap.newKeySet();
    private final ManualTicker ticker = new ManualTicker();
    private RecordingRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("fleetdrain-cli-");
        originalOut = System.out;
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        err = new StringWriter();
        runner = new RecordingRunner(this::respond);
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        TestFiles.deleteRecursively(root);
    }

    @Test
    void teardownStopsEveryPausedWorker() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.pausesAfter(1));
        fleet.with("20.1.1.2", SimulatedClient.pausesAfter(0));

        int code = run("teardown", "lab", "--concurrency", "1", "--confirm");

        Assertions.assertEquals(ExitCodes.OK, code, output());
        Assertions.assertTrue(output().contains("teardown: 2 worker(s), 2 ok"), output());
        Assertions.assertEquals(Set.of("fold-1", "fold-2"), deallocated);
        long deallocations = runner.commands().stream()
                .filter(c -> c.size() > 2 && c.get(0).equals("az") && c.get(2).equals("deallocate"))
                .count();
        Assertions.assertEquals(2L, deallocations);

        StateLedger ledger = ledger("lab");
        Assertions.assertEquals(LifecyclePhase.STOPPED, ledger.phase("fold-1"));
        Assertions.assertEquals(LifecyclePhase.STOPPED, ledger.phase("fold-2"));

        out.reset();
        Assertions.assertEquals(ExitCodes.OK, run("verify", "lab"));
        Assertions.assertTrue(output().contains("\"valid\""), output());
    }

    @Test
    void teardownWithoutConfirmTouchesNothing() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.alreadyPaused());
        fleet.with("20.1.1.2", SimulatedClient.alreadyPaused());

        int code = run("teardown", "lab");

        Assertions.assertEquals(ExitCodes.USAGE, code);
        Assertions.assertTrue(err.toString().contains("--confirm"), err.toString());
        Assertions.assertTrue(runner.commands().isEmpty(), String.valueOf(runner.commands()));
        Assertions.assertTrue(deallocated.isEmpty());
        Assertions.assertEquals(0, fleet.client("20.1.1.1").finishCalls());
    }

    @Test
    void resumeSendsFoldAndRecordsOperatorReset() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.pausesAfter(0));
        Assertions.assertEquals(ExitCodes.OK, run("drain", "lab", "--worker", "fold-1"));
        Assertions.assertEquals(LifecyclePhase.PAUSED_CONFIRMED, ledger("lab").phase("fold-1"));

        int code = run("resume", "lab", "fold-1", "--reason", "more work queued", "--operator", "ops");

        Assertions.assertEquals(ExitCodes.OK, code, err.toString());
        Assertions.assertTrue(output().contains("RESUMED"), output());
        Assertions.assertEquals(1, fleet.client("20.1.1.1").foldCalls());
        Assertions.assertEquals(LifecyclePhase.ACTIVE, ledger("lab").phase("fold-1"));

        out.reset();
        run("history", "lab", "--worker", "fold-1");
        String history = output();
        Assertions.assertTrue(history.contains("RESET"), history);
        Assertions.assertTrue(history.contains("more work queued"), history);
        Assertions.assertTrue(history.contains("ops"), history);
    }

    @Test
    void resumeIsRefusedOnceStopped() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.alreadyPaused());
        Assertions.assertEquals(ExitCodes.OK, run("teardown", "lab", "--worker", "fold-1", "--confirm"));

        int code = run("resume", "lab", "fold-1", "--reason", "changed my mind");

        Assertions.assertEquals(ExitCodes.HARD_FAILURE, code);
        Assertions.assertTrue(output().contains("STOP_IN_PROGRESS"), output());
        Assertions.assertEquals(0, fleet.client("20.1.1.1").foldCalls());
        Assertions.assertEquals(LifecyclePhase.STOPPED, ledger("lab").phase("fold-1"));
    }

    @Test
    void statusOneExitCodeReportsClientHealth() {
        fleet.with("20.1.1.1", SimulatedClient.alreadyPaused());

        Assertions.assertEquals(ExitCodes.OK, run("status-one", "20.1.1.1"));
        Assertions.assertTrue(output().contains("PAUSED"), output());

        out.reset();
        Assertions.assertEquals(ExitCodes.HARD_FAILURE, run("status-one", "20.9.9.9"));
        Assertions.assertTrue(output().contains("UNREACHABLE"), output());
    }

    @Test
    void unreachableWorkerMakesDrainPartial() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.pausesAfter(0));

        int code = run("drain", "lab", "--concurrency", "1", "--timeout", "120", "--interval", "30");

        Assertions.assertEquals(ExitCodes.PARTIAL_FAILURE, code, output());
        Assertions.assertTrue(output().contains("DRAIN_SIGNAL_FAILED"), output());
        Assertions.assertTrue(runner.commands().stream().noneMatch(c -> c.get(0).equals("az")));
        StateLedger ledger = ledger("lab");
        Assertions.assertEquals(LifecyclePhase.PAUSED_CONFIRMED, ledger.phase("fold-1"));
        Assertions.assertEquals(LifecyclePhase.DRAIN_REQUESTED, ledger.phase("fold-2"));
    }

    @Test
    void workerFilterRestrictsTheRun() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.pausesAfter(0));

        int code = run("drain", "lab", "--worker", "20.1.1.1");

        Assertions.assertEquals(ExitCodes.OK, code, output());
        Assertions.assertTrue(output().contains("drain: 1 worker(s)"), output());
        Assertions.assertEquals(LifecyclePhase.ACTIVE, ledger("lab").phase("fold-2"));
    }

    @Test
    void unknownWorkerFilterFails() throws Exception {
        writeFleet("lab");

        int code = run("drain", "lab", "--worker", "fold-7");

        Assertions.assertEquals(ExitCodes.HARD_FAILURE, code);
        Assertions.assertTrue(err.toString().contains("fold-7"), err.toString());
    }

    @Test
    void missingProvisioningStateIsAHardFailure() {
        int code = run("teardown", "nowhere", "--confirm");

        Assertions.assertEquals(ExitCodes.HARD_FAILURE, code);
        Assertions.assertTrue(err.toString().contains("No recorded provisioning state"), err.toString());
        Assertions.assertTrue(runner.commands().isEmpty());
    }

    @Test
    void badUsageExitsWithUsageCode() {
        Assertions.assertEquals(ExitCodes.USAGE, run("drain"));
        Assertions.assertEquals(ExitCodes.USAGE, run("drain", "lab", "--concurrency", "many"));
        Assertions.assertEquals(ExitCodes.USAGE, run("reset", "lab", "fold-1", "--to", "ACTIVE"));
    }

    @Test
    void resetMovesWorkerBackWithRecordedReason() throws Exception {
        writeFleet("lab");
        fleet.with("20.1.1.1", SimulatedClient.pausesAfter(0));
        run("drain", "lab", "--concurrency", "1", "--timeout", "60");
        Assertions.assertEquals(LifecyclePhase.DRAIN_REQUESTED, ledger("lab").phase("fold-2"));

        int code = run("reset", "lab", "fold-2", "--to", "ACTIVE", "--reason", "host rebuilt", "--operator", "ops");

        Assertions.assertEquals(ExitCodes.OK, code, err.toString());
        Assertions.assertEquals(LifecyclePhase.ACTIVE, ledger("lab").phase("fold-2"));

        out.reset();
        Assertions.assertEquals(ExitCodes.OK, run("history", "lab", "--worker", "fold-2"));
        String history = output();
        Assertions.assertTrue(history.contains("host rebuilt"), history);
        Assertions.assertTrue(history.contains("RESET"), history);
    }

    @Test
    void listShowsRecordedPhases() throws Exception {
        writeFleet("lab");

        Assertions.assertEquals(ExitCodes.OK, run("list", "lab"));

        String listed = output();
        Assertions.assertTrue(listed.contains("fold-1"), listed);
        Assertions.assertTrue(listed.contains("20.1.1.2"), listed);
        Assertions.assertTrue(listed.contains("ACTIVE"), listed);
    }

    private int run(String... args) {
        FleetDrainCommand command = new FleetDrainCommand();
        command.runner = runner;
        command.ticker = ticker;
        command.env = Map.of();
        command.installShutdownHook = false;
        String[] withRoot = new String[args.length + 2];
        withRoot[0] = "--root";
        withRoot[1] = root.toString();
        System.arraycopy(args, 0, withRoot, 2, args.length);
        return FleetDrainCommand.commandLine(command)
                .setErr(new PrintWriter(err, true))
                .execute(withRoot);
    }

    private void writeFleet(String name) throws Exception {
        Path dir = root.resolve("fleets").resolve(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("fleet-state.json"), """
                {
                  "worker_names": {"value": ["fold-1", "fold-2"]},
                  "worker_public_ips": {"value": ["20.1.1.1", "20.1.1.2"]},
                  "provider": {"value": "azure"}
                }
                """, StandardCharsets.UTF_8);
    }

    private StateLedger ledger(String name) {
        return new StateLedger(root.resolve("fleets").resolve(name).resolve("ledger.jsonl"), ticker);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private CommandResult respond(List<String> command) {
        if (command.get(0).equals("ssh")) {
            String target = command.get(command.size() - 2);
            String address = target.substring(target.indexOf('@') + 1);
            RemoteResult result = fleet.execute(address, command.get(command.size() - 1), 0L, 0L);
            return switch (result.outcome()) {
                case OK -> CommandResult.completed(0, result.output(), result.error());
                case AUTH_FAILED -> CommandResult.completed(255, "", "Permission denied (publickey).");
                case CONNECT_FAILED -> CommandResult.completed(255, "",
                        "ssh: connect to host " + address + " port 22: Connection timed out");
                default -> CommandResult.completed(result.exitCode(), result.output(), result.error());
            };
        }
        if (command.get(0).equals("az") && command.get(2).equals("get-instance-view")) {
            String name = command.get(command.indexOf("--name") + 1);
            return CommandResult.completed(0,
                    deallocated.contains(name) ? "PowerState/deallocated\n" : "PowerState/running\n", "");
        }
        if (command.get(0).equals("az") && command.get(2).equals("deallocate")) {
            deallocated.add(command.get(command.indexOf("--name") + 1));
            return CommandResult.completed(0, "", "");
        }
        return CommandResult.completed(1, "", "unexpected command " + command);
    }
}
