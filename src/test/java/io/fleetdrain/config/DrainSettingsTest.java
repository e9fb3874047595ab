package io.fleetdrain.config;

import io.fleetdrain.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class DrainSettingsTest {

    @Test
    void missingFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("fleetdrain-settings-defaults-");
        try {
            FleetDrainConfig config = FleetDrainConfig.fromRoot(root.toString());
            DrainSettings settings = DrainSettings.load(config.settingsFile(), Map.of());
            DrainSettings defaults = DrainSettings.defaults();
            Assertions.assertEquals(defaults.pollIntervalMs(), settings.pollIntervalMs());
            Assertions.assertEquals(30_000L, settings.pollIntervalMs());
            Assertions.assertEquals(1_800_000L, settings.drainTimeoutMs());
            Assertions.assertEquals("foldingadmin", settings.sshUser());
            Assertions.assertEquals("lufah finish", settings.finishCommand());
            Assertions.assertEquals("lufah fold", settings.resumeCommand());
            Assertions.assertEquals("foldingcloud-rg", settings.azureResourceGroup());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitizedAndEnvironmentWins() throws Exception {
        Path root = Files.createTempDirectory("fleetdrain-settings-file-");
        try {
            FleetDrainConfig config = FleetDrainConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "sshUser": "ops",
                      "pollIntervalMs": 10,
                      "drainTimeoutMs": 600000,
                      "concurrency": 0,
                      "baseBackoffMs": 2000,
                      "maxBackoffMs": 500,
                      "settleDelayMs": 5000,
                      "unknownKey": true
                    }
                    """, StandardCharsets.UTF_8);
            DrainSettings settings = DrainSettings.load(config.settingsFile(), Map.of(
                    "SSH_USER", "root-override",
                    "DRAIN_GRACEFUL_TIMEOUT", "90",
                    "OCI_COMPARTMENT_ID", "ocid1.compartment.oc1..abc"
            ));
            Assertions.assertEquals("root-override", settings.sshUser());
            Assertions.assertEquals(1_000L, settings.pollIntervalMs());
            Assertions.assertEquals(90_000L, settings.drainTimeoutMs());
            Assertions.assertEquals(1, settings.concurrency());
            Assertions.assertEquals(2_000L, settings.baseBackoffMs());
            Assertions.assertEquals(2_000L, settings.maxBackoffMs());
            Assertions.assertEquals(5_000L, settings.settleDelayMs());
            Assertions.assertEquals("ocid1.compartment.oc1..abc", settings.ociCompartmentId());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void nonNumericGracefulTimeoutIsIgnored() {
        DrainSettings settings = DrainSettings.defaults().withEnvironment(Map.of("DRAIN_GRACEFUL_TIMEOUT", "soon"));
        Assertions.assertEquals(DrainSettings.DEFAULT_DRAIN_TIMEOUT_MS, settings.drainTimeoutMs());
    }

    @Test
    void malformedFileIsRejected() throws Exception {
        Path root = Files.createTempDirectory("fleetdrain-settings-bad-");
        try {
            FleetDrainConfig config = FleetDrainConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> DrainSettings.load(config.settingsFile(), Map.of()));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void drainWindowOverridesOnlyWhatIsGiven() {
        DrainSettings base = DrainSettings.defaults();
        DrainSettings window = base.withDrainWindow(5_000L, null, 3);
        Assertions.assertEquals(5_000L, window.pollIntervalMs());
        Assertions.assertEquals(base.drainTimeoutMs(), window.drainTimeoutMs());
        Assertions.assertEquals(3, window.concurrency());
        Assertions.assertEquals(base.settleDelayMs(), window.settleDelayMs());
    }

    @Test
    void fleetNamesAreSanitizedIntoPaths() {
        FleetDrainConfig config = FleetDrainConfig.fromRoot("/tmp/fd-root");
        Assertions.assertEquals("east-fleet", FleetDrainConfig.sanitizeFleetName(" East Fleet "));
        Assertions.assertEquals("fleet.hidden", FleetDrainConfig.sanitizeFleetName(".hidden"));
        Assertions.assertTrue(config.ledgerFile("east").endsWith(Path.of("fleets", "east", "ledger.jsonl")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> FleetDrainConfig.sanitizeFleetName(" "));
    }
}
