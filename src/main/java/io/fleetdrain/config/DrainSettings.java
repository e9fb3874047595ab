package io.fleetdrain.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fleetdrain.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public record DrainSettings(
        String sshUser,
        String sshKeyPath,
        long connectTimeoutMs,
        long commandTimeoutMs,
        String livenessCommand,
        String stateCommand,
        String unitsCommand,
        String finishCommand,
        String resumeCommand,
        long pollIntervalMs,
        long drainTimeoutMs,
        long settleDelayMs,
        int concurrency,
        int drainSignalAttempts,
        int providerAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long providerTimeoutMs,
        long stopConfirmTimeoutMs,
        long stopConfirmIntervalMs,
        String azureResourceGroup,
        String ociCompartmentId,
        String terraformRoot
) {
    private static final Logger LOG = LoggerFactory.getLogger(DrainSettings.class);

    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 1_800_000L;
    // No upstream guidance exists for how long "paused" must hold; one poll interval.
    public static final long DEFAULT_SETTLE_DELAY_MS = 30_000L;
    public static final int DEFAULT_CONCURRENCY = 8;
    public static final int DEFAULT_DRAIN_SIGNAL_ATTEMPTS = 3;
    public static final int DEFAULT_PROVIDER_ATTEMPTS = 4;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_PROVIDER_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_STOP_CONFIRM_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_STOP_CONFIRM_INTERVAL_MS = 15_000L;
    // Exits 3 when lufah fails; an empty listing still prints 0.
    public static final String DEFAULT_UNITS_COMMAND =
            "units=$(lufah units 2>/dev/null) || exit 3; printf '%s\\n' \"$units\" | grep -c 'RUNNING\\|READY' || true";

    public static DrainSettings defaults() {
        return new DrainSettings(
                "foldingadmin",
                Paths.get(System.getProperty("user.home", "."), ".ssh", "id_ed25519").toString(),
                DEFAULT_CONNECT_TIMEOUT_MS,
                DEFAULT_COMMAND_TIMEOUT_MS,
                "true",
                "lufah state",
                DEFAULT_UNITS_COMMAND,
                "lufah finish",
                "lufah fold",
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_DRAIN_TIMEOUT_MS,
                DEFAULT_SETTLE_DELAY_MS,
                DEFAULT_CONCURRENCY,
                DEFAULT_DRAIN_SIGNAL_ATTEMPTS,
                DEFAULT_PROVIDER_ATTEMPTS,
                DEFAULT_BASE_BACKOFF_MS,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_PROVIDER_TIMEOUT_MS,
                DEFAULT_STOP_CONFIRM_TIMEOUT_MS,
                DEFAULT_STOP_CONFIRM_INTERVAL_MS,
                "foldingcloud-rg",
                "",
                ""
        );
    }

    public static DrainSettings load(FleetDrainConfig config) {
        return load(config.settingsFile(), System.getenv());
    }

    public static DrainSettings load(Path settingsFile, Map<String, String> env) {
        DrainSettings resolved = defaults();
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            try {
                DrainSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), DrainSettingsFile.class);
                resolved = fromFile(file, resolved);
                LOG.debug("Loaded settings from {}", settingsFile);
            } catch (IOException e) {
                throw new IllegalStateException("Invalid settings file: " + settingsFile, e);
            }
        }
        return resolved.withEnvironment(env == null ? Map.of() : env);
    }

    static DrainSettings fromFile(DrainSettingsFile file, DrainSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new DrainSettings(
                sanitizeText(file.sshUser(), defaults.sshUser()),
                sanitizeText(file.sshKeyPath(), defaults.sshKeyPath()),
                sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 1_000L),
                sanitizeLong(file.commandTimeoutMs(), defaults.commandTimeoutMs(), 1_000L),
                sanitizeText(file.livenessCommand(), defaults.livenessCommand()),
                sanitizeText(file.stateCommand(), defaults.stateCommand()),
                sanitizeText(file.unitsCommand(), defaults.unitsCommand()),
                sanitizeText(file.finishCommand(), defaults.finishCommand()),
                sanitizeText(file.resumeCommand(), defaults.resumeCommand()),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 1_000L),
                sanitizeLong(file.drainTimeoutMs(), defaults.drainTimeoutMs(), 1_000L),
                sanitizeLong(file.settleDelayMs(), defaults.settleDelayMs(), 0L),
                sanitizeInt(file.concurrency(), defaults.concurrency(), 1),
                sanitizeInt(file.drainSignalAttempts(), defaults.drainSignalAttempts(), 1),
                sanitizeInt(file.providerAttempts(), defaults.providerAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.providerTimeoutMs(), defaults.providerTimeoutMs(), 1_000L),
                sanitizeLong(file.stopConfirmTimeoutMs(), defaults.stopConfirmTimeoutMs(), 0L),
                sanitizeLong(file.stopConfirmIntervalMs(), defaults.stopConfirmIntervalMs(), 1_000L),
                sanitizeText(file.azureResourceGroup(), defaults.azureResourceGroup()),
                sanitizeText(file.ociCompartmentId(), defaults.ociCompartmentId()),
                sanitizeText(file.terraformRoot(), defaults.terraformRoot())
        );
    }

    DrainSettings withEnvironment(Map<String, String> env) {
        long drainTimeout = drainTimeoutMs;
        String gracefulTimeout = env.get("DRAIN_GRACEFUL_TIMEOUT");
        if (gracefulTimeout != null && !gracefulTimeout.isBlank()) {
            try {
                drainTimeout = Math.max(1L, Long.parseLong(gracefulTimeout.trim())) * 1_000L;
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric DRAIN_GRACEFUL_TIMEOUT={}", gracefulTimeout);
            }
        }
        return new DrainSettings(
                sanitizeText(env.get("SSH_USER"), sshUser),
                sanitizeText(env.get("SSH_PRIVATE_KEY_PATH"), sshKeyPath),
                connectTimeoutMs,
                commandTimeoutMs,
                livenessCommand,
                stateCommand,
                unitsCommand,
                finishCommand,
                resumeCommand,
                pollIntervalMs,
                drainTimeout,
                settleDelayMs,
                concurrency,
                drainSignalAttempts,
                providerAttempts,
                baseBackoffMs,
                maxBackoffMs,
                providerTimeoutMs,
                stopConfirmTimeoutMs,
                stopConfirmIntervalMs,
                sanitizeText(env.get("AZURE_RESOURCE_GROUP"), azureResourceGroup),
                sanitizeText(env.get("OCI_COMPARTMENT_ID"), ociCompartmentId),
                terraformRoot
        );
    }

    public DrainSettings withDrainWindow(Long intervalMs, Long timeoutMs, Integer parallelism) {
        return new DrainSettings(
                sshUser,
                sshKeyPath,
                connectTimeoutMs,
                commandTimeoutMs,
                livenessCommand,
                stateCommand,
                unitsCommand,
                finishCommand,
                resumeCommand,
                sanitizeLong(intervalMs, pollIntervalMs, 1L),
                sanitizeLong(timeoutMs, drainTimeoutMs, 1L),
                settleDelayMs,
                sanitizeInt(parallelism, concurrency, 1),
                drainSignalAttempts,
                providerAttempts,
                baseBackoffMs,
                maxBackoffMs,
                providerTimeoutMs,
                stopConfirmTimeoutMs,
                stopConfirmIntervalMs,
                azureResourceGroup,
                ociCompartmentId,
                terraformRoot
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DrainSettingsFile(
            String sshUser,
            String sshKeyPath,
            Long connectTimeoutMs,
            Long commandTimeoutMs,
            String livenessCommand,
            String stateCommand,
            String unitsCommand,
            String finishCommand,
            String resumeCommand,
            Long pollIntervalMs,
            Long drainTimeoutMs,
            Long settleDelayMs,
            Integer concurrency,
            Integer drainSignalAttempts,
            Integer providerAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long providerTimeoutMs,
            Long stopConfirmTimeoutMs,
            Long stopConfirmIntervalMs,
            String azureResourceGroup,
            String ociCompartmentId,
            String terraformRoot
    ) {
    }
}
