package io.fleetdrain.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final int MAX_OUTPUT_CHARS = 256 * 1024;

    @Override
    public CommandResult run(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long effectiveTimeoutMs = Math.max(1_000L, timeoutMs);
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            // Output is captured to files, not pipes; large output never stalls the child.
            stdoutFile = Files.createTempFile("fleetdrain-out-", ".log");
            stderrFile = Files.createTempFile("fleetdrain-err-", ".log");
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            try {
                process = pb.start();
            } catch (IOException e) {
                LOG.debug("spawn failed for {}: {}", command.get(0), e.getMessage());
                return CommandResult.spawnFailed("spawn failed: " + e.getMessage());
            }

            boolean finished = process.waitFor(effectiveTimeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CommandResult.timedOut("timeout after " + Duration.ofMillis(effectiveTimeoutMs));
            }
            return CommandResult.completed(
                    process.exitValue(),
                    truncate(Files.readString(stdoutFile, StandardCharsets.UTF_8)),
                    truncate(Files.readString(stderrFile, StandardCharsets.UTF_8))
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return CommandResult.timedOut("interrupted while waiting for " + command.get(0));
        } catch (IOException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            return CommandResult.spawnFailed("process i/o failed: " + e.getMessage());
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static File nullDevice() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return new File(os.contains("win") ? "NUL" : "/dev/null");
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.strip();
        if (trimmed.length() <= MAX_OUTPUT_CHARS) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_OUTPUT_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
