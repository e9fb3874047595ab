package io.fleetdrain.remote;

public record CommandResult(
        Status status,
        int exitCode,
        String stdout,
        String stderr
) {
    public enum Status {
        COMPLETED,
        TIMED_OUT,
        SPAWN_FAILED
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr) {
        return new CommandResult(Status.COMPLETED, exitCode, stdout == null ? "" : stdout, stderr == null ? "" : stderr);
    }

    public static CommandResult timedOut(String detail) {
        return new CommandResult(Status.TIMED_OUT, -1, "", detail == null ? "" : detail);
    }

    public static CommandResult spawnFailed(String detail) {
        return new CommandResult(Status.SPAWN_FAILED, -1, "", detail == null ? "" : detail);
    }

    public boolean succeeded() {
        return status == Status.COMPLETED && exitCode == 0;
    }

    public String combinedOutput() {
        if (stderr.isBlank()) {
            return stdout;
        }
        if (stdout.isBlank()) {
            return stderr;
        }
        return stdout + "\n" + stderr;
    }
}
