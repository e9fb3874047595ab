package io.fleetdrain.remote;

import java.util.List;
import java.util.Locale;

public final class SshRemoteShell implements RemoteShell {
    private static final int SSH_ERROR_EXIT = 255;
    private static final List<String> AUTH_MARKERS = List.of(
            "permission denied",
            "host key verification failed",
            "too many authentication failures",
            "no supported authentication methods"
    );

    private final CommandRunner runner;
    private final String user;
    private final String keyPath;

    public SshRemoteShell(CommandRunner runner, String user, String keyPath) {
        this.runner = runner;
        this.user = user;
        this.keyPath = keyPath;
    }

    @Override
    public RemoteResult execute(String address, String command, long connectTimeoutMs, long commandTimeoutMs) {
        long connectSeconds = Math.max(1L, (connectTimeoutMs + 999L) / 1_000L);
        CommandResult result = runner.run(List.of(
                "ssh",
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=no",
                "-o", "LogLevel=ERROR",
                "-o", "ConnectTimeout=" + connectSeconds,
                "-i", keyPath,
                user + "@" + address,
                command
        ), connectTimeoutMs + commandTimeoutMs);
        return classify(result);
    }

    static RemoteResult classify(CommandResult result) {
        switch (result.status()) {
            case TIMED_OUT:
                return new RemoteResult(RemoteResult.Outcome.CONNECT_FAILED, -1, "", result.stderr());
            case SPAWN_FAILED:
                return new RemoteResult(RemoteResult.Outcome.CONNECT_FAILED, -1, "", result.stderr());
            default:
                break;
        }
        if (result.exitCode() == 0) {
            return new RemoteResult(RemoteResult.Outcome.OK, 0, result.stdout(), result.stderr());
        }
        if (result.exitCode() == SSH_ERROR_EXIT) {
            String err = result.stderr().toLowerCase(Locale.ROOT);
            for (String marker : AUTH_MARKERS) {
                if (err.contains(marker)) {
                    return new RemoteResult(RemoteResult.Outcome.AUTH_FAILED, SSH_ERROR_EXIT, result.stdout(), result.stderr());
                }
            }
            return new RemoteResult(RemoteResult.Outcome.CONNECT_FAILED, SSH_ERROR_EXIT, result.stdout(), result.stderr());
        }
        return new RemoteResult(RemoteResult.Outcome.COMMAND_FAILED, result.exitCode(), result.stdout(), result.stderr());
    }
}
