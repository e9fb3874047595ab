package io.fleetdrain.remote;

import java.util.List;

public interface CommandRunner {
    CommandResult run(List<String> command, long timeoutMs);
}
