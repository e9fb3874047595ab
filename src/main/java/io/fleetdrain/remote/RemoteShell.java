package io.fleetdrain.remote;

public interface RemoteShell {
    RemoteResult execute(String address, String command, long connectTimeoutMs, long commandTimeoutMs);
}
