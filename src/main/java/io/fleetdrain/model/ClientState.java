package io.fleetdrain.model;

public enum ClientState {
    UNKNOWN,
    RUNNING,
    FINISHING,
    PAUSED,
    UNREACHABLE
}
