package io.fleetdrain.model;

public enum PowerState {
    RUNNING,
    STOPPING,
    STOPPED,
    UNKNOWN
}
