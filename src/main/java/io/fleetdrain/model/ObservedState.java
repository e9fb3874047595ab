package io.fleetdrain.model;

import java.time.Instant;

public record ObservedState(
        String workerId,
        Instant timestamp,
        boolean reachable,
        ClientState clientState,
        int unitsInFlight,
        ProbeError probeError,
        String detail
) {
    public static ObservedState unreachable(String workerId, Instant at, ProbeError error, String detail) {
        return new ObservedState(workerId, at, false, ClientState.UNREACHABLE, -1, error, detail);
    }

    public static ObservedState unknown(String workerId, Instant at, ProbeError error, String detail) {
        return new ObservedState(workerId, at, true, ClientState.UNKNOWN, -1, error, detail);
    }

    public boolean pausedAndIdle() {
        return reachable && clientState == ClientState.PAUSED && unitsInFlight == 0;
    }
}
