package io.fleetdrain.cli;

import io.fleetdrain.coordinator.FleetReport;

public final class ExitCodes {
    public static final int OK = FleetReport.EXIT_OK;
    public static final int HARD_FAILURE = FleetReport.EXIT_HARD_FAILURE;
    public static final int USAGE = 2;
    public static final int PARTIAL_FAILURE = FleetReport.EXIT_PARTIAL_FAILURE;

    private ExitCodes() {
    }
}
