package io.fleetdrain;

import io.fleetdrain.cli.FleetDrainCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = FleetDrainCommand.commandLine(new FleetDrainCommand()).execute(args);
        System.exit(code);
    }
}
