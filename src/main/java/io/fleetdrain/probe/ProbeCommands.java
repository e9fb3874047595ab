package io.fleetdrain.probe;

import io.fleetdrain.config.DrainSettings;

public record ProbeCommands(String liveness, String state, String units, String finish, String resume) {
    public static ProbeCommands from(DrainSettings settings) {
        return new ProbeCommands(
                settings.livenessCommand(),
                settings.stateCommand(),
                settings.unitsCommand(),
                settings.finishCommand(),
                settings.resumeCommand()
        );
    }
}
