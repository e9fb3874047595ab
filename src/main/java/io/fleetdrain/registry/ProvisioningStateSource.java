package io.fleetdrain.registry;

import java.util.Optional;

public interface ProvisioningStateSource {
    Optional<String> read();

    String describe();
}
