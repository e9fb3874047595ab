package io.fleetdrain.provider;

import io.fleetdrain.model.Backend;
import io.fleetdrain.model.PowerState;
import io.fleetdrain.model.WorkerRef;

import java.util.List;

public interface ProviderAdapter {
    Backend backend();

    PowerState queryPowerState(WorkerRef ref);

    ProviderResult stop(WorkerRef ref);

    List<WorkerRef> list(String filter);
}
