package io.fleetdrain.provider;

import io.fleetdrain.config.DrainSettings;
import io.fleetdrain.model.Backend;
import io.fleetdrain.remote.CommandRunner;

import java.util.EnumMap;
import java.util.Map;

public final class ProviderAdapters {
    private final Map<Backend, ProviderAdapter> adapters;

    public ProviderAdapters(Map<Backend, ProviderAdapter> adapters) {
        EnumMap<Backend, ProviderAdapter> copy = new EnumMap<>(Backend.class);
        for (Map.Entry<Backend, ProviderAdapter> entry : adapters.entrySet()) {
            if (entry.getValue().backend() != entry.getKey()) {
                throw new IllegalArgumentException(
                        "adapter for " + entry.getKey() + " reports backend " + entry.getValue().backend());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.adapters = copy;
    }

    public static ProviderAdapters standard(CommandRunner runner, DrainSettings settings) {
        EnumMap<Backend, ProviderAdapter> map = new EnumMap<>(Backend.class);
        map.put(Backend.AZURE, new AzureCliAdapter(runner, settings.azureResourceGroup(), settings.providerTimeoutMs()));
        map.put(Backend.OCI, new OciCliAdapter(runner, settings.ociCompartmentId(), settings.providerTimeoutMs()));
        return new ProviderAdapters(map);
    }

    public ProviderAdapter forBackend(Backend backend) {
        ProviderAdapter adapter = adapters.get(backend);
        if (adapter == null) {
            throw new IllegalStateException("No provider adapter configured for backend " + backend);
        }
        return adapter;
    }
}
