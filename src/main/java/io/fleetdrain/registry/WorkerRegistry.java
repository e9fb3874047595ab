package io.fleetdrain.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetdrain.model.Worker;
import io.fleetdrain.util.Jsons;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public final class WorkerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerRegistry.class);

    private final ProvisioningStateSource source;
    private final Ticker ticker;
    private List<Worker> snapshot;

    public WorkerRegistry(ProvisioningStateSource source, Ticker ticker) {
        this.source = source;
        this.ticker = ticker;
    }

    public synchronized List<Worker> snapshot() {
        if (snapshot != null) {
            return snapshot;
        }
        Optional<String> raw = source.read();
        if (raw.isEmpty() || raw.get().isBlank()) {
            throw new RegistryUnavailableException("No recorded provisioning state at " + source.describe());
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(raw.get());
        } catch (IOException e) {
            throw new RegistryUnavailableException("Malformed provisioning state at " + source.describe(), e);
        }
        List<Worker> workers = ProvisioningOutputParser.parse(root, ticker.now());
        if (workers.isEmpty()) {
            throw new RegistryUnavailableException("Provisioning state at " + source.describe() + " lists no workers");
        }
        snapshot = List.copyOf(workers);
        LOG.info("Fleet snapshot from {}: {} worker(s)", source.describe(), snapshot.size());
        return snapshot;
    }

    public Optional<Worker> find(String idOrAddress) {
        for (Worker worker : snapshot()) {
            if (worker.id().equals(idOrAddress)
                    || worker.address().equals(idOrAddress)
                    || worker.displayName().equals(idOrAddress)) {
                return Optional.of(worker);
            }
        }
        return Optional.empty();
    }
}
