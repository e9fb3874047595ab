package io.fleetdrain.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetdrain.model.Backend;
import io.fleetdrain.model.Worker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class ProvisioningOutputParser {
    private ProvisioningOutputParser() {
    }

    static List<Worker> parse(JsonNode root, Instant registeredAt) {
        if (root == null || !root.isObject()) {
            throw new RegistryUnavailableException("provisioning output is not a JSON object");
        }
        List<Tuple> tuples = root.has("workers") ? fromWorkerObjects(output(root, "workers")) : fromParallelLists(root);
        return toWorkers(tuples, registeredAt);
    }

    private static List<Tuple> fromWorkerObjects(JsonNode workers) {
        if (!workers.isArray()) {
            throw new RegistryUnavailableException("'workers' output must be a list");
        }
        List<Tuple> out = new ArrayList<>();
        for (JsonNode node : workers) {
            out.add(new Tuple(
                    firstText(node, "name", "display_name"),
                    firstText(node, "address", "public_ip", "ip"),
                    firstText(node, "backend", "provider"),
                    firstText(node, "resource_id", "id", "ocid")
            ));
        }
        return out;
    }

    private static List<Tuple> fromParallelLists(JsonNode root) {
        JsonNode names = output(root, "worker_names");
        JsonNode addresses = root.has("worker_public_ips") ? output(root, "worker_public_ips") : output(root, "worker_ips");
        JsonNode resourceIds = output(root, "worker_resource_ids");
        String backend = output(root, "provider").asText("");
        if (!addresses.isArray() || addresses.isEmpty()) {
            throw new RegistryUnavailableException("provisioning output has no worker addresses");
        }
        if (names.isArray() && names.size() != addresses.size()) {
            throw new RegistryUnavailableException(
                    "worker_names has " + names.size() + " entries but addresses has " + addresses.size());
        }
        List<Tuple> out = new ArrayList<>();
        for (int i = 0; i < addresses.size(); i++) {
            out.add(new Tuple(
                    names.isArray() ? names.get(i).asText("") : "",
                    addresses.get(i).asText(""),
                    backend,
                    resourceIds.isArray() && i < resourceIds.size() ? resourceIds.get(i).asText("") : ""
            ));
        }
        return out;
    }

    private static List<Worker> toWorkers(List<Tuple> tuples, Instant registeredAt) {
        Map<String, Integer> nameCounts = new HashMap<>();
        for (Tuple t : tuples) {
            if (!t.name().isBlank()) {
                nameCounts.merge(t.name(), 1, Integer::sum);
            }
        }
        Set<String> addresses = new HashSet<>();
        List<Worker> workers = new ArrayList<>();
        for (Tuple t : tuples) {
            if (t.address().isBlank()) {
                throw new RegistryUnavailableException("worker entry without address: " + t.name());
            }
            if (!addresses.add(t.address())) {
                throw new RegistryUnavailableException("duplicate worker address: " + t.address());
            }
            Backend backend;
            try {
                backend = Backend.fromString(t.backend());
            } catch (IllegalArgumentException e) {
                throw new RegistryUnavailableException("worker " + t.address() + ": " + e.getMessage(), e);
            }
            String name = t.name().isBlank() ? t.address() : t.name();
            String id = nameCounts.getOrDefault(name, 0) > 1 ? name + "@" + t.address() : name;
            workers.add(new Worker(id, backend, t.address(), name, t.resourceId(), registeredAt));
        }
        return workers;
    }

    private static JsonNode output(JsonNode root, String key) {
        JsonNode node = root.path(key);
        return node.has("value") ? node.path("value") : node;
    }

    private static String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && !value.asText("").isBlank()) {
                return value.asText().trim();
            }
        }
        return "";
    }

    private record Tuple(String name, String address, String backend, String resourceId) {
    }
}
