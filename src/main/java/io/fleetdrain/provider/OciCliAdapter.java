package io.fleetdrain.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetdrain.model.Backend;
import io.fleetdrain.model.PowerState;
import io.fleetdrain.model.WorkerRef;
import io.fleetdrain.remote.CommandResult;
import io.fleetdrain.remote.CommandRunner;
import io.fleetdrain.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class OciCliAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(OciCliAdapter.class);

    private final CommandRunner runner;
    private final String compartmentId;
    private final long timeoutMs;

    public OciCliAdapter(CommandRunner runner, String compartmentId, long timeoutMs) {
        this.runner = runner;
        this.compartmentId = compartmentId == null ? "" : compartmentId.trim();
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Backend backend() {
        return Backend.OCI;
    }

    @Override
    public PowerState queryPowerState(WorkerRef ref) {
        if (!looksLikeOcid(ref.resourceId())) {
            LOG.warn("[{}] no instance OCID recorded (resource id '{}')", ref.name(), ref.resourceId());
            return PowerState.UNKNOWN;
        }
        CommandResult result = runner.run(List.of(
                "oci", "compute", "instance", "get",
                "--instance-id", ref.resourceId(),
                "--query", "data.\"lifecycle-state\"",
                "--raw-output"
        ), timeoutMs);
        if (!result.succeeded()) {
            LOG.warn("[{}] oci power-state query failed: {}", ref.name(), CliErrors.describe(result));
            return PowerState.UNKNOWN;
        }
        return mapLifecycleState(result.stdout());
    }

    @Override
    public ProviderResult stop(WorkerRef ref) {
        if (!looksLikeOcid(ref.resourceId())) {
            return ProviderResult.failed(ProviderError.PERMANENT,
                    "no instance OCID recorded for " + ref.name() + "; stop it from the console");
        }
        CommandResult result = runner.run(List.of(
                "oci", "compute", "instance", "action",
                "--instance-id", ref.resourceId(),
                "--action", "SOFTSTOP"
        ), timeoutMs);
        if (result.succeeded()) {
            return ProviderResult.ok("SOFTSTOP accepted for " + ref.resourceId());
        }
        return ProviderResult.failed(CliErrors.classify(result), CliErrors.describe(result));
    }

    @Override
    public List<WorkerRef> list(String filter) {
        if (compartmentId.isBlank()) {
            throw new ProviderException(ProviderError.PERMANENT, "OCI_COMPARTMENT_ID is not configured");
        }
        CommandResult result = runner.run(List.of(
                "oci", "compute", "instance", "list",
                "--compartment-id", compartmentId,
                "--all",
                "--query", "data[?\"lifecycle-state\" != 'TERMINATED'].{name:\"display-name\", id:id}",
                "--output", "json"
        ), timeoutMs);
        if (!result.succeeded()) {
            throw new ProviderException(CliErrors.classify(result), "oci instance list failed: " + CliErrors.describe(result));
        }
        List<WorkerRef> out = new ArrayList<>();
        if (result.stdout().isBlank()) {
            return out;
        }
        try {
            JsonNode root = Jsons.mapper().readTree(result.stdout());
            for (JsonNode instance : root) {
                String name = instance.path("name").asText("");
                String id = instance.path("id").asText("");
                if (!name.isBlank() && (filter == null || filter.isBlank() || name.contains(filter))) {
                    out.add(new WorkerRef(Backend.OCI, name, id.isBlank() ? name : id));
                }
            }
        } catch (IOException e) {
            throw new ProviderException(ProviderError.PERMANENT, "oci instance list returned malformed JSON: " + e.getMessage());
        }
        return out;
    }

    static PowerState mapLifecycleState(String raw) {
        String state = raw == null ? "" : raw.trim().replace("\"", "").toUpperCase(Locale.ROOT);
        return switch (state) {
            case "RUNNING", "STARTING" -> PowerState.RUNNING;
            case "STOPPING", "TERMINATING" -> PowerState.STOPPING;
            case "STOPPED", "TERMINATED" -> PowerState.STOPPED;
            default -> PowerState.UNKNOWN;
        };
    }

    private static boolean looksLikeOcid(String value) {
        return value != null && value.startsWith("ocid1.");
    }
}
