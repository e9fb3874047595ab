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

public final class AzureCliAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(AzureCliAdapter.class);
    private static final String POWER_STATE_QUERY =
            "instanceView.statuses[?starts_with(code, 'PowerState/')].code | [0]";

    private final CommandRunner runner;
    private final String resourceGroup;
    private final long timeoutMs;

    public AzureCliAdapter(CommandRunner runner, String resourceGroup, long timeoutMs) {
        if (resourceGroup == null || resourceGroup.isBlank()) {
            throw new IllegalArgumentException("Azure resource group cannot be empty");
        }
        this.runner = runner;
        this.resourceGroup = resourceGroup;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Backend backend() {
        return Backend.AZURE;
    }

    @Override
    public PowerState queryPowerState(WorkerRef ref) {
        CommandResult result = runner.run(List.of(
                "az", "vm", "get-instance-view",
                "--name", ref.resourceId(),
                "--resource-group", resourceGroup,
                "--query", POWER_STATE_QUERY,
                "-o", "tsv"
        ), timeoutMs);
        if (!result.succeeded()) {
            LOG.warn("[{}] az power-state query failed: {}", ref.name(), CliErrors.describe(result));
            return PowerState.UNKNOWN;
        }
        return mapPowerState(result.stdout());
    }

    @Override
    public ProviderResult stop(WorkerRef ref) {
        CommandResult result = runner.run(List.of(
                "az", "vm", "deallocate",
                "--name", ref.resourceId(),
                "--resource-group", resourceGroup,
                "--no-wait"
        ), timeoutMs);
        if (result.succeeded()) {
            return ProviderResult.ok("deallocate accepted for " + ref.resourceId());
        }
        return ProviderResult.failed(CliErrors.classify(result), CliErrors.describe(result));
    }

    @Override
    public List<WorkerRef> list(String filter) {
        CommandResult result = runner.run(List.of(
                "az", "vm", "list",
                "--resource-group", resourceGroup,
                "--query", "[].{name:name}",
                "-o", "json"
        ), timeoutMs);
        if (!result.succeeded()) {
            throw new ProviderException(CliErrors.classify(result), "az vm list failed: " + CliErrors.describe(result));
        }
        List<WorkerRef> out = new ArrayList<>();
        try {
            JsonNode root = Jsons.mapper().readTree(result.stdout());
            for (JsonNode vm : root) {
                String name = vm.path("name").asText("");
                if (!name.isBlank() && matches(name, filter)) {
                    out.add(new WorkerRef(Backend.AZURE, name, name));
                }
            }
        } catch (IOException e) {
            throw new ProviderException(ProviderError.PERMANENT, "az vm list returned malformed JSON: " + e.getMessage());
        }
        return out;
    }

    static PowerState mapPowerState(String raw) {
        String code = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (code.startsWith("powerstate/")) {
            code = code.substring("powerstate/".length());
        } else if (code.startsWith("vm ")) {
            code = code.substring(3);
        }
        return switch (code) {
            case "running", "starting" -> PowerState.RUNNING;
            // Powered off but still allocated: deallocation is still owed.
            case "stopped" -> PowerState.RUNNING;
            case "stopping", "deallocating" -> PowerState.STOPPING;
            case "deallocated" -> PowerState.STOPPED;
            default -> PowerState.UNKNOWN;
        };
    }

    private static boolean matches(String name, String filter) {
        return filter == null || filter.isBlank() || name.contains(filter);
    }
}
