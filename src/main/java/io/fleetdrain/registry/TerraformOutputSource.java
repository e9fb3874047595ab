package io.fleetdrain.registry;

import io.fleetdrain.remote.CommandResult;
import io.fleetdrain.remote.CommandRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public final class TerraformOutputSource implements ProvisioningStateSource {
    private final CommandRunner runner;
    private final Path terraformDir;
    private final long timeoutMs;

    public TerraformOutputSource(CommandRunner runner, Path terraformDir, long timeoutMs) {
        this.runner = runner;
        this.terraformDir = terraformDir;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Optional<String> read() {
        if (!Files.isDirectory(terraformDir)) {
            return Optional.empty();
        }
        CommandResult result = runner.run(
                List.of("terraform", "-chdir=" + terraformDir, "output", "-json"),
                timeoutMs
        );
        if (!result.succeeded()) {
            throw new RegistryUnavailableException(
                    "terraform output failed in " + terraformDir + ": " + result.combinedOutput());
        }
        String out = result.stdout().strip();
        if (out.isEmpty() || "{}".equals(out)) {
            return Optional.empty();
        }
        return Optional.of(out);
    }

    @Override
    public String describe() {
        return "terraform output in " + terraformDir;
    }
}
