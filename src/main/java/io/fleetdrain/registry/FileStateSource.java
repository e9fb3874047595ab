package io.fleetdrain.registry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class FileStateSource implements ProvisioningStateSource {
    private final Path file;

    public FileStateSource(Path file) {
        this.file = file;
    }

    @Override
    public Optional<String> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to read provisioning state: " + file, e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
