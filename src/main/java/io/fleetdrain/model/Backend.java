package io.fleetdrain.model;

import java.util.Locale;

public enum Backend {
    AZURE("azure"),
    OCI("oci");

    private final String cliName;

    Backend(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static Backend fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Backend cannot be empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Backend value : values()) {
            if (value.cliName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + raw);
    }
}
