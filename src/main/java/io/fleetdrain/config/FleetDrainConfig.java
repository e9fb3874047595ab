package io.fleetdrain.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FleetDrainConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "fleetdrain-settings.json";
    public static final String FLEETS_DIR = "fleets";
    public static final String STATE_FILE = "fleet-state.json";
    public static final String LEDGER_FILE = "ledger.jsonl";

    private final Path rootDir;

    public FleetDrainConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static FleetDrainConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new FleetDrainConfig(resolved.toAbsolutePath().normalize());
    }

    public static String sanitizeFleetName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("fleet name cannot be empty");
        }
        String normalized = raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "fleet" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path fleetDir(String fleet) {
        return rootDir.resolve(FLEETS_DIR).resolve(sanitizeFleetName(fleet));
    }

    public Path fleetStateFile(String fleet) {
        return fleetDir(fleet).resolve(STATE_FILE);
    }

    public Path ledgerFile(String fleet) {
        return fleetDir(fleet).resolve(LEDGER_FILE);
    }
}
