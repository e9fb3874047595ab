package io.fleetdrain.model;

public enum LifecyclePhase {
    ACTIVE,
    DRAIN_REQUESTED,
    DRAINING,
    PAUSED_CONFIRMED,
    STOP_AUTHORIZED,
    STOP_REQUESTED,
    STOPPED;

    public boolean isBefore(LifecyclePhase other) {
        return ordinal() < other.ordinal();
    }

    public boolean isAtLeast(LifecyclePhase other) {
        return ordinal() >= other.ordinal();
    }

    public boolean isNextStep(LifecyclePhase next) {
        return next != null && next.ordinal() == ordinal() + 1;
    }

    public boolean stopOutstanding() {
        return this == STOP_AUTHORIZED || this == STOP_REQUESTED;
    }

    public static LifecyclePhase fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Phase cannot be empty");
        }
        String normalized = raw.trim().replace('-', '_');
        for (LifecyclePhase value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle phase: " + raw);
    }
}
