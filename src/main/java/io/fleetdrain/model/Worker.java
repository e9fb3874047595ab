package io.fleetdrain.model;

import java.time.Instant;
import java.util.Objects;

public record Worker(
        String id,
        Backend backend,
        String address,
        String displayName,
        String resourceId,
        Instant registeredAt
) {
    public Worker {
        Objects.requireNonNull(backend, "backend");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("worker address cannot be empty: " + id);
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        resourceId = resourceId == null || resourceId.isBlank() ? displayName : resourceId;
        registeredAt = registeredAt == null ? Instant.now() : registeredAt;
    }

    public WorkerRef ref() {
        return new WorkerRef(backend, displayName, resourceId);
    }
}
