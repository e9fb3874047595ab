package io.fleetdrain.model;

public record WorkerRef(Backend backend, String name, String resourceId) {
}
