/**
 * Fleet-level orchestration.
 *
 * <p>{@link io.fleetdrain.coordinator.DrainCoordinator} runs one task per worker on a
 * bounded pool. Polling and retries share {@link io.fleetdrain.coordinator.Poller} and
 * {@link io.fleetdrain.coordinator.Retrier}, so every wait honors the session's
 * cancellation token the same way.
 *
 * <p>Teardown of one worker runs drain, gate, a final power-state read, stop and
 * confirmation. A worker already at {@code STOP_REQUESTED} is only reconciled against
 * the backend. Resume resets the worker to {@code ACTIVE} before the client is told to
 * fold again, and is refused once a stop is authorized.
 */
package io.fleetdrain.coordinator;
