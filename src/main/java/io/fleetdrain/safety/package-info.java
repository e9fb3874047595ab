/**
 * Stop authorization.
 *
 * <p>{@link io.fleetdrain.safety.SafetyGate} is the only path to {@code STOP_AUTHORIZED}.
 * It requires two paused-and-idle readings a settle delay apart and then wins a ledger
 * check-and-set. An unreachable reading is never evidence of completion.
 */
package io.fleetdrain.safety;
