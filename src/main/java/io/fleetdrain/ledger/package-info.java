/**
 * Durable per-fleet lifecycle ledger: hash-chained JSON lines, replayed on open.
 *
 * <p>Rows are never rewritten. The only repair on open is dropping a torn final line left
 * by a crash mid-write; a corrupt row anywhere else fails the open.
 *
 * <p>Automatic moves advance one phase and go through
 * {@link io.fleetdrain.ledger.StateLedger#transition}, a check-and-set against the current
 * phase. Backward moves only happen through {@link io.fleetdrain.ledger.StateLedger#reset},
 * which always carries an operator and a reason.
 */
package io.fleetdrain.ledger;
