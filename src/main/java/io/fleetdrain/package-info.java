/**
 * FleetDrain source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fleetdrain.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fleetdrain.cli.FleetDrainCommand} wires a fleet session and maps subcommands to it.</li>
 *   <li>{@code io.fleetdrain.coordinator.DrainCoordinator} drives workers from finish signal to stop.</li>
 *   <li>{@code io.fleetdrain.safety.SafetyGate} is the only path to stop authorization.</li>
 *   <li>{@code io.fleetdrain.ledger.StateLedger} is the durable source of lifecycle phases.</li>
 * </ul>
 */
package io.fleetdrain;
