/**
 * FleetGate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fleetgate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fleetgate.cli.FleetGateCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.fleetgate.runtime.FleetGateRuntime} wires the trust ledger, command dispatcher and backup orchestrator.</li>
 *   <li>{@code io.fleetgate.storage} holds the SQLite stores every state change goes through.</li>
 * </ul>
 */
package io.fleetgate;
