/**
 * Runtime facade.
 *
 * <p>{@link io.fleetgate.runtime.FleetGateRuntime} wires storage, the trust ledger, the command
 * dispatcher and the backup orchestrator together, applies the capability check for every
 * operator-facing operation, and exposes the operations used by the CLI and the HTTP API.
 */
package io.fleetgate.runtime;
