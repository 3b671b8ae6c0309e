/**
 * Coordination core.
 *
 * <p>{@link io.coordmesh.coord.Coordinator} composes the agent registry, lease manager,
 * liveness sweeper, message bus and hash-chained event log of a single project. Leases and
 * liveness are evaluated lazily against an injected clock; nothing here starts threads.
 */
package io.coordmesh.coord;
