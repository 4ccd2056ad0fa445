/**
 * Peer synchronization.
 *
 * <p>{@link io.skipkp.sync.SyncMessenger} signs, seals and delivers messages and validates inbound
 * ones; {@link io.skipkp.sync.SyncScheduler} runs the heartbeat, replication and sweep cycles.
 * Replication is best-effort and never blocks the request that created a key.
 */
package io.skipkp.sync;
