package io.skipkp.model;

import java.time.Instant;
import java.util.Set;

/**
 * Stored key as handed out by a repository.
 *
 * <p>{@code keyMaterial} is a fresh copy owned by the caller; it is empty for consumed tombstones.
 */
public record KeyRecord(
        String keyId,
        byte[] keyMaterial,
        String remoteSystemId,
        int sizeBits,
        Instant createdAt,
        boolean consumed,
        String origin,
        Set<String> syncedPeers
) {
    public KeyRecord {
        syncedPeers = syncedPeers == null ? Set.of() : Set.copyOf(syncedPeers);
    }
}
