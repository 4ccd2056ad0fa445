package io.skipkp.config;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable startup configuration shared by every component.
 *
 * <p>Built once by {@link KeyProviderConfigLoader} and handed to constructors explicitly.
 */
public record KeyProviderConfig(
        Path dataDir,
        String host,
        int port,
        String localSystemId,
        List<String> remoteSystemIds,
        String algorithm,
        int defaultKeySizeBits,
        int minKeySizeBits,
        int maxKeySizeBits,
        int defaultEntropyBits,
        int minEntropyBits,
        int maxEntropyBits,
        int maxStoredKeys,
        Duration keyTtl,
        boolean syncEnabled,
        Duration heartbeatInterval,
        Duration syncInterval,
        Duration sweepInterval,
        Duration syncTimeout,
        int maxRetries,
        Duration retryBaseBackoff,
        Duration retryMaxBackoff,
        int missedThreshold,
        Duration replayWindow,
        int replicationBatchSize,
        int httpThreads,
        int syncThreads,
        List<PeerConfig> peers
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_LOCAL_SYSTEM_ID = "KP_QuIIN_Server";
    public static final String DEFAULT_ALGORITHM = "TLS_DHE_PSK_WITH_AES_256_CBC_SHA384";
    public static final int DEFAULT_KEY_SIZE_BITS = 256;
    public static final int MIN_KEY_SIZE_BITS = 128;
    public static final int MAX_KEY_SIZE_BITS = 512;
    public static final int DEFAULT_ENTROPY_BITS = 256;
    public static final int MIN_ENTROPY_BITS = 8;
    public static final int MAX_ENTROPY_BITS = 2048;
    public static final int DEFAULT_MAX_STORED_KEYS = 1000;
    public static final long DEFAULT_KEY_TTL_SECONDS = 3600L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_SYNC_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_SYNC_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_RETRY_MAX_BACKOFF_MS = 8_000L;
    public static final int DEFAULT_MISSED_THRESHOLD = 3;
    public static final long DEFAULT_REPLAY_WINDOW_MS = 300_000L;
    public static final int DEFAULT_REPLICATION_BATCH_SIZE = 256;
    public static final int DEFAULT_HTTP_THREADS = 8;
    public static final int DEFAULT_SYNC_THREADS = 4;
    public static final int MIN_SHARED_SECRET_BYTES = 32;

    public KeyProviderConfig {
        remoteSystemIds = List.copyOf(remoteSystemIds);
        peers = List.copyOf(peers);
    }

    public Path dbFile() {
        return dataDir.resolve("skip-kp.db");
    }

    public Path auditFile() {
        return dataDir.resolve("audit").resolve("audit.log");
    }

    public Duration staleAfter() {
        return heartbeatInterval.multipliedBy(2L);
    }

    /**
     * Returns every problem found in this configuration; an empty list means it is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (localSystemId == null || localSystemId.isBlank()) {
            errors.add("localSystemId must not be blank");
        }
        if (remoteSystemIds.isEmpty()) {
            errors.add("remoteSystemIds must contain at least one pattern");
        }
        if (minKeySizeBits < MIN_KEY_SIZE_BITS || minKeySizeBits % 8 != 0) {
            errors.add("minKeySizeBits must be a multiple of 8 and >= " + MIN_KEY_SIZE_BITS);
        }
        if (maxKeySizeBits > MAX_KEY_SIZE_BITS || maxKeySizeBits < minKeySizeBits || maxKeySizeBits % 8 != 0) {
            errors.add("maxKeySizeBits must be a multiple of 8 between minKeySizeBits and " + MAX_KEY_SIZE_BITS);
        }
        if (defaultKeySizeBits < minKeySizeBits) {
            errors.add("defaultKeySizeBits must be >= minKeySizeBits");
        }
        if (defaultKeySizeBits > maxKeySizeBits) {
            errors.add("defaultKeySizeBits must be <= maxKeySizeBits");
        }
        if (defaultKeySizeBits % 8 != 0) {
            errors.add("defaultKeySizeBits must be a multiple of 8");
        }
        if (port <= 0 || port > 65_535) {
            errors.add("port out of range: " + port);
        }
        if (maxStoredKeys <= 0) {
            errors.add("maxStoredKeys must be positive");
        }
        if (missedThreshold <= 0) {
            errors.add("missedThreshold must be positive");
        }
        if (maxRetries < 0) {
            errors.add("maxRetries must not be negative");
        }
        requirePositive(errors, "keyTtl", keyTtl);
        requirePositive(errors, "heartbeatInterval", heartbeatInterval);
        requirePositive(errors, "syncInterval", syncInterval);
        requirePositive(errors, "sweepInterval", sweepInterval);
        requirePositive(errors, "syncTimeout", syncTimeout);
        requirePositive(errors, "replayWindow", replayWindow);

        Set<String> peerIds = new HashSet<>();
        Set<String> secrets = new HashSet<>();
        for (PeerConfig peer : peers) {
            if (peer.systemId() == null || peer.systemId().isBlank()) {
                errors.add("peer systemId must not be blank");
                continue;
            }
            if (peer.systemId().equals(localSystemId)) {
                errors.add("peer " + peer.systemId() + " uses the local system id");
            }
            if (!peerIds.add(peer.systemId())) {
                errors.add("duplicate peer systemId: " + peer.systemId());
            }
            if (peer.endpoint() == null || peer.endpoint().isBlank()) {
                errors.add("peer " + peer.systemId() + " has no endpoint");
            }
            if (peer.port() <= 0 || peer.port() > 65_535) {
                errors.add("peer " + peer.systemId() + " port out of range: " + peer.port());
            }
            String secret = peer.sharedSecret() == null ? "" : peer.sharedSecret();
            if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SHARED_SECRET_BYTES) {
                errors.add("peer " + peer.systemId() + " sharedSecret must be at least 256 bits");
            } else if (!secrets.add(secret)) {
                errors.add("peer " + peer.systemId() + " reuses another peer's sharedSecret");
            }
        }
        return errors;
    }

    private static void requirePositive(List<String> errors, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(name + " must be positive");
        }
    }
}
