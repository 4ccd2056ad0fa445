package io.skipkp.config;

import io.skipkp.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code skip-kp.json} and resolves it over the built-in defaults.
 *
 * <p>Every field in the file is optional. The {@code SKIP_LOCAL_SYSTEM_ID} environment variable
 * overrides {@code localSystemId}; explicit overrides passed by the CLI win over both.
 */
public final class KeyProviderConfigLoader {
    public static final String DEFAULT_FILE_NAME = "skip-kp.json";
    public static final String LOCAL_SYSTEM_ID_ENV = "SKIP_LOCAL_SYSTEM_ID";

    private final Map<String, String> environment;

    public KeyProviderConfigLoader() {
        this(System.getenv());
    }

    public KeyProviderConfigLoader(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : environment;
    }

    public KeyProviderConfig load(Path configFile) {
        return load(configFile, null, null);
    }

    public KeyProviderConfig load(Path configFile, Path dataDirOverride, Integer portOverride) {
        SettingsFile file = null;
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            try {
                file = Jsons.mapper().readValue(configFile.toFile(), SettingsFile.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read config file: " + configFile, e);
            }
        }
        KeyProviderConfig resolved = resolve(file, dataDirOverride, portOverride);
        List<String> errors = resolved.validate();
        if (!errors.isEmpty()) {
            throw new InvalidConfigException(errors);
        }
        return resolved;
    }

    KeyProviderConfig resolve(SettingsFile file, Path dataDirOverride, Integer portOverride) {
        SettingsFile f = file == null ? SettingsFile.empty() : file;
        Path dataDir = dataDirOverride != null
                ? dataDirOverride
                : Paths.get(f.dataDir() == null || f.dataDir().isBlank() ? "data" : f.dataDir());
        String localSystemId = environment.get(LOCAL_SYSTEM_ID_ENV);
        if (localSystemId == null || localSystemId.isBlank()) {
            localSystemId = orDefault(f.localSystemId(), KeyProviderConfig.DEFAULT_LOCAL_SYSTEM_ID);
        }
        List<String> remotes = f.remoteSystemIds() == null
                ? List.of("KP_QuIIN_Client", "KP_*_Test", "KP_Development_*")
                : f.remoteSystemIds();
        List<PeerConfig> peers = new ArrayList<>();
        if (f.peers() != null) {
            for (PeerFile peer : f.peers()) {
                if (peer == null) {
                    continue;
                }
                peers.add(new PeerConfig(
                        trimToEmpty(peer.systemId()),
                        trimToEmpty(peer.endpoint()),
                        peer.port() == null ? 0 : peer.port(),
                        peer.sharedSecret()
                ));
            }
        }
        return new KeyProviderConfig(
                dataDir.toAbsolutePath().normalize(),
                orDefault(f.host(), KeyProviderConfig.DEFAULT_HOST),
                portOverride != null ? portOverride : orDefault(f.port(), KeyProviderConfig.DEFAULT_PORT),
                localSystemId.trim(),
                remotes,
                orDefault(f.algorithm(), KeyProviderConfig.DEFAULT_ALGORITHM),
                orDefault(f.defaultKeySizeBits(), KeyProviderConfig.DEFAULT_KEY_SIZE_BITS),
                orDefault(f.minKeySizeBits(), KeyProviderConfig.MIN_KEY_SIZE_BITS),
                orDefault(f.maxKeySizeBits(), KeyProviderConfig.MAX_KEY_SIZE_BITS),
                orDefault(f.defaultEntropyBits(), KeyProviderConfig.DEFAULT_ENTROPY_BITS),
                KeyProviderConfig.MIN_ENTROPY_BITS,
                KeyProviderConfig.MAX_ENTROPY_BITS,
                orDefault(f.maxStoredKeys(), KeyProviderConfig.DEFAULT_MAX_STORED_KEYS),
                Duration.ofSeconds(orDefault(f.keyTtlSeconds(), KeyProviderConfig.DEFAULT_KEY_TTL_SECONDS)),
                f.syncEnabled() == null || f.syncEnabled(),
                millis(f.heartbeatIntervalMs(), KeyProviderConfig.DEFAULT_HEARTBEAT_INTERVAL_MS),
                millis(f.syncIntervalMs(), KeyProviderConfig.DEFAULT_SYNC_INTERVAL_MS),
                millis(f.sweepIntervalMs(), KeyProviderConfig.DEFAULT_SWEEP_INTERVAL_MS),
                millis(f.syncTimeoutMs(), KeyProviderConfig.DEFAULT_SYNC_TIMEOUT_MS),
                orDefault(f.maxRetries(), KeyProviderConfig.DEFAULT_MAX_RETRIES),
                millis(f.retryBaseBackoffMs(), KeyProviderConfig.DEFAULT_RETRY_BASE_BACKOFF_MS),
                millis(f.retryMaxBackoffMs(), KeyProviderConfig.DEFAULT_RETRY_MAX_BACKOFF_MS),
                orDefault(f.missedThreshold(), KeyProviderConfig.DEFAULT_MISSED_THRESHOLD),
                millis(f.replayWindowMs(), KeyProviderConfig.DEFAULT_REPLAY_WINDOW_MS),
                Math.max(1, orDefault(f.replicationBatchSize(), KeyProviderConfig.DEFAULT_REPLICATION_BATCH_SIZE)),
                Math.max(1, orDefault(f.httpThreads(), KeyProviderConfig.DEFAULT_HTTP_THREADS)),
                Math.max(1, orDefault(f.syncThreads(), KeyProviderConfig.DEFAULT_SYNC_THREADS)),
                peers
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static long orDefault(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static Duration millis(Long value, long fallbackMs) {
        return Duration.ofMillis(value == null ? fallbackMs : value);
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    record SettingsFile(
            String dataDir,
            String host,
            Integer port,
            String localSystemId,
            List<String> remoteSystemIds,
            String algorithm,
            Integer defaultKeySizeBits,
            Integer minKeySizeBits,
            Integer maxKeySizeBits,
            Integer defaultEntropyBits,
            Integer maxStoredKeys,
            Long keyTtlSeconds,
            Boolean syncEnabled,
            Long heartbeatIntervalMs,
            Long syncIntervalMs,
            Long sweepIntervalMs,
            Long syncTimeoutMs,
            Integer maxRetries,
            Long retryBaseBackoffMs,
            Long retryMaxBackoffMs,
            Integer missedThreshold,
            Long replayWindowMs,
            Integer replicationBatchSize,
            Integer httpThreads,
            Integer syncThreads,
            List<PeerFile> peers
    ) {
        static SettingsFile empty() {
            return new SettingsFile(null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
    }

    record PeerFile(String systemId, String endpoint, Integer port, String sharedSecret) {
    }

    public static final class InvalidConfigException extends IllegalArgumentException {
        private final List<String> errors;

        public InvalidConfigException(List<String> errors) {
            super("Invalid configuration: " + String.join("; ", errors));
            this.errors = List.copyOf(errors);
        }

        public List<String> errors() {
            return errors;
        }
    }
}
