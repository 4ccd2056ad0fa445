package io.skipkp.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.skipkp.capability.CapabilityRegistry;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.entropy.EntropyProvider;
import io.skipkp.entropy.SecureRandomEntropyProvider;
import io.skipkp.keystore.KeyStore;
import io.skipkp.model.PeerView;
import io.skipkp.observability.AuditLogger;
import io.skipkp.peer.PeerRegistry;
import io.skipkp.storage.Database;
import io.skipkp.storage.KeyRecordRepository;
import io.skipkp.storage.SqliteKeyRecordRepository;
import io.skipkp.sync.HttpSyncTransport;
import io.skipkp.sync.SyncMessenger;
import io.skipkp.sync.SyncScheduler;
import io.skipkp.sync.SyncTransport;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Owns every component of one key provider node and their start/stop order.
 */
public final class KeyProviderRuntime implements AutoCloseable {
    public static final String VERSION = "0.1.0";

    private final KeyProviderConfig config;
    private final Database database;
    private final KeyRecordRepository repository;
    private final EntropyProvider entropy;
    private final CapabilityRegistry capabilities;
    private final AuditLogger auditLogger;
    private final KeyStore keyStore;
    private final PeerRegistry peers;
    private final SyncMessenger messenger;
    private final SyncScheduler scheduler;
    private final Clock clock;
    private boolean initialized;
    private boolean started;

    public KeyProviderRuntime(KeyProviderConfig config) {
        this(config, new Database(config), null, new SecureRandomEntropyProvider(),
                new HttpSyncTransport(config.syncTimeout()), Clock.systemUTC());
    }

    /**
     * Wiring with swappable collaborators. When {@code repository} is null the SQLite repository
     * over {@code database} is used.
     */
    public KeyProviderRuntime(KeyProviderConfig config, Database database, KeyRecordRepository repository,
                              EntropyProvider entropy, SyncTransport transport, Clock clock) {
        this.config = config;
        this.database = database;
        this.repository = repository != null ? repository : new SqliteKeyRecordRepository(database);
        this.entropy = entropy;
        this.clock = clock;
        this.capabilities = new CapabilityRegistry(config);
        this.auditLogger = new AuditLogger(config.auditFile(), config.localSystemId());
        this.keyStore = new KeyStore(config, this.repository, entropy, capabilities, auditLogger, clock);
        this.peers = new PeerRegistry(config, clock);
        this.messenger = new SyncMessenger(config, keyStore, capabilities, peers, transport, auditLogger, clock);
        this.scheduler = new SyncScheduler(config, keyStore, peers, messenger);
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        if (database != null) {
            database.init();
        }
        initialized = true;
    }

    public synchronized void start() {
        init();
        if (started) {
            return;
        }
        scheduler.start();
        started = true;
        auditLogger.log(AuditLogger.AuditEvent.of("runtime.start", "runtime", config.localSystemId(), "success",
                Map.of("peers", peers.peers().size(), "version", VERSION)));
    }

    public synchronized void stop() {
        scheduler.stop();
        if (started) {
            started = false;
            auditLogger.log(AuditLogger.AuditEvent.of("runtime.stop", "runtime", config.localSystemId(), "success",
                    Map.of()));
        }
    }

    @Override
    public void close() {
        stop();
    }

    public HealthOutcome health() {
        boolean dbOk = repository.healthy();
        KeyRecordRepository.Stats stats = dbOk ? safeStats() : null;
        return new HealthOutcome(
                dbOk ? "ok" : "degraded",
                dbOk ? "ok" : "error",
                VERSION,
                config.localSystemId(),
                stats == null ? null : stats.live(),
                stats == null ? null : stats.consumed(),
                Instant.now(clock).toString()
        );
    }

    public SyncStatus syncStatus() {
        List<PeerView> views = peers.views();
        return new SyncStatus(config.syncEnabled(), config.localSystemId(), views.size(), views);
    }

    public KeyProviderConfig config() {
        return config;
    }

    public KeyStore keyStore() {
        return keyStore;
    }

    public EntropyProvider entropy() {
        return entropy;
    }

    public CapabilityRegistry capabilities() {
        return capabilities;
    }

    public PeerRegistry peers() {
        return peers;
    }

    public SyncMessenger messenger() {
        return messenger;
    }

    public SyncScheduler scheduler() {
        return scheduler;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private KeyRecordRepository.Stats safeStats() {
        try {
            return repository.stats();
        } catch (RuntimeException e) {
            System.err.println("WARN health stats unavailable: " + e.getMessage());
            return null;
        }
    }

    public record HealthOutcome(
            String status,
            String database,
            String version,
            @JsonProperty("localSystemID") String localSystemId,
            Long liveKeys,
            Long consumedKeys,
            String timestamp
    ) {
        public boolean ok() {
            return "ok".equals(status);
        }
    }

    public record SyncStatus(
            boolean syncEnabled,
            @JsonProperty("localSystemID") String localSystemId,
            int peerCount,
            List<PeerView> peers
    ) {
    }
}
