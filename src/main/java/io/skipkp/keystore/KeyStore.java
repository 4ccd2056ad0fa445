package io.skipkp.keystore;

import io.skipkp.capability.CapabilityRegistry;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.entropy.EntropyProvider;
import io.skipkp.model.KeyProviderException;
import io.skipkp.model.KeyRecord;
import io.skipkp.observability.AuditLogger;
import io.skipkp.security.KeyMaterial;
import io.skipkp.storage.KeyRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Key record lifecycle: creation, single authorized retrieval, replication bookkeeping and expiry.
 *
 * <p>Retrieval consumes the record in the same repository step that hands out the material, so
 * concurrent callers cannot both succeed. The stored copy of the material is erased on
 * consumption; the row remains as a tombstone until {@link #sweep()} removes it.
 */
public final class KeyStore {
    public static final int KEY_ID_BYTES = 16;
    private static final Pattern KEY_ID_PATTERN = Pattern.compile("^[0-9a-fA-F]{32}$");

    private final KeyProviderConfig config;
    private final KeyRecordRepository repository;
    private final EntropyProvider entropy;
    private final CapabilityRegistry capabilities;
    private final AuditLogger audit;
    private final Clock clock;

    public KeyStore(KeyProviderConfig config, KeyRecordRepository repository, EntropyProvider entropy,
                    CapabilityRegistry capabilities, AuditLogger audit) {
        this(config, repository, entropy, capabilities, audit, Clock.systemUTC());
    }

    public KeyStore(KeyProviderConfig config, KeyRecordRepository repository, EntropyProvider entropy,
                    CapabilityRegistry capabilities, AuditLogger audit, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.entropy = entropy;
        this.capabilities = capabilities;
        this.audit = audit;
        this.clock = clock;
    }

    public GeneratedKey generate(String remoteSystemId, int sizeBits) {
        if (!capabilities.authorize(remoteSystemId)) {
            auditRejected("key.generate", remoteSystemId, null, "unauthorized");
            throw KeyProviderException.unauthorized(remoteSystemId);
        }
        validateSize(sizeBits);
        if (repository.countLive() >= config.maxStoredKeys()) {
            auditRejected("key.generate", remoteSystemId, null, "capacity");
            throw new KeyProviderException(KeyProviderException.Reason.STORAGE_UNAVAILABLE,
                    "Key storage capacity reached");
        }
        byte[] material = entropy.randomBytes(sizeBits / 8);
        String keyId = newKeyId();
        KeyRecord record = new KeyRecord(keyId, material, remoteSystemId, sizeBits, clock.instant(),
                false, config.localSystemId(), Set.of());
        boolean stored;
        try {
            stored = repository.insert(record);
        } catch (RuntimeException e) {
            KeyMaterial.wipe(material);
            throw e;
        }
        if (!stored) {
            KeyMaterial.wipe(material);
            throw new KeyProviderException(KeyProviderException.Reason.STORAGE_UNAVAILABLE,
                    "Key id collision, retry the request");
        }
        audit.log(AuditLogger.AuditEvent.of("key.generate", remoteSystemId, keyId, "success",
                Map.of("sizeBits", sizeBits)));
        return new GeneratedKey(keyId, KeyMaterial.wrap(material));
    }

    /**
     * Hands out the material for {@code keyId} and consumes the record. The caller closes the
     * returned buffer once the bytes have been written out.
     */
    public KeyMaterial retrieve(String keyId, String remoteSystemId) {
        if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw KeyProviderException.notFound("Malformed keyId");
        }
        String normalized = keyId.toLowerCase(Locale.ROOT);
        KeyRecord existing = repository.find(normalized)
                .orElseThrow(() -> KeyProviderException.notFound("Key not found"));
        KeyMaterial.wipe(existing.keyMaterial());
        if (existing.consumed()) {
            auditRejected("key.retrieve", remoteSystemId, normalized, "already_consumed");
            throw alreadyConsumed();
        }
        if (!capabilities.authorize(remoteSystemId)) {
            auditRejected("key.retrieve", remoteSystemId, normalized, "unauthorized");
            throw KeyProviderException.unauthorized(remoteSystemId);
        }
        KeyRecordRepository.ConsumeResult result = repository.consume(normalized, clock.instant());
        switch (result.outcome()) {
            case CONSUMED -> {
                audit.log(AuditLogger.AuditEvent.of("key.retrieve", remoteSystemId, normalized, "success",
                        Map.of("createdFor", String.valueOf(result.remoteSystemId()))));
                return KeyMaterial.wrap(result.material());
            }
            case ALREADY_CONSUMED -> {
                auditRejected("key.retrieve", remoteSystemId, normalized, "already_consumed");
                throw alreadyConsumed();
            }
            default -> throw KeyProviderException.notFound("Key not found");
        }
    }

    /**
     * Stores a key received from a peer. Existing ids, including tombstones, are left untouched.
     *
     * @return true when the record was new
     */
    public boolean acceptReplicated(ReplicatedKey key, String fromPeer) {
        validateSize(key.sizeBits());
        if (key.keyId() == null || !KEY_ID_PATTERN.matcher(key.keyId()).matches()) {
            throw KeyProviderException.validation("Malformed keyId");
        }
        if (key.material().length() * 8 != key.sizeBits()) {
            throw KeyProviderException.validation("Key material does not match sizeBits");
        }
        byte[] material = key.material().copy();
        try {
            KeyRecord record = new KeyRecord(key.keyId().toLowerCase(Locale.ROOT), material, key.remoteSystemId(),
                    key.sizeBits(), key.createdAt() == null ? clock.instant() : key.createdAt(),
                    false, fromPeer, Set.of(fromPeer));
            boolean stored = repository.insert(record);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("fromPeer", fromPeer);
            details.put("sizeBits", key.sizeBits());
            audit.log(AuditLogger.AuditEvent.of("key.replicate.accept", fromPeer, record.keyId(),
                    stored ? "success" : "duplicate", details));
            return stored;
        } finally {
            KeyMaterial.wipe(material);
        }
    }

    /**
     * Applies a consumption notice from a peer.
     *
     * @return true when this call consumed a live local record
     */
    public boolean consumeReplicated(String keyId, String fromPeer) {
        if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw KeyProviderException.validation("Malformed keyId");
        }
        String normalized = keyId.toLowerCase(Locale.ROOT);
        KeyRecordRepository.ConsumeResult result = repository.consume(normalized, clock.instant());
        KeyMaterial.wipe(result.material());
        if (result.outcome() != KeyRecordRepository.ConsumeOutcome.NOT_FOUND) {
            // The sender already knows; do not echo the notice back.
            repository.markNotified(normalized, fromPeer, clock.instant());
        }
        audit.log(AuditLogger.AuditEvent.of("key.replicate.consume", fromPeer, normalized,
                result.outcome().name().toLowerCase(Locale.ROOT), Map.of()));
        return result.outcome() == KeyRecordRepository.ConsumeOutcome.CONSUMED;
    }

    public List<KeyRecord> pendingReplication(String peerId, int limit) {
        return repository.pendingReplication(peerId, limit);
    }

    public void markSynced(String keyId, String peerId) {
        repository.markSynced(keyId, peerId, clock.instant());
    }

    public List<String> pendingConsumptionNotices(String peerId, int limit) {
        return repository.pendingConsumptionNotices(peerId, limit);
    }

    public void markNotified(String keyId, String peerId) {
        repository.markNotified(keyId, peerId, clock.instant());
    }

    public int sweep() {
        return sweep(clock.instant());
    }

    /**
     * Removes every record older than the configured TTL, consumed or not.
     */
    public int sweep(Instant now) {
        int removed = repository.deleteCreatedBefore(now.minus(config.keyTtl()));
        if (removed > 0) {
            audit.log(AuditLogger.AuditEvent.of("key.sweep", "scheduler", "key_records", "success",
                    Map.of("removed", removed)));
        }
        return removed;
    }

    public KeyRecordRepository.Stats stats() {
        return repository.stats();
    }

    public boolean healthy() {
        return repository.healthy();
    }

    private void validateSize(int sizeBits) {
        if (sizeBits < config.minKeySizeBits() || sizeBits > config.maxKeySizeBits() || sizeBits % 8 != 0) {
            throw KeyProviderException.validation("Invalid key size: " + sizeBits
                    + " (must be " + config.minKeySizeBits() + "-" + config.maxKeySizeBits()
                    + " bits and a multiple of 8)");
        }
    }

    private String newKeyId() {
        byte[] raw = entropy.randomBytes(KEY_ID_BYTES);
        try {
            return HexFormat.of().formatHex(raw);
        } finally {
            KeyMaterial.wipe(raw);
        }
    }

    private void auditRejected(String action, String actor, String keyId, String reason) {
        audit.log(AuditLogger.AuditEvent.of(action, actor, keyId == null ? "key" : keyId, "rejected",
                Map.of("reason", reason)));
    }

    private static KeyProviderException alreadyConsumed() {
        return new KeyProviderException(KeyProviderException.Reason.ALREADY_CONSUMED, "Key already consumed");
    }

    public record GeneratedKey(String keyId, KeyMaterial keyMaterial) implements AutoCloseable {
        @Override
        public void close() {
            keyMaterial.close();
        }
    }

    /**
     * Key as received in a KEY_SYNC payload. The material buffer stays owned by the caller.
     */
    public record ReplicatedKey(String keyId, KeyMaterial material, String remoteSystemId, int sizeBits,
                                Instant createdAt) {
    }
}
