package io.skipkp.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.skipkp.capability.CapabilityRegistry;
import io.skipkp.config.KeyProviderConfig;
import io.skipkp.config.PeerConfig;
import io.skipkp.keystore.KeyStore;
import io.skipkp.model.CapabilityDescriptor;
import io.skipkp.model.KeyProviderException;
import io.skipkp.model.KeyRecord;
import io.skipkp.model.SyncMessage;
import io.skipkp.model.SyncMessageType;
import io.skipkp.observability.AuditLogger;
import io.skipkp.peer.PeerRegistry;
import io.skipkp.security.KeyMaterial;
import io.skipkp.security.MessageSigner;
import io.skipkp.security.PayloadCrypto;
import io.skipkp.util.Jsons;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builds, signs and delivers sync messages, and validates and applies inbound ones.
 *
 * <p>Outbound failures are recorded against the peer and audited; they never surface to the HTTP
 * client whose request created the key. Inbound integrity failures are audited in detail while
 * the caller only sees a short reason.
 */
public final class SyncMessenger {
    private static final String INVALID_SIGNATURE = "Invalid signature";

    private final KeyProviderConfig config;
    private final KeyStore keyStore;
    private final CapabilityRegistry capabilities;
    private final PeerRegistry peers;
    private final SyncTransport transport;
    private final AuditLogger audit;
    private final Clock clock;
    private final Map<String, PayloadCrypto> cryptoByPeer;

    public SyncMessenger(KeyProviderConfig config, KeyStore keyStore, CapabilityRegistry capabilities,
                         PeerRegistry peers, SyncTransport transport, AuditLogger audit) {
        this(config, keyStore, capabilities, peers, transport, audit, Clock.systemUTC());
    }

    public SyncMessenger(KeyProviderConfig config, KeyStore keyStore, CapabilityRegistry capabilities,
                         PeerRegistry peers, SyncTransport transport, AuditLogger audit, Clock clock) {
        this.config = config;
        this.keyStore = keyStore;
        this.capabilities = capabilities;
        this.peers = peers;
        this.transport = transport;
        this.audit = audit;
        this.clock = clock;
        Map<String, PayloadCrypto> crypto = new LinkedHashMap<>();
        for (PeerConfig peer : peers.peers()) {
            crypto.put(peer.systemId(), new PayloadCrypto(peer.sharedSecret()));
        }
        this.cryptoByPeer = Map.copyOf(crypto);
    }

    public SyncOutcome sendHeartbeat(PeerConfig peer) {
        return send(peer, SyncMessageType.HEARTBEAT, newMessageId(), Jsons.toJson(Map.of("status", "online")));
    }

    public SyncOutcome sendCapabilities(PeerConfig peer) {
        return send(peer, SyncMessageType.CAPABILITY_EXCHANGE, newMessageId(), Jsons.toJson(capabilities.describe()));
    }

    public SyncOutcome sendConsumed(PeerConfig peer, String keyId) {
        return send(peer, SyncMessageType.KEY_CONSUMED, newMessageId(), Jsons.toJson(Map.of("keyId", keyId)));
    }

    /**
     * Seals the record's material for the peer and sends it. The record's material array is not
     * touched; the plaintext envelope built here is wiped before the network call.
     */
    public SyncOutcome sendKey(PeerConfig peer, KeyRecord record) {
        String messageId = newMessageId();
        String sealed;
        byte[] plaintext = null;
        try (KeyMaterial material = KeyMaterial.wrap(record.keyMaterial().clone())) {
            KeySyncPayload payload = new KeySyncPayload(
                    record.keyId(),
                    material.toHex(),
                    record.remoteSystemId(),
                    record.sizeBits(),
                    record.createdAt().toEpochMilli()
            );
            plaintext = Jsons.mapper().writeValueAsBytes(payload);
            sealed = crypto(peer).encrypt(plaintext, messageId);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode key sync payload", e);
        } finally {
            KeyMaterial.wipe(plaintext);
        }
        SyncOutcome outcome = send(peer, SyncMessageType.KEY_SYNC, messageId, sealed);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("peer", peer.systemId());
        details.put("messageId", messageId);
        details.put("attempts", outcome.attempts());
        audit.log(AuditLogger.AuditEvent.of("sync.key.send", config.localSystemId(), record.keyId(),
                outcome.status().name().toLowerCase(Locale.ROOT), details));
        return outcome;
    }

    SyncOutcome send(PeerConfig peer, SyncMessageType type, String messageId, String payload) {
        SyncMessage unsigned = new SyncMessage(messageId, config.localSystemId(), peer.systemId(), type,
                clock.millis(), payload, null);
        String body = Jsons.toJson(MessageSigner.sign(unsigned, peer.sharedSecret()));
        int attempts = 0;
        String lastError = "";
        int maxAttempts = 1 + Math.max(0, config.maxRetries());
        while (attempts < maxAttempts) {
            attempts++;
            try {
                SyncTransport.Response response = transport.post(peer, body, config.syncTimeout());
                // The peer answered, so it is reachable even when it refuses the message.
                peers.recordSuccess(peer.systemId());
                if (response.ok()) {
                    return new SyncOutcome(peer.systemId(), type, messageId, SyncOutcome.Status.DELIVERED,
                            attempts, response.status(), "");
                }
                String detail = "status=" + response.status() + " body=" + abbreviate(response.body());
                System.err.println("WARN sync " + type + " to " + peer.systemId() + " rejected: " + detail);
                audit.log(AuditLogger.AuditEvent.of("sync.send", config.localSystemId(), peer.systemId(), "rejected",
                        Map.of("type", type.name(), "messageId", messageId, "status", response.status())));
                return new SyncOutcome(peer.systemId(), type, messageId, SyncOutcome.Status.REJECTED,
                        attempts, response.status(), detail);
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
                if (attempts < maxAttempts && !sleepBackoff(attempts)) {
                    lastError = "interrupted";
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = "interrupted";
                break;
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            // Cut short by shutdown; says nothing about the peer.
            System.err.println("WARN sync " + type + " to " + peer.systemId() + " interrupted after "
                    + attempts + " attempt(s)");
            return new SyncOutcome(peer.systemId(), type, messageId, SyncOutcome.Status.UNREACHABLE,
                    attempts, 0, lastError);
        }
        peers.recordFailure(peer.systemId());
        System.err.println("WARN sync " + type + " to " + peer.systemId() + " failed after "
                + attempts + " attempt(s): " + lastError);
        audit.log(AuditLogger.AuditEvent.of("sync.send", config.localSystemId(), peer.systemId(), "unreachable",
                Map.of("type", type.name(), "messageId", messageId, "attempts", attempts, "error", lastError)));
        return new SyncOutcome(peer.systemId(), type, messageId, SyncOutcome.Status.UNREACHABLE,
                attempts, 0, lastError);
    }

    /**
     * Validates and applies one inbound message.
     *
     * @throws KeyProviderException with {@code VALIDATION}, {@code INVALID_SIGNATURE},
     *                              {@code REPLAY_REJECTED} or {@code UNAUTHORIZED}
     */
    public ReceiveResult receive(String rawJson) {
        SyncMessage message;
        try {
            message = Jsons.fromJson(rawJson == null ? "" : rawJson, SyncMessage.class);
        } catch (IllegalArgumentException e) {
            throw rejectInbound(KeyProviderException.validation("Malformed sync message"), null, "malformed_json");
        }
        if (message == null || isBlank(message.messageId()) || isBlank(message.senderId())
                || isBlank(message.receiverId()) || message.type() == null) {
            throw rejectInbound(KeyProviderException.validation("Missing sync message fields"), message, "missing_fields");
        }
        PeerConfig peer = peers.find(message.senderId()).orElse(null);
        if (peer == null) {
            throw rejectInbound(integrity(KeyProviderException.Reason.INVALID_SIGNATURE), message, "unknown_sender");
        }
        if (!MessageSigner.verify(message, peer.sharedSecret())) {
            throw rejectInbound(integrity(KeyProviderException.Reason.INVALID_SIGNATURE), message, "bad_signature");
        }
        if (!config.localSystemId().equals(message.receiverId())) {
            throw rejectInbound(integrity(KeyProviderException.Reason.INVALID_SIGNATURE), message, "wrong_receiver");
        }
        long skewMs = Math.abs(clock.millis() - message.timestamp());
        if (skewMs > config.replayWindow().toMillis()) {
            throw rejectInbound(integrity(KeyProviderException.Reason.REPLAY_REJECTED), message,
                    "timestamp_outside_window skew_ms=" + skewMs);
        }

        String result = switch (message.type()) {
            case HEARTBEAT -> {
                peers.recordHeartbeat(peer.systemId());
                yield "heartbeat received";
            }
            case CAPABILITY_EXCHANGE -> {
                peers.recordSuccess(peer.systemId());
                applyCapabilities(peer, message);
                yield "capabilities recorded";
            }
            case KEY_SYNC -> {
                peers.recordSuccess(peer.systemId());
                yield applyKeySync(peer, message) ? "key stored" : "key already known";
            }
            case KEY_CONSUMED -> {
                peers.recordSuccess(peer.systemId());
                yield applyKeyConsumed(peer, message) ? "key consumed" : "consumption already applied";
            }
        };
        return new ReceiveResult(message.messageId(), peer.systemId(), message.type(), result);
    }

    private void applyCapabilities(PeerConfig peer, SyncMessage message) {
        CapabilityDescriptor descriptor;
        try {
            descriptor = Jsons.fromJson(message.payload() == null ? "" : message.payload(), CapabilityDescriptor.class);
        } catch (IllegalArgumentException e) {
            throw rejectInbound(KeyProviderException.validation("Malformed capability payload"), message, "bad_capabilities");
        }
        peers.recordCapabilities(peer.systemId(), descriptor);
    }

    private boolean applyKeySync(PeerConfig peer, SyncMessage message) {
        byte[] plaintext;
        try {
            plaintext = crypto(peer).decrypt(message.payload(), message.messageId());
        } catch (IllegalArgumentException e) {
            throw rejectInbound(KeyProviderException.validation("Invalid key sync payload"), message, "decrypt_failed");
        }
        KeySyncPayload payload;
        try {
            payload = Jsons.mapper().readValue(plaintext, KeySyncPayload.class);
        } catch (IOException e) {
            throw rejectInbound(KeyProviderException.validation("Invalid key sync payload"), message, "payload_parse_failed");
        } finally {
            KeyMaterial.wipe(plaintext);
        }
        if (payload == null || isBlank(payload.key())) {
            throw rejectInbound(KeyProviderException.validation("Invalid key sync payload"), message, "payload_missing_key");
        }
        if (!capabilities.authorize(payload.remoteSystemId())) {
            throw rejectInbound(KeyProviderException.unauthorized(payload.remoteSystemId()), message, "unauthorized_remote");
        }
        KeyMaterial material;
        try {
            material = KeyMaterial.fromHex(payload.key());
        } catch (IllegalArgumentException e) {
            throw rejectInbound(KeyProviderException.validation("Invalid key sync payload"), message, "payload_bad_hex");
        }
        try (material) {
            Instant createdAt = payload.createdAtMs() == null ? null : Instant.ofEpochMilli(payload.createdAtMs());
            return keyStore.acceptReplicated(
                    new KeyStore.ReplicatedKey(payload.keyId(), material, payload.remoteSystemId(),
                            payload.sizeBits() == null ? material.sizeBits() : payload.sizeBits(), createdAt),
                    peer.systemId());
        } catch (KeyProviderException e) {
            throw rejectInbound(e, message, "store_rejected " + e.reason());
        }
    }

    private boolean applyKeyConsumed(PeerConfig peer, SyncMessage message) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(message.payload() == null ? "" : message.payload());
        } catch (IOException e) {
            throw rejectInbound(KeyProviderException.validation("Malformed consumption notice"), message, "bad_notice");
        }
        String keyId = node == null ? "" : node.path("keyId").asText("");
        return keyStore.consumeReplicated(keyId, peer.systemId());
    }

    private KeyProviderException rejectInbound(KeyProviderException error, SyncMessage message, String cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cause", cause);
        if (message != null) {
            details.put("messageId", String.valueOf(message.messageId()));
            details.put("type", String.valueOf(message.type()));
            details.put("receiverId", String.valueOf(message.receiverId()));
        }
        String sender = message == null || message.senderId() == null ? "unknown" : message.senderId();
        audit.log(AuditLogger.AuditEvent.of("sync.receive", sender, "sync", "rejected", details));
        System.err.println("WARN sync message from " + sender + " rejected: " + cause);
        return error;
    }

    private static KeyProviderException integrity(KeyProviderException.Reason reason) {
        String message = reason == KeyProviderException.Reason.REPLAY_REJECTED
                ? "Message timestamp outside accepted window"
                : INVALID_SIGNATURE;
        return new KeyProviderException(reason, message);
    }

    private boolean sleepBackoff(int attempt) {
        try {
            Thread.sleep(backoffFor(attempt, config.retryBaseBackoff(), config.retryMaxBackoff()).toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Delay before retry number {@code attempt}: base, doubled per attempt, capped.
     */
    static Duration backoffFor(int attempt, Duration base, Duration cap) {
        long delay = base.toMillis();
        for (int i = 1; i < attempt && delay < cap.toMillis(); i++) {
            delay = delay * 2;
        }
        return Duration.ofMillis(Math.min(delay, cap.toMillis()));
    }

    private PayloadCrypto crypto(PeerConfig peer) {
        PayloadCrypto crypto = cryptoByPeer.get(peer.systemId());
        if (crypto == null) {
            throw new IllegalArgumentException("Unknown peer: " + peer.systemId());
        }
        return crypto;
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 200 ? value : value.substring(0, 200) + "...";
    }

    /**
     * Plaintext sealed inside a KEY_SYNC message.
     */
    record KeySyncPayload(String keyId, String key, String remoteSystemId, Integer sizeBits, Long createdAtMs) {
    }
}
