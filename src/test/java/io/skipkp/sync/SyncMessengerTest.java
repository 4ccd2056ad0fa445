package io.skipkp.sync;

import io.skipkp.TestConfigs;
import io.skipkp.config.PeerConfig;
import io.skipkp.keystore.KeyStore;
import io.skipkp.model.KeyProviderException;
import io.skipkp.model.PeerStatus;
import io.skipkp.model.SyncMessage;
import io.skipkp.model.SyncMessageType;
import io.skipkp.runtime.KeyProviderRuntime;
import io.skipkp.security.KeyMaterial;
import io.skipkp.security.MessageSigner;
import io.skipkp.security.PayloadCrypto;
import io.skipkp.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

final class SyncMessengerTest {
    private static final String KEY_ID = "00112233445566778899aabbccddeeff";
    private static final String KEY_HEX = "5a".repeat(32);

    @Test
    void heartbeatMarksBothSidesOnline() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            SyncOutcome outcome = nodes.a.messenger().sendHeartbeat(peerOf(nodes.a, "KP_B"));
            Assertions.assertTrue(outcome.delivered());
            Assertions.assertEquals(1, outcome.attempts());
            Assertions.assertEquals(200, outcome.httpStatus());
            Assertions.assertEquals(PeerStatus.ONLINE, nodes.a.peers().status("KP_B"));
            Assertions.assertEquals(PeerStatus.ONLINE, nodes.b.peers().status("KP_A"));
        }
    }

    @Test
    void signedSealedKeyIsStoredOnceAndRetrievable() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            String messageId = UUID.randomUUID().toString();
            SyncMessage message = keySync(messageId, "KP_A", "KP_B", seal(keyPayload(), messageId),
                    System.currentTimeMillis());
            String body = Jsons.toJson(MessageSigner.sign(message, TestConfigs.SECRET_AB));

            ReceiveResult result = nodes.b.messenger().receive(body);
            Assertions.assertEquals("key stored", result.message());
            Assertions.assertEquals(SyncMessageType.KEY_SYNC, result.type());
            Assertions.assertEquals("key already known", nodes.b.messenger().receive(body).message());

            try (KeyMaterial material = nodes.b.keyStore().retrieve(KEY_ID, SyncNodes.CLIENT)) {
                Assertions.assertEquals(KEY_HEX, material.toHex());
            }
        }
    }

    @Test
    void tamperedMessagesNeverReachTheStore() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            String messageId = UUID.randomUUID().toString();
            String sealed = seal(keyPayload(), messageId);
            SyncMessage signed = MessageSigner.sign(
                    keySync(messageId, "KP_A", "KP_B", sealed, System.currentTimeMillis()), TestConfigs.SECRET_AB);

            // Payload altered after signing.
            SyncMessage altered = new SyncMessage(signed.messageId(), signed.senderId(), signed.receiverId(),
                    signed.type(), signed.timestamp(), flipMiddleChar(sealed), signed.signature());
            assertRejected(nodes, Jsons.toJson(altered), KeyProviderException.Reason.INVALID_SIGNATURE);

            // Re-signed by someone holding the secret, but the ciphertext no longer authenticates.
            SyncMessage resigned = MessageSigner.sign(altered.withSignature(null), TestConfigs.SECRET_AB);
            assertRejected(nodes, Jsons.toJson(resigned), KeyProviderException.Reason.VALIDATION);

            // Ciphertext lifted from another message id.
            String otherId = UUID.randomUUID().toString();
            SyncMessage moved = MessageSigner.sign(
                    keySync(otherId, "KP_A", "KP_B", sealed, System.currentTimeMillis()), TestConfigs.SECRET_AB);
            assertRejected(nodes, Jsons.toJson(moved), KeyProviderException.Reason.VALIDATION);

            // Wrong shared secret.
            SyncMessage forged = MessageSigner.sign(
                    keySync(messageId, "KP_A", "KP_B", sealed, System.currentTimeMillis()), TestConfigs.SECRET_AC);
            assertRejected(nodes, Jsons.toJson(forged), KeyProviderException.Reason.INVALID_SIGNATURE);

            Assertions.assertEquals(0L, nodes.b.keyStore().stats().total());
        }
    }

    @Test
    void wrongReceiverUnknownSenderAndGarbageAreRejected() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            SyncMessage wrongReceiver = MessageSigner.sign(new SyncMessage(UUID.randomUUID().toString(), "KP_A", "KP_C",
                    SyncMessageType.HEARTBEAT, System.currentTimeMillis(), "{}", null), TestConfigs.SECRET_AB);
            assertRejected(nodes, Jsons.toJson(wrongReceiver), KeyProviderException.Reason.INVALID_SIGNATURE);

            SyncMessage unknownSender = MessageSigner.sign(new SyncMessage(UUID.randomUUID().toString(), "KP_Z", "KP_B",
                    SyncMessageType.HEARTBEAT, System.currentTimeMillis(), "{}", null), TestConfigs.SECRET_AB);
            assertRejected(nodes, Jsons.toJson(unknownSender), KeyProviderException.Reason.INVALID_SIGNATURE);

            assertRejected(nodes, "not json", KeyProviderException.Reason.VALIDATION);
            assertRejected(nodes, "{\"messageId\":\"x\"}", KeyProviderException.Reason.VALIDATION);

            Assertions.assertEquals(PeerStatus.UNKNOWN, nodes.b.peers().status("KP_A"));
        }
    }

    @Test
    void staleTimestampIsRejectedWithoutRetry() throws Exception {
        Clock behind = Clock.offset(Clock.systemUTC(), Duration.ofMinutes(-10));
        try (SyncNodes nodes = SyncNodes.create(behind)) {
            SyncOutcome outcome = nodes.a.messenger().sendHeartbeat(peerOf(nodes.a, "KP_B"));
            Assertions.assertEquals(SyncOutcome.Status.REJECTED, outcome.status());
            Assertions.assertEquals(1, outcome.attempts());
            Assertions.assertEquals(400, outcome.httpStatus());
            Assertions.assertTrue(outcome.detail().contains("outside accepted window"));
            Assertions.assertEquals(1, nodes.transport.posts());

            // B answered, so A still considers it reachable; B never accepted A's message.
            Assertions.assertEquals(PeerStatus.ONLINE, nodes.a.peers().status("KP_B"));
            Assertions.assertEquals(PeerStatus.UNKNOWN, nodes.b.peers().status("KP_A"));
        }
    }

    @Test
    void unreachablePeerIsRetriedThenMarkedOffline() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            nodes.transport.setDown("KP_B", true);
            PeerConfig peer = peerOf(nodes.a, "KP_B");

            SyncOutcome first = nodes.a.messenger().sendHeartbeat(peer);
            Assertions.assertEquals(SyncOutcome.Status.UNREACHABLE, first.status());
            Assertions.assertEquals(3, first.attempts());
            Assertions.assertEquals(3, nodes.transport.posts());
            Assertions.assertTrue(first.detail().startsWith("ConnectException"));

            nodes.a.messenger().sendHeartbeat(peer);
            Assertions.assertNotEquals(PeerStatus.OFFLINE, nodes.a.peers().status("KP_B"));
            nodes.a.messenger().sendHeartbeat(peer);
            Assertions.assertEquals(PeerStatus.OFFLINE, nodes.a.peers().status("KP_B"));

            nodes.transport.setDown("KP_B", false);
            Assertions.assertTrue(nodes.a.messenger().sendHeartbeat(peer).delivered());
            Assertions.assertEquals(PeerStatus.ONLINE, nodes.a.peers().status("KP_B"));
        }
    }

    @Test
    void interruptedSendIsNotCountedAgainstThePeer() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            nodes.transport.setDelay("KP_B", Duration.ofSeconds(5));
            AtomicReference<SyncOutcome> result = new AtomicReference<>();
            Thread sender = new Thread(() -> result.set(nodes.a.messenger().sendHeartbeat(peerOf(nodes.a, "KP_B"))));
            sender.start();
            Thread.sleep(200L);
            sender.interrupt();
            sender.join(5_000L);

            SyncOutcome outcome = result.get();
            Assertions.assertNotNull(outcome);
            Assertions.assertEquals(SyncOutcome.Status.UNREACHABLE, outcome.status());
            Assertions.assertEquals("interrupted", outcome.detail());
            Assertions.assertEquals(1, outcome.attempts());
            Assertions.assertEquals(0, nodes.a.peers().views().get(0).consecutiveFailures());
            Assertions.assertEquals(PeerStatus.UNKNOWN, nodes.a.peers().status("KP_B"));
        }
    }

    @Test
    void consumptionNoticeBurnsTheReplica() throws Exception {
        try (SyncNodes nodes = SyncNodes.create()) {
            String keyId;
            try (KeyStore.GeneratedKey key = nodes.a.keyStore().generate(SyncNodes.CLIENT, 256)) {
                keyId = key.keyId();
            }
            PeerConfig peer = peerOf(nodes.a, "KP_B");
            Assertions.assertTrue(nodes.a.messenger()
                    .sendKey(peer, nodes.a.keyStore().pendingReplication("KP_B", 10).get(0)).delivered());
            Assertions.assertTrue(nodes.a.messenger().sendConsumed(peer, keyId).delivered());

            KeyProviderException e = Assertions.assertThrows(KeyProviderException.class,
                    () -> nodes.b.keyStore().retrieve(keyId, SyncNodes.CLIENT));
            Assertions.assertEquals(KeyProviderException.Reason.ALREADY_CONSUMED, e.reason());
        }
    }

    @Test
    void backoffDoublesUpToTheCap() {
        Duration base = Duration.ofMillis(100);
        Duration cap = Duration.ofMillis(800);
        Assertions.assertEquals(Duration.ofMillis(100), SyncMessenger.backoffFor(1, base, cap));
        Assertions.assertEquals(Duration.ofMillis(200), SyncMessenger.backoffFor(2, base, cap));
        Assertions.assertEquals(Duration.ofMillis(400), SyncMessenger.backoffFor(3, base, cap));
        Assertions.assertEquals(Duration.ofMillis(800), SyncMessenger.backoffFor(4, base, cap));
        Assertions.assertEquals(Duration.ofMillis(800), SyncMessenger.backoffFor(30, base, cap));
    }

    private static void assertRejected(SyncNodes nodes, String body, KeyProviderException.Reason reason) {
        KeyProviderException e = Assertions.assertThrows(KeyProviderException.class,
                () -> nodes.b.messenger().receive(body));
        Assertions.assertEquals(reason, e.reason());
    }

    private static PeerConfig peerOf(KeyProviderRuntime runtime, String systemId) {
        return runtime.peers().find(systemId).orElseThrow();
    }

    private static SyncMessenger.KeySyncPayload keyPayload() {
        return new SyncMessenger.KeySyncPayload(KEY_ID, KEY_HEX, SyncNodes.CLIENT, 256, System.currentTimeMillis());
    }

    private static String seal(SyncMessenger.KeySyncPayload payload, String messageId) throws Exception {
        return new PayloadCrypto(TestConfigs.SECRET_AB).encrypt(Jsons.mapper().writeValueAsBytes(payload), messageId);
    }

    private static SyncMessage keySync(String messageId, String sender, String receiver, String payload, long ts) {
        return new SyncMessage(messageId, sender, receiver, SyncMessageType.KEY_SYNC, ts, payload, null);
    }

    private static String flipMiddleChar(String value) {
        int i = value.length() / 2;
        char replacement = value.charAt(i) == 'A' ? 'B' : 'A';
        return value.substring(0, i) + replacement + value.substring(i + 1);
    }
}
