package io.skipkp.storage;

import io.skipkp.model.KeyRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

final class SqliteKeyRecordRepositoryTest {
    private static final String KEY_1 = "00000000000000000000000000000001";
    private static final String KEY_2 = "00000000000000000000000000000002";

    @Test
    void consumeHandsOutMaterialOnceAndLeavesTombstone() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-sqlite-");
        try {
            SqliteKeyRecordRepository repo = open(root);
            Instant now = Instant.now();
            Assertions.assertTrue(repo.insert(record(KEY_1, now, "KP_A")));
            Assertions.assertFalse(repo.insert(record(KEY_1, now, "KP_A")));

            KeyRecordRepository.ConsumeResult first = repo.consume(KEY_1, now);
            Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.CONSUMED, first.outcome());
            Assertions.assertArrayEquals(material(), first.material());
            Assertions.assertEquals("KP_QuIIN_Client", first.remoteSystemId());

            Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.ALREADY_CONSUMED, repo.consume(KEY_1, now).outcome());
            Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.NOT_FOUND, repo.consume(KEY_2, now).outcome());

            KeyRecord tombstone = repo.find(KEY_1).orElseThrow();
            Assertions.assertTrue(tombstone.consumed());
            Assertions.assertEquals(0, tombstone.keyMaterial().length);
            Assertions.assertEquals(new KeyRecordRepository.Stats(0L, 1L, 1L), repo.stats());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentConsumersHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-sqlite-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            SqliteKeyRecordRepository repo = open(root);
            repo.insert(record(KEY_1, Instant.now(), "KP_A"));
            CountDownLatch start = new CountDownLatch(1);
            List<Future<KeyRecordRepository.ConsumeOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit((Callable<KeyRecordRepository.ConsumeOutcome>) () -> {
                    start.await();
                    return repo.consume(KEY_1, Instant.now()).outcome();
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<KeyRecordRepository.ConsumeOutcome> f : futures) {
                KeyRecordRepository.ConsumeOutcome outcome = f.get();
                if (outcome == KeyRecordRepository.ConsumeOutcome.CONSUMED) {
                    winners++;
                } else {
                    Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.ALREADY_CONSUMED, outcome);
                }
            }
            Assertions.assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void replicationBookkeepingTracksPerPeerState() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-sqlite-");
        try {
            SqliteKeyRecordRepository repo = open(root);
            Instant now = Instant.now();
            repo.insert(record(KEY_1, now, "KP_A"));
            repo.insert(new KeyRecord(KEY_2, material(), "KP_QuIIN_Client", 256, now.plusMillis(1),
                    false, "KP_B", Set.of("KP_B")));

            Assertions.assertEquals(List.of(KEY_1), ids(repo.pendingReplication("KP_B", 10)));
            Assertions.assertEquals(List.of(KEY_1, KEY_2), ids(repo.pendingReplication("KP_C", 10)));
            Assertions.assertEquals(Set.of("KP_B"), repo.find(KEY_2).orElseThrow().syncedPeers());

            repo.markSynced(KEY_1, "KP_B", now);
            Assertions.assertTrue(repo.pendingReplication("KP_B", 10).isEmpty());

            repo.consume(KEY_1, now);
            repo.consume(KEY_2, now);
            Assertions.assertEquals(List.of(KEY_1, KEY_2), repo.pendingConsumptionNotices("KP_B", 10));
            Assertions.assertTrue(repo.pendingConsumptionNotices("KP_C", 10).isEmpty());
            Assertions.assertTrue(repo.pendingReplication("KP_C", 10).isEmpty());

            repo.markNotified(KEY_1, "KP_B", now);
            Assertions.assertEquals(List.of(KEY_2), repo.pendingConsumptionNotices("KP_B", 10));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sweepDeletesOldRecordsAndTheirPeerState() throws Exception {
        Path root = Files.createTempDirectory("skip-kp-test-sqlite-");
        try {
            SqliteKeyRecordRepository repo = open(root);
            Instant now = Instant.now();
            repo.insert(record(KEY_1, now.minus(Duration.ofHours(2)), "KP_A"));
            repo.insert(record(KEY_2, now, "KP_A"));
            repo.markSynced(KEY_1, "KP_B", now);
            repo.consume(KEY_1, now);

            Assertions.assertEquals(1, repo.deleteCreatedBefore(now.minus(Duration.ofHours(1))));
            Assertions.assertTrue(repo.find(KEY_1).isEmpty());
            Assertions.assertTrue(repo.find(KEY_2).isPresent());
            Assertions.assertTrue(repo.pendingConsumptionNotices("KP_B", 10).isEmpty());
            Assertions.assertEquals(1L, repo.countLive());
            Assertions.assertTrue(repo.healthy());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteKeyRecordRepository open(Path root) {
        Database db = new Database(root.resolve("skip-kp.db"));
        db.init();
        return new SqliteKeyRecordRepository(db);
    }

    private static KeyRecord record(String keyId, Instant createdAt, String origin) {
        return new KeyRecord(keyId, material(), "KP_QuIIN_Client", 256, createdAt, false, origin, Set.of());
    }

    private static byte[] material() {
        byte[] out = new byte[32];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (i + 1);
        }
        return out;
    }

    private static List<String> ids(List<KeyRecord> records) {
        return records.stream().map(KeyRecord::keyId).toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
