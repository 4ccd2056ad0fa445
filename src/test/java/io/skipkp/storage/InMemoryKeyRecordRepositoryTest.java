package io.skipkp.storage;

import io.skipkp.model.KeyRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

final class InMemoryKeyRecordRepositoryTest {
    private static final String KEY = "0123456789abcdef0123456789abcdef";

    @Test
    void behavesLikeTheSqliteRepositoryForConsumption() {
        InMemoryKeyRecordRepository repo = new InMemoryKeyRecordRepository();
        byte[] material = {9, 8, 7, 6};
        Assertions.assertTrue(repo.insert(new KeyRecord(KEY, material, "KP_QuIIN_Client", 32, Instant.now(),
                false, "KP_A", Set.of())));
        material[0] = 0;

        KeyRecordRepository.ConsumeResult result = repo.consume(KEY, Instant.now());
        Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.CONSUMED, result.outcome());
        Assertions.assertArrayEquals(new byte[]{9, 8, 7, 6}, result.material());
        Assertions.assertEquals(KeyRecordRepository.ConsumeOutcome.ALREADY_CONSUMED, repo.consume(KEY, Instant.now()).outcome());
        Assertions.assertEquals(0, repo.find(KEY).orElseThrow().keyMaterial().length);
    }

    @Test
    void concurrentConsumersHaveExactlyOneWinner() throws Exception {
        InMemoryKeyRecordRepository repo = new InMemoryKeyRecordRepository();
        repo.insert(new KeyRecord(KEY, new byte[16], "KP_QuIIN_Client", 128, Instant.now(), false, "KP_A", Set.of()));
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<KeyRecordRepository.ConsumeOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(pool.submit((Callable<KeyRecordRepository.ConsumeOutcome>) () -> {
                    start.await();
                    return repo.consume(KEY, Instant.now()).outcome();
                }));
            }
            start.countDown();
            long winners = 0;
            for (Future<KeyRecordRepository.ConsumeOutcome> f : futures) {
                if (f.get() == KeyRecordRepository.ConsumeOutcome.CONSUMED) {
                    winners++;
                }
            }
            Assertions.assertEquals(1L, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
