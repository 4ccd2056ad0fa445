package io.skipkp.storage;

import io.skipkp.model.KeyRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for key records and their per-peer replication state.
 *
 * <p>Every byte array handed out is a fresh copy owned by the caller. Implementations must make
 * {@link #consume(String, Instant)} a compare-and-set on the consumed flag: of any number of
 * concurrent calls for one key, at most one observes {@link ConsumeOutcome#CONSUMED}.
 */
public interface KeyRecordRepository {

    /**
     * Stores a new record together with its {@code syncedPeers}.
     *
     * @return false when the key id already exists (live or tombstone); the stored row is untouched
     */
    boolean insert(KeyRecord record);

    Optional<KeyRecord> find(String keyId);

    /**
     * Marks the record consumed and erases the stored material in one step.
     */
    ConsumeResult consume(String keyId, Instant now);

    /**
     * Deletes every record created before {@code cutoff}, consumed or not.
     */
    int deleteCreatedBefore(Instant cutoff);

    /**
     * Live records the peer does not hold yet, oldest first, excluding records that came from it.
     */
    List<KeyRecord> pendingReplication(String peerId, int limit);

    void markSynced(String keyId, String peerId, Instant now);

    /**
     * Consumed keys the peer holds but has not been told about.
     */
    List<String> pendingConsumptionNotices(String peerId, int limit);

    void markNotified(String keyId, String peerId, Instant now);

    long countLive();

    Stats stats();

    boolean healthy();

    enum ConsumeOutcome {
        CONSUMED,
        ALREADY_CONSUMED,
        NOT_FOUND
    }

    /**
     * {@code material} is non-null only for {@link ConsumeOutcome#CONSUMED}; the caller owns it.
     */
    record ConsumeResult(ConsumeOutcome outcome, byte[] material, String remoteSystemId) {
        public static ConsumeResult of(ConsumeOutcome outcome) {
            return new ConsumeResult(outcome, null, null);
        }
    }

    record Stats(long live, long consumed, long total) {
    }
}
