package io.skipkp.storage;

import io.skipkp.model.KeyRecord;
import io.skipkp.security.KeyMaterial;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Heap-backed repository for tests and throwaway nodes. Nothing survives a restart.
 */
public final class InMemoryKeyRecordRepository implements KeyRecordRepository {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean insert(KeyRecord record) {
        Entry entry = new Entry(record);
        if (entries.putIfAbsent(record.keyId(), entry) != null) {
            entry.erase();
            return false;
        }
        return true;
    }

    @Override
    public Optional<KeyRecord> find(String keyId) {
        Entry entry = entries.get(keyId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    @Override
    public ConsumeResult consume(String keyId, Instant now) {
        Entry entry = entries.get(keyId);
        if (entry == null) {
            return ConsumeResult.of(ConsumeOutcome.NOT_FOUND);
        }
        if (!entry.consumed.compareAndSet(false, true)) {
            return ConsumeResult.of(ConsumeOutcome.ALREADY_CONSUMED);
        }
        entry.consumedAt = now;
        return new ConsumeResult(ConsumeOutcome.CONSUMED, entry.takeMaterial(), entry.remoteSystemId);
    }

    @Override
    public int deleteCreatedBefore(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().createdAt.isBefore(cutoff) && entries.remove(e.getKey(), e.getValue())) {
                e.getValue().erase();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<KeyRecord> pendingReplication(String peerId, int limit) {
        return entries.values().stream()
                .filter(e -> !e.consumed.get())
                .filter(e -> !e.origin.equals(peerId))
                .filter(e -> !e.synced.contains(peerId))
                .sorted(Comparator.comparing((Entry e) -> e.createdAt).thenComparing(e -> e.keyId))
                .limit(Math.max(1, limit))
                .map(Entry::snapshot)
                .toList();
    }

    @Override
    public void markSynced(String keyId, String peerId, Instant now) {
        Entry entry = entries.get(keyId);
        if (entry != null) {
            entry.synced.add(peerId);
        }
    }

    @Override
    public List<String> pendingConsumptionNotices(String peerId, int limit) {
        List<Entry> matches = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (e.consumed.get() && e.synced.contains(peerId) && !e.notified.contains(peerId)) {
                matches.add(e);
            }
        }
        matches.sort(Comparator.comparing((Entry e) -> e.consumedAt == null ? Instant.EPOCH : e.consumedAt)
                .thenComparing(e -> e.keyId));
        return matches.stream().limit(Math.max(1, limit)).map(e -> e.keyId).toList();
    }

    @Override
    public void markNotified(String keyId, String peerId, Instant now) {
        Entry entry = entries.get(keyId);
        if (entry != null) {
            entry.notified.add(peerId);
        }
    }

    @Override
    public long countLive() {
        return entries.values().stream().filter(e -> !e.consumed.get()).count();
    }

    @Override
    public Stats stats() {
        long total = entries.size();
        long live = countLive();
        return new Stats(live, total - live, total);
    }

    @Override
    public boolean healthy() {
        return true;
    }

    private static final class Entry {
        private final String keyId;
        private final String remoteSystemId;
        private final int sizeBits;
        private final Instant createdAt;
        private final String origin;
        private final AtomicBoolean consumed;
        private final Set<String> synced = ConcurrentHashMap.newKeySet();
        private final Set<String> notified = ConcurrentHashMap.newKeySet();
        private volatile Instant consumedAt;
        private byte[] material;

        private Entry(KeyRecord record) {
            this.keyId = record.keyId();
            this.remoteSystemId = record.remoteSystemId();
            this.sizeBits = record.sizeBits();
            this.createdAt = record.createdAt();
            this.origin = record.origin() == null ? "" : record.origin();
            this.consumed = new AtomicBoolean(record.consumed());
            byte[] in = record.keyMaterial();
            this.material = record.consumed() || in == null ? null : Arrays.copyOf(in, in.length);
            this.synced.addAll(record.syncedPeers());
        }

        private synchronized byte[] takeMaterial() {
            byte[] out = material == null ? new byte[0] : material;
            material = null;
            return out;
        }

        private synchronized void erase() {
            KeyMaterial.wipe(material);
            material = null;
        }

        private synchronized KeyRecord snapshot() {
            byte[] copy = material == null ? new byte[0] : Arrays.copyOf(material, material.length);
            return new KeyRecord(keyId, copy, remoteSystemId, sizeBits, createdAt, consumed.get(), origin, Set.copyOf(synced));
        }
    }
}
