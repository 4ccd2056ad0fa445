package io.skipkp.sync;

import io.skipkp.config.KeyProviderConfig;
import io.skipkp.config.PeerConfig;
import io.skipkp.keystore.KeyStore;
import io.skipkp.model.KeyRecord;
import io.skipkp.model.PeerStatus;
import io.skipkp.peer.PeerRegistry;
import io.skipkp.security.KeyMaterial;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives heartbeats, key replication and the expiry sweep.
 *
 * <p>Timed cycles run as independent per-peer tasks; the {@code run*Once} methods fan one pass out
 * over a worker pool and wait for it. Messages to a single peer are serialized by that peer's
 * lock and no lock is shared across peers.
 */
public final class SyncScheduler implements AutoCloseable {
    private static final long STOP_MARGIN_MS = 1_000L;

    private final KeyProviderConfig config;
    private final KeyStore keyStore;
    private final PeerRegistry peers;
    private final SyncMessenger messenger;
    private final ExecutorService workers;
    private final Map<String, ReentrantLock> peerLocks;
    private volatile ScheduledExecutorService timer;

    public SyncScheduler(KeyProviderConfig config, KeyStore keyStore, PeerRegistry peers, SyncMessenger messenger) {
        this.config = config;
        this.keyStore = keyStore;
        this.peers = peers;
        this.messenger = messenger;
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.syncThreads()), daemonThreads("skip-kp-sync-worker"));
        Map<String, ReentrantLock> locks = new LinkedHashMap<>();
        for (PeerConfig peer : peers.peers()) {
            locks.put(peer.systemId(), new ReentrantLock());
        }
        this.peerLocks = Map.copyOf(locks);
    }

    /**
     * Schedules the timed cycles. Every peer gets its own heartbeat and replication task so a slow
     * peer only holds up its own schedule.
     */
    public synchronized void start() {
        if (timer != null) {
            return;
        }
        boolean syncing = config.syncEnabled() && !peerLocks.isEmpty();
        // Per peer: capability exchange, heartbeat and replication; plus the sweep.
        int threads = (syncing ? 3 * peerLocks.size() : 0) + 1;
        timer = Executors.newScheduledThreadPool(threads, daemonThreads("skip-kp-sync-timer"));
        if (syncing) {
            for (PeerConfig peer : peers.peers()) {
                String id = peer.systemId();
                timer.execute(() -> guarded("capability exchange " + id,
                        () -> runLocked(peer, () -> messenger.sendCapabilities(peer))));
                scheduleEvery(config.heartbeatInterval(), "heartbeat " + id,
                        () -> runLocked(peer, () -> messenger.sendHeartbeat(peer)));
                scheduleEvery(config.syncInterval(), "replication " + id, () -> replicateIfOnline(peer));
            }
        }
        scheduleEvery(config.sweepInterval(), "sweep", keyStore::sweep);
        System.out.println("sync scheduler started peers=" + peerLocks.size()
                + " syncEnabled=" + config.syncEnabled()
                + " heartbeatMs=" + config.heartbeatInterval().toMillis()
                + " syncMs=" + config.syncInterval().toMillis());
    }

    public List<SyncOutcome> runCapabilityExchangeOnce() {
        return forEachPeer(peer -> runLocked(peer, () -> messenger.sendCapabilities(peer)));
    }

    public List<SyncOutcome> runHeartbeatsOnce() {
        return forEachPeer(peer -> runLocked(peer, () -> messenger.sendHeartbeat(peer)));
    }

    /**
     * One replication pass: pending keys first, then consumption notices. OFFLINE peers are
     * skipped until a heartbeat brings them back.
     */
    public List<ReplicationReport> runReplicationOnce() {
        return forEachPeer(this::replicateIfOnline);
    }

    public int runSweepOnce() {
        return keyStore.sweep();
    }

    private ReplicationReport replicateIfOnline(PeerConfig peer) {
        if (peers.status(peer.systemId()) == PeerStatus.OFFLINE) {
            return new ReplicationReport(peer.systemId(), 0, 0, 0, true);
        }
        return runLocked(peer, () -> replicateTo(peer));
    }

    private ReplicationReport replicateTo(PeerConfig peer) {
        int keysSent = 0;
        int noticesSent = 0;
        int failures = 0;
        boolean reachable = true;
        List<KeyRecord> pending = keyStore.pendingReplication(peer.systemId(), config.replicationBatchSize());
        try {
            for (KeyRecord record : pending) {
                SyncOutcome outcome = messenger.sendKey(peer, record);
                if (outcome.delivered()) {
                    keyStore.markSynced(record.keyId(), peer.systemId());
                    keysSent++;
                } else {
                    failures++;
                    if (outcome.status() == SyncOutcome.Status.UNREACHABLE) {
                        reachable = false;
                        break;
                    }
                }
            }
        } finally {
            for (KeyRecord record : pending) {
                KeyMaterial.wipe(record.keyMaterial());
            }
        }
        if (reachable) {
            for (String keyId : keyStore.pendingConsumptionNotices(peer.systemId(), config.replicationBatchSize())) {
                SyncOutcome outcome = messenger.sendConsumed(peer, keyId);
                if (outcome.delivered()) {
                    keyStore.markNotified(keyId, peer.systemId());
                    noticesSent++;
                } else {
                    failures++;
                    if (outcome.status() == SyncOutcome.Status.UNREACHABLE) {
                        break;
                    }
                }
            }
        }
        if (keysSent > 0 || noticesSent > 0 || failures > 0) {
            System.out.println("replication peer=" + peer.systemId() + " keys=" + keysSent
                    + " notices=" + noticesSent + " failures=" + failures);
        }
        return new ReplicationReport(peer.systemId(), keysSent, noticesSent, failures, false);
    }

    private <T> List<T> forEachPeer(PeerTask<T> task) {
        List<PeerConfig> targets = peers.peers();
        List<Future<T>> futures = new ArrayList<>();
        for (PeerConfig peer : targets) {
            futures.add(workers.submit((Callable<T>) () -> task.run(peer)));
        }
        List<T> out = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                System.err.println("WARN sync task for peer " + targets.get(i).systemId() + " failed: " + cause);
            }
        }
        return out;
    }

    private <T> T runLocked(PeerConfig peer, Supplier<T> body) {
        ReentrantLock lock = peerLocks.get(peer.systemId());
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    private void scheduleEvery(Duration interval, String name, Runnable body) {
        long ms = Math.max(1L, interval.toMillis());
        timer.scheduleWithFixedDelay(() -> guarded(name, body), ms, ms, TimeUnit.MILLISECONDS);
    }

    private static void guarded(String name, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            // A throwing task would cancel its schedule.
            System.err.println("WARN " + name + " cycle failed: " + e);
        }
    }

    /**
     * Stops scheduling new cycles. Sends already on the wire get one full call timeout to finish
     * before they are interrupted.
     */
    public synchronized void stop() {
        long graceMs = config.syncTimeout().toMillis() + STOP_MARGIN_MS;
        ScheduledExecutorService current = timer;
        timer = null;
        if (current != null) {
            current.shutdown();
        }
        workers.shutdown();
        long deadline = System.currentTimeMillis() + graceMs;
        if (current != null) {
            awaitOrInterrupt(current, deadline);
        }
        awaitOrInterrupt(workers, deadline);
    }

    @Override
    public void close() {
        stop();
    }

    private static void awaitOrInterrupt(ExecutorService executor, long deadlineMs) {
        try {
            long remaining = Math.max(0L, deadlineMs - System.currentTimeMillis());
            if (!executor.awaitTermination(remaining, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface PeerTask<T> {
        T run(PeerConfig peer) throws Exception;
    }

    public record ReplicationReport(String peerId, int keysSent, int noticesSent, int failures, boolean skipped) {
    }
}
