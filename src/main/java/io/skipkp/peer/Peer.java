package io.skipkp.peer;

import io.skipkp.config.PeerConfig;
import io.skipkp.model.CapabilityDescriptor;
import io.skipkp.model.PeerStatus;
import io.skipkp.model.PeerView;

import java.time.Duration;
import java.time.Instant;

final class Peer {
    private final PeerConfig config;
    private PeerStatus status = PeerStatus.UNKNOWN;
    private Instant lastHeartbeatAt;
    private int consecutiveFailures;
    private CapabilityDescriptor capabilities;

    Peer(PeerConfig config) {
        this.config = config;
    }

    PeerConfig config() {
        return config;
    }

    synchronized PeerStatus status() {
        return status;
    }

    synchronized Transition recordSuccess(Instant now) {
        PeerStatus before = status;
        status = PeerStatus.ONLINE;
        consecutiveFailures = 0;
        lastHeartbeatAt = now;
        return new Transition(before, status);
    }

    synchronized Transition recordHeartbeat(Instant now) {
        return recordSuccess(now);
    }

    synchronized Transition recordFailure(int missedThreshold) {
        PeerStatus before = status;
        consecutiveFailures++;
        if (consecutiveFailures >= missedThreshold) {
            status = PeerStatus.OFFLINE;
        }
        return new Transition(before, status);
    }

    synchronized void recordCapabilities(CapabilityDescriptor descriptor) {
        this.capabilities = descriptor;
    }

    synchronized PeerView view(Instant now, Duration staleAfter) {
        boolean stale = status == PeerStatus.ONLINE
                && lastHeartbeatAt != null
                && lastHeartbeatAt.plus(staleAfter).isBefore(now);
        return new PeerView(
                config.systemId(),
                config.baseUrl(),
                status,
                lastHeartbeatAt == null ? null : lastHeartbeatAt.toEpochMilli(),
                consecutiveFailures,
                stale,
                capabilities
        );
    }

    record Transition(PeerStatus before, PeerStatus after) {
    }
}
