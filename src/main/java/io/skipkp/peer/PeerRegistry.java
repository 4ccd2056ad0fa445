package io.skipkp.peer;

import io.skipkp.config.KeyProviderConfig;
import io.skipkp.config.PeerConfig;
import io.skipkp.model.CapabilityDescriptor;
import io.skipkp.model.PeerStatus;
import io.skipkp.model.PeerView;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness state for the configured peers. Holds no sockets; outcomes are reported to it by the
 * messenger.
 *
 * <p>A peer starts {@code UNKNOWN}, becomes {@code ONLINE} on any success or valid inbound
 * message, and drops to {@code OFFLINE} after {@code missedThreshold} consecutive failed sends.
 */
public final class PeerRegistry {
    private final Map<String, Peer> peers;
    private final int missedThreshold;
    private final Duration staleAfter;
    private final Clock clock;

    public PeerRegistry(KeyProviderConfig config) {
        this(config, Clock.systemUTC());
    }

    public PeerRegistry(KeyProviderConfig config, Clock clock) {
        Map<String, Peer> byId = new LinkedHashMap<>();
        for (PeerConfig peer : config.peers()) {
            byId.put(peer.systemId(), new Peer(peer));
        }
        this.peers = Map.copyOf(byId);
        this.missedThreshold = Math.max(1, config.missedThreshold());
        this.staleAfter = config.staleAfter();
        this.clock = clock;
    }

    public List<PeerConfig> peers() {
        List<PeerConfig> out = new ArrayList<>();
        for (Peer peer : peers.values()) {
            out.add(peer.config());
        }
        out.sort((a, b) -> a.systemId().compareTo(b.systemId()));
        return out;
    }

    public Optional<PeerConfig> find(String systemId) {
        Peer peer = systemId == null ? null : peers.get(systemId);
        return peer == null ? Optional.empty() : Optional.of(peer.config());
    }

    public PeerStatus status(String systemId) {
        return require(systemId).status();
    }

    public PeerStatus recordSuccess(String systemId) {
        return logTransition(systemId, require(systemId).recordSuccess(clock.instant()));
    }

    public PeerStatus recordFailure(String systemId) {
        return logTransition(systemId, require(systemId).recordFailure(missedThreshold));
    }

    /**
     * Inbound heartbeat from the peer.
     */
    public PeerStatus recordHeartbeat(String systemId) {
        return logTransition(systemId, require(systemId).recordHeartbeat(clock.instant()));
    }

    public void recordCapabilities(String systemId, CapabilityDescriptor descriptor) {
        require(systemId).recordCapabilities(descriptor);
    }

    public List<PeerView> views() {
        Instant now = clock.instant();
        List<PeerView> out = new ArrayList<>();
        for (PeerConfig config : peers()) {
            out.add(peers.get(config.systemId()).view(now, staleAfter));
        }
        return out;
    }

    private Peer require(String systemId) {
        Peer peer = systemId == null ? null : peers.get(systemId);
        if (peer == null) {
            throw new IllegalArgumentException("Unknown peer: " + systemId);
        }
        return peer;
    }

    private static PeerStatus logTransition(String systemId, Peer.Transition transition) {
        if (transition.before() != transition.after()) {
            System.out.println("peer " + systemId + ": " + transition.before() + " -> " + transition.after());
        }
        return transition.after();
    }
}
