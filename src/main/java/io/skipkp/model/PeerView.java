package io.skipkp.model;

public record PeerView(
        String systemId,
        String endpoint,
        PeerStatus status,
        Long lastHeartbeatMs,
        int consecutiveFailures,
        boolean stale,
        CapabilityDescriptor capabilities
) {
}
