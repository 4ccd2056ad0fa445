package io.skipkp.capability;

import io.skipkp.config.KeyProviderConfig;
import io.skipkp.model.CapabilityDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static capability descriptor plus remote-system authorization.
 *
 * <p>Authorization is fixed at startup; descriptors learned from peers never widen it.
 */
public final class CapabilityRegistry {
    private final CapabilityDescriptor descriptor;
    private final List<GlobPattern> patterns;

    public CapabilityRegistry(KeyProviderConfig config) {
        this.descriptor = new CapabilityDescriptor(
                true,
                true,
                config.algorithm(),
                config.localSystemId(),
                config.remoteSystemIds()
        );
        List<GlobPattern> compiled = new ArrayList<>();
        for (String raw : config.remoteSystemIds()) {
            if (raw != null && !raw.isEmpty()) {
                compiled.add(GlobPattern.compile(raw));
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    public CapabilityDescriptor describe() {
        return descriptor;
    }

    public boolean authorize(String remoteSystemId) {
        if (remoteSystemId == null || remoteSystemId.isBlank()) {
            return false;
        }
        for (GlobPattern pattern : patterns) {
            if (pattern.matches(remoteSystemId)) {
                return true;
            }
        }
        return false;
    }
}
