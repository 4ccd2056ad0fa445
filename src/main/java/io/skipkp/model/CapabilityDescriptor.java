package io.skipkp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CapabilityDescriptor(
        @JsonProperty("entropy") boolean entropy,
        @JsonProperty("key") boolean key,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("localSystemID") String localSystemId,
        @JsonProperty("remoteSystemID") List<String> remoteSystemIds
) {
    public CapabilityDescriptor {
        remoteSystemIds = remoteSystemIds == null ? List.of() : List.copyOf(remoteSystemIds);
    }
}
