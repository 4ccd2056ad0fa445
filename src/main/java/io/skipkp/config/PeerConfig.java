package io.skipkp.config;

public record PeerConfig(String systemId, String endpoint, int port, String sharedSecret) {

    public String baseUrl() {
        return "http://" + endpoint + ":" + port;
    }

    @Override
    public String toString() {
        return "PeerConfig[systemId=" + systemId + ", endpoint=" + endpoint + ", port=" + port + "]";
    }
}
