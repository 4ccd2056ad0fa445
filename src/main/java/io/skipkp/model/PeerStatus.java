package io.skipkp.model;

public enum PeerStatus {
    UNKNOWN,
    ONLINE,
    OFFLINE
}
