package io.skipkp.model;

public enum SyncMessageType {
    HEARTBEAT,
    KEY_SYNC,
    CAPABILITY_EXCHANGE,
    KEY_CONSUMED
}
