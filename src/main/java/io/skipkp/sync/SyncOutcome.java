package io.skipkp.sync;

import io.skipkp.model.SyncMessageType;

/**
 * Result of one send, after retries.
 */
public record SyncOutcome(
        String peerId,
        SyncMessageType type,
        String messageId,
        Status status,
        int attempts,
        int httpStatus,
        String detail
) {
    public boolean delivered() {
        return status == Status.DELIVERED;
    }

    public enum Status {
        DELIVERED,
        REJECTED,
        UNREACHABLE
    }
}
