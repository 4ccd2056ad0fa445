package io.skipkp.sync;

import io.skipkp.model.SyncMessageType;

public record ReceiveResult(String messageId, String senderId, SyncMessageType type, String message) {
}
