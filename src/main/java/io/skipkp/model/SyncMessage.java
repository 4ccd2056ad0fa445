package io.skipkp.model;

/**
 * Wire form of a message exchanged on {@code POST /sync}.
 *
 * <p>{@code timestamp} is epoch milliseconds. For {@link SyncMessageType#KEY_SYNC} the payload is
 * base64 ciphertext; for other types it is plain JSON text.
 */
public record SyncMessage(
        String messageId,
        String senderId,
        String receiverId,
        SyncMessageType type,
        long timestamp,
        String payload,
        String signature
) {
    public SyncMessage withSignature(String value) {
        return new SyncMessage(messageId, senderId, receiverId, type, timestamp, payload, value);
    }

    /**
     * Canonical byte string covered by the signature: every field except the signature itself.
     */
    public String signingInput() {
        return nullToEmpty(messageId) + '|'
                + nullToEmpty(senderId) + '|'
                + nullToEmpty(receiverId) + '|'
                + (type == null ? "" : type.name()) + '|'
                + timestamp + '|'
                + nullToEmpty(payload);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
