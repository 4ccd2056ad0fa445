package io.skipkp.security;

import io.skipkp.model.SyncMessage;
import io.skipkp.util.Hashing;

public final class MessageSigner {
    private MessageSigner() {
    }

    public static SyncMessage sign(SyncMessage message, String sharedSecret) {
        if (sharedSecret == null || sharedSecret.isBlank()) {
            throw new IllegalArgumentException("sharedSecret must not be blank");
        }
        String signature = Hashing.hmacSha256Hex(sharedSecret, message.signingInput());
        return message.withSignature(signature);
    }

    public static boolean verify(SyncMessage message, String sharedSecret) {
        if (message == null || sharedSecret == null || sharedSecret.isBlank()) {
            return false;
        }
        String signature = message.signature() == null ? "" : message.signature().trim();
        if (signature.isBlank()) {
            return false;
        }
        String expected = Hashing.hmacSha256Hex(sharedSecret, message.signingInput());
        return Hashing.constantTimeEquals(expected, signature);
    }
}
