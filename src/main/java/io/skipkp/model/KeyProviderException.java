package io.skipkp.model;

/**
 * Failure raised by the key lifecycle and synchronization engines.
 *
 * <p>The {@link Reason} decides the HTTP status the protocol handler renders; the message is
 * kept short because it may reach the client.
 */
public final class KeyProviderException extends RuntimeException {
    private final Reason reason;

    public KeyProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public KeyProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public int httpStatus() {
        return reason.httpStatus();
    }

    public static KeyProviderException validation(String message) {
        return new KeyProviderException(Reason.VALIDATION, message);
    }

    public static KeyProviderException unauthorized(String remoteSystemId) {
        return new KeyProviderException(Reason.UNAUTHORIZED, "Invalid remoteSystemID: " + remoteSystemId);
    }

    public static KeyProviderException notFound(String message) {
        return new KeyProviderException(Reason.NOT_FOUND, message);
    }

    public enum Reason {
        VALIDATION(400),
        UNAUTHORIZED(400),
        NOT_FOUND(400),
        ALREADY_CONSUMED(400),
        INVALID_SIGNATURE(400),
        REPLAY_REJECTED(400),
        RNG_UNAVAILABLE(503),
        STORAGE_UNAVAILABLE(503);

        private final int httpStatus;

        Reason(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }
}
