package io.skipkp.security;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Owned buffer for secret bytes.
 *
 * <p>The holder reads the bytes out (typically into a response) and closes the buffer on every
 * exit path; closing overwrites the content with zeros. Reads after close fail.
 */
public final class KeyMaterial implements AutoCloseable {
    private final byte[] bytes;
    private volatile boolean wiped;

    private KeyMaterial(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Takes ownership of {@code bytes}; the caller must not keep another reference.
     */
    public static KeyMaterial wrap(byte[] bytes) {
        return new KeyMaterial(bytes == null ? new byte[0] : bytes);
    }

    public static KeyMaterial fromHex(String hex) {
        return new KeyMaterial(HexFormat.of().parseHex(hex));
    }

    public int length() {
        return bytes.length;
    }

    public int sizeBits() {
        return bytes.length * 8;
    }

    public String toHex() {
        ensureLive();
        return HexFormat.of().formatHex(bytes);
    }

    public byte[] copy() {
        ensureLive();
        return Arrays.copyOf(bytes, bytes.length);
    }

    public boolean isWiped() {
        return wiped;
    }

    @Override
    public void close() {
        Arrays.fill(bytes, (byte) 0);
        wiped = true;
    }

    /**
     * Zeroes an unowned array in place; tolerates null.
     */
    public static void wipe(byte[] buffer) {
        if (buffer != null) {
            Arrays.fill(buffer, (byte) 0);
        }
    }

    private void ensureLive() {
        if (wiped) {
            throw new IllegalStateException("Key material already zeroized");
        }
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + bytes.length + " bytes" + (wiped ? ", wiped" : "") + "]";
    }
}
