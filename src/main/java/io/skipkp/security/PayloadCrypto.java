package io.skipkp.security;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM sealing of KEY_SYNC payloads between two peers.
 *
 * <p>The cipher key is HKDF-SHA256 derived from the pair's shared secret, so the HMAC key and the
 * encryption key never coincide. Wire layout: base64(iv || ciphertext || tag).
 */
public final class PayloadCrypto {
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;
    private static final byte[] HKDF_SALT = "skip-kp.sync.v1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HKDF_INFO = "skip-kp.payload.aes-gcm".getBytes(StandardCharsets.UTF_8);

    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    public PayloadCrypto(String sharedSecret) {
        this(sharedSecret, new SecureRandom());
    }

    PayloadCrypto(String sharedSecret, SecureRandom secureRandom) {
        if (sharedSecret == null || sharedSecret.isBlank()) {
            throw new IllegalArgumentException("sharedSecret must not be blank");
        }
        byte[] raw = deriveKey(sharedSecret.getBytes(StandardCharsets.UTF_8));
        try {
            this.key = new SecretKeySpec(raw, "AES");
        } finally {
            KeyMaterial.wipe(raw);
        }
        this.secureRandom = secureRandom;
    }

    public String encrypt(byte[] plaintext, String associatedData) {
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(aad(associatedData));
            byte[] cipherText = cipher.doFinal(plaintext);
            byte[] out = new byte[iv.length + cipherText.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(cipherText, 0, out, iv.length, cipherText.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt sync payload", e);
        }
    }

    /**
     * Opens a sealed payload. The returned array is owned by the caller and must be wiped.
     *
     * @throws IllegalArgumentException when the payload is malformed or fails authentication
     */
    public byte[] decrypt(String sealed, String associatedData) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(sealed == null ? "" : sealed.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Sync payload is not valid base64", e);
        }
        if (raw.length <= GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new IllegalArgumentException("Sync payload too short");
        }
        byte[] iv = Arrays.copyOfRange(raw, 0, GCM_IV_BYTES);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(aad(associatedData));
            return cipher.doFinal(raw, GCM_IV_BYTES, raw.length - GCM_IV_BYTES);
        } catch (AEADBadTagException e) {
            throw new IllegalArgumentException("Sync payload failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt sync payload", e);
        } finally {
            KeyMaterial.wipe(raw);
        }
    }

    private static byte[] aad(String associatedData) {
        return (associatedData == null ? "" : associatedData).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] deriveKey(byte[] inputKeyMaterial) {
        try {
            HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
            hkdf.init(new HKDFParameters(inputKeyMaterial, HKDF_SALT, HKDF_INFO));
            byte[] output = new byte[KEY_BYTES];
            hkdf.generateBytes(output, 0, KEY_BYTES);
            return output;
        } finally {
            KeyMaterial.wipe(inputKeyMaterial);
        }
    }
}
