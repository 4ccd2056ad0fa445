package io.skipkp.entropy;

import io.skipkp.model.KeyProviderException;
import io.skipkp.security.KeyMaterial;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class SecureRandomEntropyProvider implements EntropyProvider {
    private final SecureRandom secureRandom;

    public SecureRandomEntropyProvider() {
        this(new SecureRandom());
    }

    public SecureRandomEntropyProvider(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public String generate(int minEntropyBits) {
        if (minEntropyBits <= 0) {
            throw KeyProviderException.validation("minentropy must be positive");
        }
        byte[] raw = randomBytes((minEntropyBits + 7) / 8);
        try {
            return HexFormat.of().withUpperCase().formatHex(raw);
        } finally {
            KeyMaterial.wipe(raw);
        }
    }

    @Override
    public byte[] randomBytes(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
        byte[] out = new byte[length];
        try {
            secureRandom.nextBytes(out);
        } catch (RuntimeException e) {
            throw new KeyProviderException(
                    KeyProviderException.Reason.RNG_UNAVAILABLE,
                    "Hardware random number generator not available",
                    e
            );
        }
        return out;
    }
}
