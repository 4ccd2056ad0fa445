package io.skipkp.entropy;

/**
 * Source of cryptographically secure random bytes.
 *
 * <p>Implementations throw a {@link io.skipkp.model.KeyProviderException} with reason
 * {@code RNG_UNAVAILABLE} when the underlying generator cannot be read.
 */
public interface EntropyProvider {

    /**
     * Returns {@code ceil(minEntropyBits / 8)} random bytes, hex-encoded in upper case.
     */
    String generate(int minEntropyBits);

    /**
     * Returns {@code length} fresh random bytes. The caller owns and wipes the array.
     */
    byte[] randomBytes(int length);
}
