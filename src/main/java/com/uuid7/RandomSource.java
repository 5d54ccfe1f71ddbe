package com.uuid7;

/**
 * Supplier of cryptographically secure random bytes.
 *
 * <p>A failing source should throw; the generator does not retry and the
 * exception reaches the caller unchanged.</p>
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns {@code count} fresh random bytes.
     */
    byte[] randomBytes(int count);
}
