package com.uuid7;

import java.security.SecureRandom;

/**
 * {@link RandomSource} backed by a {@link SecureRandom}, which is safe for
 * concurrent use.
 */
public final class SecureRandomSource implements RandomSource {

    private final SecureRandom random;

    public SecureRandomSource(SecureRandom random) {
        if (random == null) throw new IllegalArgumentException("random must not be null");
        this.random = random;
    }

    @Override
    public byte[] randomBytes(int count) {
        byte[] bytes = new byte[count];
        random.nextBytes(bytes);
        return bytes;
    }

    /** The JCA algorithm name of the underlying generator. */
    public String getAlgorithm() {
        return random.getAlgorithm();
    }

    @Override
    public String toString() {
        return "SecureRandomSource[" + random.getAlgorithm() + "]";
    }
}
