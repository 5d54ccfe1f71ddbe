package com.uuid7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Chooses the SecureRandom that feeds identifier randomness.
 * Priority: env var → system property → platform default
 */
public final class SecureRandomAllocator {
    private static final Logger logger = LoggerFactory.getLogger(SecureRandomAllocator.class);

    private SecureRandomAllocator() {
    }

    /**
     * Get the configured random source (recommended method)
     *
     * @return a source backed by the configured algorithm, or by {@code new SecureRandom()}
     */
    public static SecureRandomSource getRandomSource() {
        // 1. Environment variable or JVM parameter (highest priority)
        String configured = getConfiguredAlgorithm();
        if (configured != null) {
            try {
                SecureRandom random = SecureRandom.getInstance(configured);
                logger.info("Using configured SecureRandom algorithm: {} (source: {})", configured,
                        configuredFromEnv() ? "environment variable" : "JVM parameter");
                return new SecureRandomSource(random);
            } catch (NoSuchAlgorithmException e) {
                logger.warn("Configured SecureRandom algorithm '{}' is unavailable: {}", configured, e.toString());
            }
        }

        // 2. Platform default
        SecureRandom random = new SecureRandom();
        logger.info("Using default SecureRandom algorithm: {}", random.getAlgorithm());
        return new SecureRandomSource(random);
    }

    static String getConfiguredAlgorithm() {
        String value = System.getenv(DefaultValue.RANDOM_ALGORITHM_ENV_KEY);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY);
        }
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static boolean configuredFromEnv() {
        String value = System.getenv(DefaultValue.RANDOM_ALGORITHM_ENV_KEY);
        return value != null && !value.trim().isEmpty();
    }
}
