package com.uuid7;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class SecureRandomAllocatorTest {

    @BeforeEach
    void setUp() {
        // the environment variable outranks the property and cannot be changed from here
        assumeTrue(System.getenv(DefaultValue.RANDOM_ALGORITHM_ENV_KEY) == null);
        System.clearProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY);
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY);
    }

    @Test
    void testDefaultWhenNothingConfigured() {
        assertNull(SecureRandomAllocator.getConfiguredAlgorithm());

        SecureRandomSource source = SecureRandomAllocator.getRandomSource();
        assertNotNull(source.getAlgorithm());
        assertEquals(7, source.randomBytes(7).length);
    }

    @Test
    void testSystemPropertySelectsAlgorithm() {
        System.setProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY, " SHA1PRNG ");

        assertEquals("SHA1PRNG", SecureRandomAllocator.getConfiguredAlgorithm());
        assertEquals("SHA1PRNG", SecureRandomAllocator.getRandomSource().getAlgorithm());
    }

    @Test
    void testBlankPropertyIgnored() {
        System.setProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY, "   ");
        assertNull(SecureRandomAllocator.getConfiguredAlgorithm());
    }

    @Test
    void testUnknownAlgorithmFallsBackToDefault() {
        System.setProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY, "NoSuchPRNG");

        SecureRandomSource source = SecureRandomAllocator.getRandomSource();
        assertNotEquals("NoSuchPRNG", source.getAlgorithm());
        assertEquals(16, source.randomBytes(16).length);
    }

    @Test
    void testGeneratorUsesConfiguredSource() {
        System.setProperty(DefaultValue.RANDOM_ALGORITHM_PROP_KEY, "SHA1PRNG");

        Uuid7Generator generator = new Uuid7Generator();
        assertTrue(generator.getRandomSource() instanceof SecureRandomSource);
        assertEquals("SHA1PRNG", ((SecureRandomSource) generator.getRandomSource()).getAlgorithm());
        assertEquals(7, generator.next().version());
    }
}
