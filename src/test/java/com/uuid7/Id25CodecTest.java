package com.uuid7;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class Id25CodecTest {

    private static final Uuid7 VECTOR = Uuid7Codec.parseHex("017f22e279b07cc398c4dc0c0c07398f");

    @Test
    void testKnownEncodings() {
        assertEquals("0000000000000000000000000", Id25Codec.encode(Uuid7.NIL));
        assertEquals("usz5xbbiqsfq7s727n0pzr2xa", Id25Codec.encode(Uuid7.MAX));
        assertEquals("USZ5XBBIQSFQ7S727M0PZR2XA", Id25Codec.encode(Uuid7.MAX, Id25Codec.Alphabet.UPPER));
        assertEquals("063ecvmgn09sck3fx6nqjpbxt", Id25Codec.encode(VECTOR));
        assertEquals("063ECVLGM09SCK3FX6MQJPBXT", Id25Codec.encode(VECTOR, Id25Codec.Alphabet.UPPER));
        assertEquals("0000000000000000000000001", Id25Codec.encode(new Uuid7(0, 1)));
        assertEquals("0000000000000000000000010", Id25Codec.encode(new Uuid7(0, 35)));
    }

    @Test
    void testKnownDecodings() {
        assertEquals(Uuid7.NIL, Id25Codec.decode("0000000000000000000000000"));
        assertEquals(Uuid7.MAX, Id25Codec.decode("usz5xbbiqsfq7s727n0pzr2xa"));
        assertEquals(Uuid7.MAX, Id25Codec.decode("USZ5XBBIQSFQ7S727M0PZR2XA"));
        assertEquals(VECTOR, Id25Codec.decode("063ecvmgn09sck3fx6nqjpbxt"));
        assertEquals(VECTOR, Id25Codec.decode("063ECVLGM09SCK3FX6MQJPBXT"));
    }

    @Test
    void testAlphabetsOmitAmbiguousLetters() {
        Random random = new Random(11);
        for (int i = 0; i < 2000; i++) {
            Uuid7 id = new Uuid7(random.nextLong(), random.nextLong());
            String lower = Id25Codec.encode(id, Id25Codec.Alphabet.LOWER);
            String upper = Id25Codec.encode(id, Id25Codec.Alphabet.UPPER);
            assertEquals(25, lower.length());
            assertEquals(25, upper.length());
            assertFalse(lower.contains("l"), lower);
            assertFalse(upper.contains("O"), upper);
            assertEquals(lower, lower.toLowerCase());
            assertEquals(upper, upper.toUpperCase());
        }
    }

    @Test
    void testRoundTripBothCases() {
        Random random = new Random(42);
        for (int i = 0; i < 2000; i++) {
            Uuid7 id = new Uuid7(random.nextLong(), random.nextLong());
            assertEquals(id, Id25Codec.decode(Id25Codec.encode(id, Id25Codec.Alphabet.LOWER)));
            assertEquals(id, Id25Codec.decode(Id25Codec.encode(id, Id25Codec.Alphabet.UPPER)));
        }
    }

    @Test
    void testMatchesBigIntegerBase35() {
        String digits = "0123456789abcdefghijklmnopqrstuvwxy";
        String lower = "0123456789abcdefghijkmnopqrstuvwxyz";
        Random random = new Random(3);
        for (int i = 0; i < 500; i++) {
            Uuid7 id = new Uuid7(random.nextLong(), random.nextLong());
            StringBuilder expected = new StringBuilder();
            for (char c : id.toBigInteger().toString(35).toCharArray()) {
                expected.append(lower.charAt(digits.indexOf(c)));
            }
            while (expected.length() < 25) expected.insert(0, '0');
            assertEquals(expected.toString(), Id25Codec.encode(id));
        }
    }

    @Test
    void testEncodingPreservesNumericOrder() {
        Random random = new Random(99);
        for (int i = 0; i < 5000; i++) {
            Uuid7 x = new Uuid7(random.nextLong(), random.nextLong());
            // neighbours in the low bits and far values in the high bits
            Uuid7 y = i % 2 == 0
                    ? new Uuid7(x.getMostSignificantBits(), x.getLeastSignificantBits() + 1 + random.nextInt(1000))
                    : new Uuid7(random.nextLong(), random.nextLong());
            int numeric = Integer.signum(x.compareTo(y));
            int lower = Integer.signum(Id25Codec.encode(x).compareTo(Id25Codec.encode(y)));
            int upper = Integer.signum(Id25Codec.encode(x, Id25Codec.Alphabet.UPPER)
                    .compareTo(Id25Codec.encode(y, Id25Codec.Alphabet.UPPER)));
            assertEquals(numeric, lower, x + " vs " + y);
            assertEquals(numeric, upper, x + " vs " + y);
        }
    }

    @Test
    void testMalformedRejected() {
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode(null));
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ecvmgn09sck3fx6nqjpbx"));
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ecvmgn09sck3fx6nqjpbxtt"));
        // 'l' is not in the lowercase alphabet
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ecvlgn09sck3fx6nqjpbxt"));
        // 'O' is not in the uppercase alphabet
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ECVLGM09SCK3FX6MQJPBXO"));
        // mixed case
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ECVLGM09SCK3FX6MQJPBXt"));
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("063ecvmgn09sck3fx6nqjpb-t"));
        assertThrows(MalformedIdentifierException.class,
                () -> Id25Codec.decode("063ecvmgn09sck3fx6nqjpbxt", Id25Codec.Alphabet.UPPER));
    }

    @Test
    void testValuesAbove128BitsRejected() {
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("usz5xbbiqsfq7s727n0pzr2xb"));
        assertThrows(MalformedIdentifierException.class, () -> Id25Codec.decode("zzzzzzzzzzzzzzzzzzzzzzzzz"));
        assertTrue(BigInteger.valueOf(35).pow(25).bitLength() > 128);
    }
}
