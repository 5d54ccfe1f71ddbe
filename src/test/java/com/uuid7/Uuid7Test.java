package com.uuid7;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class Uuid7Test {

    @Test
    void testParseDetectsForm() {
        Uuid7 expected = Uuid7Codec.parseHex("017f22e279b07cc398c4dc0c0c07398f");

        assertEquals(expected, Uuid7.parse("017f22e2-79b0-7cc3-98c4-dc0c0c07398f"));
        assertEquals(expected, Uuid7.parse("017f22e279b07cc398c4dc0c0c07398f"));
        assertEquals(expected, Uuid7.parse("063ecvmgn09sck3fx6nqjpbxt"));
        assertThrows(MalformedIdentifierException.class, () -> Uuid7.parse("017f22e2"));
        assertThrows(MalformedIdentifierException.class, () -> Uuid7.parse(null));
    }

    @Test
    void testOrderIsUnsigned() {
        Uuid7 low = new Uuid7(0x7FFFFFFFFFFFFFFFL, 0L);
        Uuid7 high = new Uuid7(0x8000000000000000L, 0L);

        assertTrue(low.compareTo(high) < 0);
        assertTrue(high.compareTo(Uuid7.MAX) < 0);
        assertTrue(Uuid7.NIL.compareTo(low) < 0);
        assertTrue(new Uuid7(0, 1).compareTo(new Uuid7(0, -1)) < 0);
        // java.util.UUID compares signed halves
        assertTrue(low.toUuid().compareTo(high.toUuid()) > 0);
    }

    @Test
    void testSortedOrderMatchesStringAndByteOrder() {
        List<Uuid7> ids = new ArrayList<>();
        java.util.Random random = new java.util.Random(5);
        for (int i = 0; i < 200; i++) {
            ids.add(new Uuid7(random.nextLong(), random.nextLong()));
        }
        Collections.sort(ids);
        for (int i = 1; i < ids.size(); i++) {
            Uuid7 a = ids.get(i - 1);
            Uuid7 b = ids.get(i);
            assertTrue(a.toString().compareTo(b.toString()) < 0);
            assertTrue(a.toHex().compareTo(b.toHex()) < 0);
            assertTrue(a.toId25().compareTo(b.toId25()) < 0);
            assertTrue(a.toBigInteger().compareTo(b.toBigInteger()) < 0);
        }
    }

    @Test
    void testUuidInterop() {
        UUID uuid = UUID.fromString("017f22e2-79b0-7cc3-98c4-dc0c0c07398f");
        Uuid7 id = Uuid7.fromUuid(uuid);

        assertEquals(7, id.version());
        assertEquals(2, id.variant());
        assertEquals(uuid.version(), id.version());
        assertEquals(uuid, id.toUuid());
        assertEquals(uuid.toString(), id.toString());
    }

    @Test
    void testSentinels() {
        assertTrue(Uuid7.NIL.isNil());
        assertFalse(Uuid7.NIL.isMax());
        assertTrue(Uuid7.MAX.isMax());
        assertEquals(Uuid7.NIL, Uuid7.fromBytes(new byte[16]));
        assertEquals(Uuid7.MAX, Uuid7.parse("usz5xbbiqsfq7s727n0pzr2xa"));
    }

    @Test
    void testEqualsAndHashCode() {
        Uuid7 a = new Uuid7(1L, 2L);
        Uuid7 b = new Uuid7(1L, 2L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Uuid7(2L, 1L));
        assertEquals(a.toUuid().hashCode(), a.hashCode());
    }
}
