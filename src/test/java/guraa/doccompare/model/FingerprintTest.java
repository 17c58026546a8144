package guraa.doccompare.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintTest {

    @Test
    void hexFormIsStable() {
        Fingerprint fingerprint = Fingerprint.fromHex("f0a5000000000001");

        assertEquals(64, fingerprint.getBitWidth());
        assertEquals("f0a5000000000001", fingerprint.toHex());
        assertEquals(Fingerprint.fromLong(0xf0a5000000000001L), fingerprint);
        assertTrue(fingerprint.getBit(0));
        assertFalse(fingerprint.getBit(4));
        assertTrue(fingerprint.getBit(63));
    }

    @Test
    void hammingDistanceCountsDifferingBits() {
        Fingerprint a = Fingerprint.fromLong(0L);
        Fingerprint b = Fingerprint.fromLong(0b1011L);

        assertEquals(0, a.hammingDistance(a));
        assertEquals(3, a.hammingDistance(b));
        assertEquals(3, b.hammingDistance(a));
        assertEquals(64, a.hammingDistance(Fingerprint.fromLong(-1L)));
    }

    @Test
    void widthsMustMatch() {
        Fingerprint narrow = Fingerprint.fromHex("ff");
        Fingerprint wide = Fingerprint.fromLong(0xffL);

        assertEquals(8, narrow.getBitWidth());
        assertThrows(IllegalArgumentException.class, () -> narrow.hammingDistance(wide));
    }

    @Test
    void widerThanOneWord() {
        boolean[] bits = new boolean[100];
        bits[0] = true;
        bits[99] = true;
        Fingerprint fingerprint = Fingerprint.fromBits(bits);

        assertEquals(100, fingerprint.getBitWidth());
        assertTrue(fingerprint.getBit(99));
        assertEquals(2, fingerprint.hammingDistance(Fingerprint.fromBits(new boolean[100])));
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.fromHex("xyz"));
    }
}
