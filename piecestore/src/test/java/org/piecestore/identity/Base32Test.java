package org.piecestore.identity;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Base32.
 */
class Base32Test {
    
    @Test
    void testEncode_Rfc4648Vectors() {
        assertEquals("", Base32.encode(new byte[0]));
        assertEquals("MY", Base32.encode("f".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("MZXQ", Base32.encode("fo".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("MZXW6", Base32.encode("foo".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("MZXW6YQ", Base32.encode("foob".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("MZXW6YTB", Base32.encode("fooba".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("MZXW6YTBOI", Base32.encode("foobar".getBytes(StandardCharsets.US_ASCII)));
    }
    
    @Test
    void testDecode_Rfc4648Vectors() {
        assertArrayEquals("foobar".getBytes(StandardCharsets.US_ASCII), Base32.decode("MZXW6YTBOI"));
        assertArrayEquals("f".getBytes(StandardCharsets.US_ASCII), Base32.decode("MY"));
    }
    
    @Test
    void testDecode_InvalidCharacter() {
        assertThrows(IllegalArgumentException.class, () -> Base32.decode("MZXW6YTB0I"));
        assertThrows(IllegalArgumentException.class, () -> Base32.decode("mzxw6ytboi"));
    }
    
    @Test
    void testDecode_ImpossibleLength() {
        assertThrows(IllegalArgumentException.class, () -> Base32.decode("M"));
        assertThrows(IllegalArgumentException.class, () -> Base32.decode("MZX"));
        assertThrows(IllegalArgumentException.class, () -> Base32.decode("MZXW6Y"));
    }
}
