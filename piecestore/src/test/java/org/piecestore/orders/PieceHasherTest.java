package org.piecestore.orders;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PieceHasher and PieceHashAlgorithm.
 */
class PieceHasherTest {
    
    @Test
    void testSha256_EmptyInput() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Hex.toHexString(PieceHasher.hash(PieceHashAlgorithm.SHA256, new byte[0])));
    }
    
    @Test
    void testSha256_Abc() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Hex.toHexString(PieceHasher.hash(PieceHashAlgorithm.SHA256, "abc".getBytes(StandardCharsets.US_ASCII))));
    }
    
    @Test
    void testBlake3_EmptyInput() {
        assertEquals("af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262",
                Hex.toHexString(PieceHasher.hash(PieceHashAlgorithm.BLAKE3, new byte[0])));
    }
    
    @Test
    void testIncrementalMatchesOneShot() {
        byte[] data = new byte[1000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        
        for (PieceHashAlgorithm algorithm : PieceHashAlgorithm.values()) {
            PieceHasher hasher = algorithm.newHasher();
            hasher.update(data, 0, 400);
            hasher.update(data, 400, 600);
            assertEquals(1000, hasher.size());
            assertArrayEquals(PieceHasher.hash(algorithm, data), hasher.digest());
            assertEquals(0, hasher.size());
        }
    }
    
    @Test
    void testFromCode() {
        assertEquals(PieceHashAlgorithm.SHA256, PieceHashAlgorithm.fromCode(0));
        assertEquals(PieceHashAlgorithm.BLAKE3, PieceHashAlgorithm.fromCode(1));
        assertThrows(IllegalArgumentException.class, () -> PieceHashAlgorithm.fromCode(9));
    }
    
    @Test
    void testPieceAction_Kinds() {
        assertTrue(PieceAction.PUT.isUpload());
        assertTrue(PieceAction.PUT_REPAIR.isUpload());
        assertTrue(PieceAction.GET_AUDIT.isDownload());
        assertFalse(PieceAction.DELETE.isUpload());
        assertFalse(PieceAction.DELETE.isDownload());
        assertEquals(PieceAction.INVALID, PieceAction.fromCode(99));
    }
}
