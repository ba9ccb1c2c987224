package org.piecestore.storage;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.identity.PieceID;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BloomFilter.
 */
class BloomFilterTest {
    
    @Test
    void testNoFalseNegatives() {
        BloomFilter filter = BloomFilter.newOptimal(1000, 0.01);
        List<PieceID> members = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            PieceID id = PieceID.newPieceID();
            members.add(id);
            filter.add(id);
        }
        
        for (PieceID id : members) {
            assertTrue(filter.contains(id));
        }
    }
    
    @Test
    void testFalsePositiveRateIsBounded() {
        BloomFilter filter = BloomFilter.newOptimal(1000, 0.01);
        for (int i = 0; i < 1000; i++) {
            filter.add(PieceID.newPieceID());
        }
        
        int falsePositives = 0;
        for (int i = 0; i < 10000; i++) {
            if (filter.contains(PieceID.newPieceID())) {
                falsePositives++;
            }
        }
        // expected around 100
        assertTrue(falsePositives < 500, "false positives: " + falsePositives);
    }
    
    @Test
    void testSerialization_KeepsMembership() throws InvalidArgumentException {
        BloomFilter filter = BloomFilter.newOptimal(50, 0.05);
        PieceID member = PieceID.newPieceID();
        filter.add(member);
        
        byte[] encoded = filter.toBytes();
        assertEquals(BloomFilter.VERSION, encoded[0]);
        assertEquals(filter.getHashCount(), encoded[2]);
        assertEquals(3 + filter.getSizeInBytes(), encoded.length);
        
        BloomFilter decoded = BloomFilter.fromBytes(encoded);
        assertTrue(decoded.contains(member));
        assertArrayEquals(encoded, decoded.toBytes());
    }
    
    @Test
    void testEmptyFilter_ContainsNothing() {
        BloomFilter filter = new BloomFilter(0, 7, 64);
        assertFalse(filter.contains(PieceID.newPieceID()));
    }
    
    @Test
    void testFromBytes_Invalid() {
        assertThrows(InvalidArgumentException.class, () -> BloomFilter.fromBytes(null));
        assertThrows(InvalidArgumentException.class, () -> BloomFilter.fromBytes(new byte[]{1, 0, 3}));
        assertThrows(InvalidArgumentException.class, () -> BloomFilter.fromBytes(new byte[]{2, 0, 3, 0}));
        assertThrows(InvalidArgumentException.class, () -> BloomFilter.fromBytes(new byte[]{1, 32, 3, 0}));
        assertThrows(InvalidArgumentException.class, () -> BloomFilter.fromBytes(new byte[]{1, 0, 0, 0}));
    }
    
    @Test
    void testNewOptimal_InvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> BloomFilter.newOptimal(0, 0.1));
        assertThrows(IllegalArgumentException.class, () -> BloomFilter.newOptimal(10, 1.5));
    }
}
