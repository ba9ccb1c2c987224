package org.piecestore.identity;

import org.piecestore.exception.PieceIdException;
import org.piecestore.orders.NodeIdentity;
import org.junit.jupiter.api.Test;

import java.security.MessageDigest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NodeID.
 */
class NodeIDTest {
    
    @Test
    void testFromPublicKey_IsSha256OfEncodedKey() throws Exception {
        NodeIdentity identity = NodeIdentity.generate();
        byte[] expected = MessageDigest.getInstance("SHA-256").digest(identity.getPublicKey().getEncoded());
        
        assertArrayEquals(expected, identity.getId().getBytes());
    }
    
    @Test
    void testFromString_RoundTrip() throws PieceIdException {
        NodeID id = NodeIdentity.generate().getId();
        assertEquals(id, NodeID.fromString(id.toString()));
    }
    
    @Test
    void testFromBytes_WrongLength() {
        assertThrows(PieceIdException.class, () -> NodeID.fromBytes(new byte[16]));
        assertThrows(PieceIdException.class, () -> NodeID.fromString("@@@"));
    }
}
