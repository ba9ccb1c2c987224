package org.piecestore.protocol;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.IntegrityException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceIdException;
import org.piecestore.exception.PieceNotFoundException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.ProtocolException;
import org.piecestore.exception.SequencingException;
import org.piecestore.exception.StorageException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProtocolUtil.
 */
class ProtocolUtilTest {
    
    @Test
    void testMapStatus_Success() {
        assertNull(ProtocolUtil.mapStatusToException(ProtocolConstants.STATUS_SUCCESS, null));
    }
    
    @Test
    void testMapException_RoundTripsClass() {
        PieceStoreException[] errors = {
                new PieceNotFoundException("x"),
                new StorageException("disk full"),
                new AuthorizationException("order expired"),
                new InvalidArgumentException("missing limit"),
                new SequencingException("chunk out of order"),
                new IntegrityException("hashes don't match"),
                new PieceIdException("bad length"),
        };
        
        for (PieceStoreException error : errors) {
            byte status = ProtocolUtil.mapExceptionToStatus(error);
            assertNotEquals(ProtocolConstants.STATUS_SUCCESS, status);
            
            PieceStoreException mapped = ProtocolUtil.mapStatusToException(status, error.getMessage());
            assertEquals(error.getClass(), mapped.getClass());
        }
    }
    
    @Test
    void testMapStatus_UnknownCodeKeepsCode() {
        PieceStoreException e = ProtocolUtil.mapStatusToException((byte) 99, "odd");
        
        assertTrue(e instanceof ProtocolException);
        assertEquals(99, ((ProtocolException) e).getCode());
        assertEquals((byte) 99, ProtocolUtil.mapExceptionToStatus(e));
    }
    
    @Test
    void testEncodeDecodeError() {
        assertEquals("hashes don't match", ProtocolUtil.decodeError(ProtocolUtil.encodeError("hashes don't match")));
        assertNull(ProtocolUtil.decodeError(ProtocolUtil.encodeError(null)));
    }
    
    @Test
    void testEncodeDecodeLong() {
        long value = 0x0102030405060708L;
        byte[] encoded = ProtocolUtil.encodeLong(value);
        
        assertEquals(8, encoded.length);
        assertEquals(value, ProtocolUtil.decodeLong(encoded, 0));
    }
}
