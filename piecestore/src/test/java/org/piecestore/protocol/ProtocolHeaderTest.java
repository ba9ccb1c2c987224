package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProtocolHeader.
 */
class ProtocolHeaderTest {
    
    @Test
    void testEncodeDecodeHeader() throws Exception {
        ProtocolHeader header = new ProtocolHeader(1024, ProtocolConstants.CMD_UPLOAD_REQUEST,
                ProtocolConstants.STATUS_SUCCESS);
        
        byte[] encoded = header.encode();
        assertEquals(ProtocolConstants.PROTO_HEADER_LEN, encoded.length);
        
        ProtocolHeader decoded = ProtocolHeader.decode(encoded);
        assertEquals(1024, decoded.getLength());
        assertEquals(ProtocolConstants.CMD_UPLOAD_REQUEST, decoded.getCmd());
        assertFalse(decoded.isError());
    }
    
    @Test
    void testEncode_BigEndianLayout() {
        byte[] encoded = new ProtocolHeader(0x0102, (byte) 13, (byte) 74).encode();
        
        assertEquals(0x01, encoded[6]);
        assertEquals(0x02, encoded[7]);
        assertEquals(13, encoded[8]);
        assertEquals(74, encoded[9]);
    }
    
    @Test
    void testDecodeHeader_ErrorStatus() throws Exception {
        byte[] encoded = new ProtocolHeader(5, ProtocolConstants.CMD_DOWNLOAD_RESPONSE,
                ProtocolConstants.STATUS_NOT_FOUND).encode();
        assertTrue(ProtocolHeader.decode(encoded).isError());
    }
    
    @Test
    void testDecodeHeader_InvalidData() {
        assertThrows(InvalidArgumentException.class, () -> {
            ProtocolHeader.decode(new byte[5]); // Too short
        });
        
        assertThrows(InvalidArgumentException.class, () -> {
            ProtocolHeader.decode(null);
        });
    }
    
    @Test
    void testDecodeHeader_BodyLengthOutOfRange() {
        byte[] tooLong = ByteBuffer.allocate(ProtocolConstants.PROTO_HEADER_LEN)
                .putLong(ProtocolConstants.MAX_FRAME_BODY_LEN + 1L).put((byte) 11).put((byte) 0).array();
        assertThrows(InvalidArgumentException.class, () -> ProtocolHeader.decode(tooLong));
        
        byte[] negative = ByteBuffer.allocate(ProtocolConstants.PROTO_HEADER_LEN)
                .putLong(-1).put((byte) 11).put((byte) 0).array();
        assertThrows(InvalidArgumentException.class, () -> ProtocolHeader.decode(negative));
    }
    
    @Test
    void testHeaderToString() {
        String str = new ProtocolHeader(1024, (byte) 11, (byte) 0).toString();
        assertTrue(str.contains("1024"));
        assertTrue(str.contains("cmd=11"));
    }
}
