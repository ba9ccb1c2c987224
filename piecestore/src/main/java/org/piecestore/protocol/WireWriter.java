package org.piecestore.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.time.Instant;

/**
 * Writes message fields in the piece store wire format.
 * 
 * Every field is encoded as:
 * - 1 byte: field tag
 * - 4 bytes: value length (big-endian int)
 * - value bytes
 * 
 * Absent (null) fields are omitted. Repeated fields are written as
 * several fields with the same tag.
 */
public class WireWriter {
    
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    
    public WireWriter writeBytes(int tag, byte[] value) {
        if (value == null) {
            return this;
        }
        writeField(tag, value);
        return this;
    }
    
    public WireWriter writeLong(int tag, long value) {
        writeField(tag, ProtocolUtil.encodeLong(value));
        return this;
    }
    
    public WireWriter writeInt(int tag, int value) {
        writeField(tag, ByteBuffer.allocate(4).putInt(value).array());
        return this;
    }
    
    /**
     * Writes a UTC instant as 8 bytes of epoch seconds followed by 4 bytes of nanoseconds.
     */
    public WireWriter writeInstant(int tag, Instant value) {
        if (value == null) {
            return this;
        }
        ByteBuffer buffer = ByteBuffer.allocate(ProtocolConstants.INSTANT_LEN);
        buffer.putLong(value.getEpochSecond());
        buffer.putInt(value.getNano());
        writeField(tag, buffer.array());
        return this;
    }
    
    private void writeField(int tag, byte[] value) {
        ByteBuffer header = ByteBuffer.allocate(ProtocolConstants.FIELD_HEADER_LEN);
        header.put((byte) tag);
        header.putInt(value.length);
        out.write(header.array(), 0, header.capacity());
        out.write(value, 0, value.length);
    }
    
    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
