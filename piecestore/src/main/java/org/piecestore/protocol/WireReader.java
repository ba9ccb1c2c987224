package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;

import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Reads message fields written by {@link WireWriter}.
 * 
 * Typical use:
 * <pre>
 * WireReader reader = new WireReader(data);
 * while (reader.next()) {
 *     switch (reader.tag()) {
 *         case 1: value = reader.bytes(); break;
 *         default: break; // unknown fields are skipped
 *     }
 * }
 * </pre>
 */
public class WireReader {
    
    private final ByteBuffer buffer;
    private int tag;
    private byte[] value;
    
    public WireReader(byte[] data) {
        this.buffer = ByteBuffer.wrap(data == null ? new byte[0] : data);
    }
    
    /**
     * Advances to the next field.
     * 
     * @return false when no fields remain
     */
    public boolean next() throws InvalidArgumentException {
        if (!buffer.hasRemaining()) {
            return false;
        }
        if (buffer.remaining() < ProtocolConstants.FIELD_HEADER_LEN) {
            throw new InvalidArgumentException("truncated field header");
        }
        tag = buffer.get() & 0xFF;
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new InvalidArgumentException("field " + tag + " length " + length + " exceeds message");
        }
        value = new byte[length];
        buffer.get(value);
        return true;
    }
    
    public int tag() {
        return tag;
    }
    
    public byte[] bytes() {
        return value;
    }
    
    public long longValue() throws InvalidArgumentException {
        if (value.length != 8) {
            throw new InvalidArgumentException("field " + tag + " is not a long");
        }
        return ProtocolUtil.decodeLong(value, 0);
    }
    
    public int intValue() throws InvalidArgumentException {
        if (value.length != 4) {
            throw new InvalidArgumentException("field " + tag + " is not an int");
        }
        return ByteBuffer.wrap(value).getInt();
    }
    
    public Instant instant() throws InvalidArgumentException {
        if (value.length != ProtocolConstants.INSTANT_LEN) {
            throw new InvalidArgumentException("field " + tag + " is not a timestamp");
        }
        ByteBuffer b = ByteBuffer.wrap(value);
        try {
            return Instant.ofEpochSecond(b.getLong(), b.getInt());
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidArgumentException("field " + tag + " timestamp out of range");
        }
    }
}
