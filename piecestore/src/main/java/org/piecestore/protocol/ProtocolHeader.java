package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;

import java.nio.ByteBuffer;

/**
 * Header preceding every frame on a piece store connection.
 * 
 * Layout, {@value ProtocolConstants#PROTO_HEADER_LEN} bytes:
 * - 8 bytes: body length (big-endian long)
 * - 1 byte: command code
 * - 1 byte: status code, non-zero only on error frames
 */
public final class ProtocolHeader {
    
    private final long length;
    private final byte cmd;
    private final byte status;
    
    public ProtocolHeader(long length, byte cmd, byte status) {
        this.length = length;
        this.cmd = cmd;
        this.status = status;
    }
    
    public byte[] encode() {
        return ByteBuffer.allocate(ProtocolConstants.PROTO_HEADER_LEN)
                .putLong(length)
                .put(cmd)
                .put(status)
                .array();
    }
    
    /**
     * Decodes a header, rejecting body lengths a peer may not announce.
     */
    public static ProtocolHeader decode(byte[] data) throws InvalidArgumentException {
        if (data == null || data.length != ProtocolConstants.PROTO_HEADER_LEN) {
            throw new InvalidArgumentException("frame header must be " + ProtocolConstants.PROTO_HEADER_LEN
                    + " bytes, got " + (data == null ? 0 : data.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        ProtocolHeader header = new ProtocolHeader(buffer.getLong(), buffer.get(), buffer.get());
        if (header.length < 0 || header.length > ProtocolConstants.MAX_FRAME_BODY_LEN) {
            throw new InvalidArgumentException("frame body length " + header.length + " out of range");
        }
        return header;
    }
    
    public long getLength() {
        return length;
    }
    
    public byte getCmd() {
        return cmd;
    }
    
    public byte getStatus() {
        return status;
    }
    
    public boolean isError() {
        return status != ProtocolConstants.STATUS_SUCCESS;
    }
    
    @Override
    public String toString() {
        return "ProtocolHeader{cmd=" + cmd + ", status=" + status + ", length=" + length + '}';
    }
}
