package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;

import java.time.Instant;

/**
 * Satellite request to trash every piece created before a threshold that is
 * not a member of the given bloom filter.
 */
public class RetainRequest implements Message {
    
    private static final int TAG_CREATION_DATE = 1;
    private static final int TAG_FILTER = 2;
    
    private final Instant creationDate;
    private final byte[] filter;
    
    public RetainRequest(Instant creationDate, byte[] filter) {
        this.creationDate = creationDate;
        this.filter = filter;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_RETAIN_REQUEST;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeInstant(TAG_CREATION_DATE, creationDate)
                .writeBytes(TAG_FILTER, filter)
                .toByteArray();
    }
    
    public static RetainRequest decode(byte[] data) throws InvalidArgumentException {
        Instant creationDate = null;
        byte[] filter = null;
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_CREATION_DATE) {
                creationDate = reader.instant();
            } else if (reader.tag() == TAG_FILTER) {
                filter = reader.bytes();
            }
        }
        return new RetainRequest(creationDate, filter);
    }
    
    public Instant getCreationDate() {
        return creationDate;
    }
    
    public byte[] getFilter() {
        return filter;
    }
}
