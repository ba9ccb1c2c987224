package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;

/**
 * Reply to a batch delete: how many of the requested pieces could not be deleted.
 */
public class DeletePiecesResponse implements Message {
    
    private static final int TAG_UNHANDLED_COUNT = 1;
    
    private final long unhandledCount;
    
    public DeletePiecesResponse(long unhandledCount) {
        this.unhandledCount = unhandledCount;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_DELETE_PIECES_RESPONSE;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeLong(TAG_UNHANDLED_COUNT, unhandledCount)
                .toByteArray();
    }
    
    public static DeletePiecesResponse decode(byte[] data) throws InvalidArgumentException {
        long unhandledCount = 0;
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_UNHANDLED_COUNT) {
                unhandledCount = reader.longValue();
            }
        }
        return new DeletePiecesResponse(unhandledCount);
    }
    
    public long getUnhandledCount() {
        return unhandledCount;
    }
}
