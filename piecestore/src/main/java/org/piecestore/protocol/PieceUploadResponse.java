package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.PieceHash;

/**
 * Final reply to an upload: the piece hash signed by the storage node.
 */
public class PieceUploadResponse implements Message {
    
    private static final int TAG_DONE = 1;
    
    private PieceHash done;
    
    public PieceUploadResponse() {
    }
    
    public PieceUploadResponse(PieceHash done) {
        this.done = done;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_UPLOAD_RESPONSE;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_DONE, done == null ? null : done.encode())
                .toByteArray();
    }
    
    public static PieceUploadResponse decode(byte[] data) throws InvalidArgumentException {
        PieceUploadResponse response = new PieceUploadResponse();
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_DONE) {
                response.done = PieceHash.decode(reader.bytes());
            }
        }
        return response;
    }
    
    public PieceHash getDone() {
        return done;
    }
    
    public void setDone(PieceHash done) {
        this.done = done;
    }
}
