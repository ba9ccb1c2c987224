package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceIdException;
import org.piecestore.identity.PieceID;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Satellite request to delete a batch of pieces.
 */
public class DeletePiecesRequest implements Message {
    
    private static final int TAG_PIECE_ID = 1;
    
    private final List<PieceID> pieceIds;
    
    public DeletePiecesRequest(List<PieceID> pieceIds) {
        this.pieceIds = pieceIds == null ? Collections.emptyList() : pieceIds;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_DELETE_PIECES_REQUEST;
    }
    
    @Override
    public byte[] encode() {
        WireWriter writer = new WireWriter();
        for (PieceID pieceId : pieceIds) {
            writer.writeBytes(TAG_PIECE_ID, pieceId.getBytes());
        }
        return writer.toByteArray();
    }
    
    public static DeletePiecesRequest decode(byte[] data) throws InvalidArgumentException {
        List<PieceID> pieceIds = new ArrayList<>();
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_PIECE_ID) {
                try {
                    pieceIds.add(PieceID.fromBytes(reader.bytes()));
                } catch (PieceIdException e) {
                    throw new InvalidArgumentException(e.getMessage());
                }
            }
        }
        return new DeletePiecesRequest(pieceIds);
    }
    
    public List<PieceID> getPieceIds() {
        return pieceIds;
    }
}
