package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.OrderLimit;

/**
 * Deletes a single piece authorized by a DELETE order limit.
 * 
 * @deprecated kept for older satellites; use {@link DeletePiecesRequest}.
 */
@Deprecated
public class PieceDeleteRequest implements Message {
    
    private static final int TAG_LIMIT = 1;
    
    private OrderLimit limit;
    
    public PieceDeleteRequest() {
    }
    
    public PieceDeleteRequest(OrderLimit limit) {
        this.limit = limit;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_DELETE_REQUEST;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_LIMIT, limit == null ? null : limit.encode())
                .toByteArray();
    }
    
    public static PieceDeleteRequest decode(byte[] data) throws InvalidArgumentException {
        PieceDeleteRequest request = new PieceDeleteRequest();
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_LIMIT) {
                request.limit = OrderLimit.decode(reader.bytes());
            }
        }
        return request;
    }
    
    public OrderLimit getLimit() {
        return limit;
    }
}
