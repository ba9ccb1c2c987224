package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;

/**
 * Message sent by the uplink during an upload.
 * 
 * Expected order of messages:
 * <pre>
 *   OrderLimit (+ optional hash algorithm) ->
 *   repeated
 *      Order ->
 *      Chunk ->
 *   PieceHash signed by uplink ->
 *      &lt;- PieceHash signed by storage node
 * </pre>
 */
public class PieceUploadRequest implements Message {
    
    private static final int TAG_LIMIT = 1;
    private static final int TAG_ORDER = 2;
    private static final int TAG_CHUNK = 3;
    private static final int TAG_DONE = 4;
    private static final int TAG_HASH_ALGORITHM = 5;
    
    private OrderLimit limit;
    private PieceHashAlgorithm hashAlgorithm;
    private Order order;
    private Chunk chunk;
    private PieceHash done;
    
    public PieceUploadRequest() {
    }
    
    public static PieceUploadRequest ofLimit(OrderLimit limit, PieceHashAlgorithm hashAlgorithm) {
        PieceUploadRequest request = new PieceUploadRequest();
        request.limit = limit;
        request.hashAlgorithm = hashAlgorithm;
        return request;
    }
    
    public static PieceUploadRequest ofOrder(Order order) {
        PieceUploadRequest request = new PieceUploadRequest();
        request.order = order;
        return request;
    }
    
    public static PieceUploadRequest ofChunk(long offset, byte[] data) {
        PieceUploadRequest request = new PieceUploadRequest();
        request.chunk = new Chunk(offset, data);
        return request;
    }
    
    public static PieceUploadRequest ofDone(PieceHash done) {
        PieceUploadRequest request = new PieceUploadRequest();
        request.done = done;
        return request;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_UPLOAD_REQUEST;
    }
    
    @Override
    public byte[] encode() {
        WireWriter writer = new WireWriter()
                .writeBytes(TAG_LIMIT, limit == null ? null : limit.encode())
                .writeBytes(TAG_ORDER, order == null ? null : order.encode())
                .writeBytes(TAG_CHUNK, chunk == null ? null : chunk.encode())
                .writeBytes(TAG_DONE, done == null ? null : done.encode());
        if (hashAlgorithm != null) {
            writer.writeInt(TAG_HASH_ALGORITHM, hashAlgorithm.getCode());
        }
        return writer.toByteArray();
    }
    
    public static PieceUploadRequest decode(byte[] data) throws InvalidArgumentException {
        PieceUploadRequest request = new PieceUploadRequest();
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            switch (reader.tag()) {
                case TAG_LIMIT:
                    request.limit = OrderLimit.decode(reader.bytes());
                    break;
                case TAG_ORDER:
                    request.order = Order.decode(reader.bytes());
                    break;
                case TAG_CHUNK:
                    request.chunk = Chunk.decode(reader.bytes());
                    break;
                case TAG_DONE:
                    request.done = PieceHash.decode(reader.bytes());
                    break;
                case TAG_HASH_ALGORITHM:
                    try {
                        request.hashAlgorithm = PieceHashAlgorithm.fromCode(reader.intValue());
                    } catch (IllegalArgumentException e) {
                        throw new InvalidArgumentException(e.getMessage());
                    }
                    break;
                default:
                    break;
            }
        }
        return request;
    }
    
    public OrderLimit getLimit() {
        return limit;
    }
    
    public void setLimit(OrderLimit limit) {
        this.limit = limit;
    }
    
    /**
     * Hash algorithm named in the first message; null means the default.
     */
    public PieceHashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }
    
    public void setHashAlgorithm(PieceHashAlgorithm hashAlgorithm) {
        this.hashAlgorithm = hashAlgorithm;
    }
    
    public Order getOrder() {
        return order;
    }
    
    public void setOrder(Order order) {
        this.order = order;
    }
    
    public Chunk getChunk() {
        return chunk;
    }
    
    public void setChunk(Chunk chunk) {
        this.chunk = chunk;
    }
    
    public PieceHash getDone() {
        return done;
    }
    
    public void setDone(PieceHash done) {
        this.done = done;
    }
    
    /**
     * Piece data written at an offset.
     */
    public static class Chunk {
        
        private static final int TAG_OFFSET = 1;
        private static final int TAG_DATA = 2;
        
        private final long offset;
        private final byte[] data;
        
        public Chunk(long offset, byte[] data) {
            this.offset = offset;
            this.data = data == null ? new byte[0] : data;
        }
        
        public long getOffset() {
            return offset;
        }
        
        public byte[] getData() {
            return data;
        }
        
        byte[] encode() {
            return new WireWriter()
                    .writeLong(TAG_OFFSET, offset)
                    .writeBytes(TAG_DATA, data)
                    .toByteArray();
        }
        
        static Chunk decode(byte[] encoded) throws InvalidArgumentException {
            long offset = 0;
            byte[] data = null;
            WireReader reader = new WireReader(encoded);
            while (reader.next()) {
                if (reader.tag() == TAG_OFFSET) {
                    offset = reader.longValue();
                } else if (reader.tag() == TAG_DATA) {
                    data = reader.bytes();
                }
            }
            return new Chunk(offset, data);
        }
    }
}
