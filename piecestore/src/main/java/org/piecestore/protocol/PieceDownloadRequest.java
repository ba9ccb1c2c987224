package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;

/**
 * Message sent by the uplink during a download.
 * 
 * Expected order of messages:
 * <pre>
 *   {OrderLimit, Chunk} ->
 *   repeated
 *      Order ->
 *      Chunk ->     (further ranges, optional)
 *   repeated
 *      &lt;- PieceDownloadResponse.Chunk
 * </pre>
 */
public class PieceDownloadRequest implements Message {
    
    private static final int TAG_LIMIT = 1;
    private static final int TAG_ORDER = 2;
    private static final int TAG_CHUNK = 3;
    
    private OrderLimit limit;
    private Order order;
    private Chunk chunk;
    
    public PieceDownloadRequest() {
    }
    
    public static PieceDownloadRequest ofLimit(OrderLimit limit, long offset, long chunkSize) {
        PieceDownloadRequest request = new PieceDownloadRequest();
        request.limit = limit;
        request.chunk = new Chunk(offset, chunkSize);
        return request;
    }
    
    public static PieceDownloadRequest ofOrder(Order order) {
        PieceDownloadRequest request = new PieceDownloadRequest();
        request.order = order;
        return request;
    }
    
    public static PieceDownloadRequest ofChunk(long offset, long chunkSize) {
        PieceDownloadRequest request = new PieceDownloadRequest();
        request.chunk = new Chunk(offset, chunkSize);
        return request;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_DOWNLOAD_REQUEST;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_LIMIT, limit == null ? null : limit.encode())
                .writeBytes(TAG_ORDER, order == null ? null : order.encode())
                .writeBytes(TAG_CHUNK, chunk == null ? null : chunk.encode())
                .toByteArray();
    }
    
    public static PieceDownloadRequest decode(byte[] data) throws InvalidArgumentException {
        PieceDownloadRequest request = new PieceDownloadRequest();
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
    
    /**
     * A byte range the uplink wishes to download.
     */
    public static class Chunk {
        
        private static final int TAG_OFFSET = 1;
        private static final int TAG_CHUNK_SIZE = 2;
        
        private final long offset;
        private final long chunkSize;
        
        public Chunk(long offset, long chunkSize) {
            this.offset = offset;
            this.chunkSize = chunkSize;
        }
        
        public long getOffset() {
            return offset;
        }
        
        public long getChunkSize() {
            return chunkSize;
        }
        
        byte[] encode() {
            return new WireWriter()
                    .writeLong(TAG_OFFSET, offset)
                    .writeLong(TAG_CHUNK_SIZE, chunkSize)
                    .toByteArray();
        }
        
        static Chunk decode(byte[] encoded) throws InvalidArgumentException {
            long offset = 0;
            long chunkSize = 0;
            WireReader reader = new WireReader(encoded);
            while (reader.next()) {
                if (reader.tag() == TAG_OFFSET) {
                    offset = reader.longValue();
                } else if (reader.tag() == TAG_CHUNK_SIZE) {
                    chunkSize = reader.longValue();
                }
            }
            return new Chunk(offset, chunkSize);
        }
    }
}
