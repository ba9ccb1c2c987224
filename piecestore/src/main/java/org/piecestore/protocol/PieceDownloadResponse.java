package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;

/**
 * Message sent by the storage node during a download: either the piece's
 * uplink-signed hash with the original order limit, or a chunk of data.
 */
public class PieceDownloadResponse implements Message {
    
    private static final int TAG_CHUNK = 1;
    private static final int TAG_HASH = 2;
    private static final int TAG_LIMIT = 3;
    
    private Chunk chunk;
    private PieceHash hash;
    private OrderLimit limit;
    
    public PieceDownloadResponse() {
    }
    
    public static PieceDownloadResponse ofHash(PieceHash hash, OrderLimit limit) {
        PieceDownloadResponse response = new PieceDownloadResponse();
        response.hash = hash;
        response.limit = limit;
        return response;
    }
    
    public static PieceDownloadResponse ofChunk(long offset, byte[] data) {
        PieceDownloadResponse response = new PieceDownloadResponse();
        response.chunk = new Chunk(offset, data);
        return response;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_DOWNLOAD_RESPONSE;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_CHUNK, chunk == null ? null : chunk.encode())
                .writeBytes(TAG_HASH, hash == null ? null : hash.encode())
                .writeBytes(TAG_LIMIT, limit == null ? null : limit.encode())
                .toByteArray();
    }
    
    public static PieceDownloadResponse decode(byte[] data) throws InvalidArgumentException {
        PieceDownloadResponse response = new PieceDownloadResponse();
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            switch (reader.tag()) {
                case TAG_CHUNK:
                    response.chunk = Chunk.decode(reader.bytes());
                    break;
                case TAG_HASH:
                    response.hash = PieceHash.decode(reader.bytes());
                    break;
                case TAG_LIMIT:
                    response.limit = OrderLimit.decode(reader.bytes());
                    break;
                default:
                    break;
            }
        }
        return response;
    }
    
    public Chunk getChunk() {
        return chunk;
    }
    
    public PieceHash getHash() {
        return hash;
    }
    
    public OrderLimit getLimit() {
        return limit;
    }
    
    /**
     * Piece data read at an offset.
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
