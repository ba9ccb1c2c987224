package org.piecestore.orders;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceIdException;
import org.piecestore.identity.PieceID;
import org.piecestore.protocol.WireReader;
import org.piecestore.protocol.WireWriter;

import java.time.Instant;

/**
 * Signed digest over a piece's full contents.
 * 
 * Sent by the uplink to finish an upload and by the storage node to
 * acknowledge it.
 */
public class PieceHash {
    
    private static final int TAG_PIECE_ID = 1;
    private static final int TAG_HASH = 2;
    private static final int TAG_PIECE_SIZE = 3;
    private static final int TAG_TIMESTAMP = 4;
    private static final int TAG_HASH_ALGORITHM = 5;
    private static final int TAG_SIGNATURE = 6;
    
    private PieceID pieceId;
    private byte[] hash;
    private long pieceSize;
    private Instant timestamp;
    private PieceHashAlgorithm hashAlgorithm = PieceHashAlgorithm.SHA256;
    private byte[] signature;
    
    public PieceHash() {
    }
    
    public PieceHash(PieceID pieceId, byte[] hash, long pieceSize, Instant timestamp,
                     PieceHashAlgorithm hashAlgorithm) {
        this.pieceId = pieceId;
        this.hash = hash;
        this.pieceSize = pieceSize;
        this.timestamp = timestamp;
        this.hashAlgorithm = hashAlgorithm;
    }
    
    public byte[] encode() {
        return encode(true);
    }
    
    public byte[] encodeForSigning() {
        return encode(false);
    }
    
    private byte[] encode(boolean withSignature) {
        WireWriter writer = new WireWriter()
                .writeBytes(TAG_PIECE_ID, pieceId == null ? null : pieceId.getBytes())
                .writeBytes(TAG_HASH, hash)
                .writeLong(TAG_PIECE_SIZE, pieceSize)
                .writeInstant(TAG_TIMESTAMP, timestamp)
                .writeInt(TAG_HASH_ALGORITHM, hashAlgorithm.getCode());
        if (withSignature) {
            writer.writeBytes(TAG_SIGNATURE, signature);
        }
        return writer.toByteArray();
    }
    
    public static PieceHash decode(byte[] data) throws InvalidArgumentException {
        PieceHash pieceHash = new PieceHash();
        WireReader reader = new WireReader(data);
        try {
            while (reader.next()) {
                switch (reader.tag()) {
                    case TAG_PIECE_ID:
                        pieceHash.pieceId = PieceID.fromBytes(reader.bytes());
                        break;
                    case TAG_HASH:
                        pieceHash.hash = reader.bytes();
                        break;
                    case TAG_PIECE_SIZE:
                        pieceHash.pieceSize = reader.longValue();
                        break;
                    case TAG_TIMESTAMP:
                        pieceHash.timestamp = reader.instant();
                        break;
                    case TAG_HASH_ALGORITHM:
                        pieceHash.hashAlgorithm = PieceHashAlgorithm.fromCode(reader.intValue());
                        break;
                    case TAG_SIGNATURE:
                        pieceHash.signature = reader.bytes();
                        break;
                    default:
                        break;
                }
            }
        } catch (PieceIdException | IllegalArgumentException e) {
            throw new InvalidArgumentException("piece hash: " + e.getMessage());
        }
        return pieceHash;
    }
    
    public PieceID getPieceId() {
        return pieceId;
    }
    
    public void setPieceId(PieceID pieceId) {
        this.pieceId = pieceId;
    }
    
    public byte[] getHash() {
        return hash;
    }
    
    public void setHash(byte[] hash) {
        this.hash = hash;
    }
    
    public long getPieceSize() {
        return pieceSize;
    }
    
    public void setPieceSize(long pieceSize) {
        this.pieceSize = pieceSize;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
    
    public PieceHashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }
    
    public void setHashAlgorithm(PieceHashAlgorithm hashAlgorithm) {
        this.hashAlgorithm = hashAlgorithm;
    }
    
    public byte[] getSignature() {
        return signature;
    }
    
    public void setSignature(byte[] signature) {
        this.signature = signature;
    }
    
    @Override
    public String toString() {
        return "PieceHash{" +
                "pieceId=" + pieceId +
                ", pieceSize=" + pieceSize +
                ", timestamp=" + timestamp +
                ", hashAlgorithm=" + hashAlgorithm +
                '}';
    }
}
