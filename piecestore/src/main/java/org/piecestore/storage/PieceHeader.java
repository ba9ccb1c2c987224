package org.piecestore.storage;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.protocol.WireReader;
import org.piecestore.protocol.WireWriter;

import java.time.Instant;

/**
 * Metadata persisted alongside each piece's bytes.
 * 
 * The uplink's piece hash is not stored as such: it is reconstructable from
 * the piece ID, the payload size and the hash, creation time and signature
 * kept here. The header is immutable once written.
 */
public class PieceHeader {
    
    /**
     * Size of the header area reserved at the start of a V1 blob.
     */
    public static final int V1_HEADER_SIZE = 512;
    
    /**
     * The encoded header is prefixed with its length as a 2-byte big-endian integer.
     */
    public static final int V1_LENGTH_PREFIX_SIZE = 2;
    
    private static final int TAG_FORMAT_VERSION = 1;
    private static final int TAG_HASH = 2;
    private static final int TAG_CREATION_TIME = 3;
    private static final int TAG_SIGNATURE = 4;
    private static final int TAG_ORDER_LIMIT = 5;
    private static final int TAG_HASH_ALGORITHM = 6;
    
    private FormatVersion formatVersion = FormatVersion.FORMAT_V1;
    private byte[] hash;
    private Instant creationTime;
    private byte[] signature;
    private OrderLimit orderLimit;
    private PieceHashAlgorithm hashAlgorithm = PieceHashAlgorithm.SHA256;
    
    public PieceHeader() {
    }
    
    /**
     * Builds the header for an accepted upload from the uplink's signed hash
     * and the order limit validated at the start of the session.
     */
    public static PieceHeader fromUplinkHash(PieceHash uplinkHash, OrderLimit orderLimit) {
        PieceHeader header = new PieceHeader();
        header.hash = uplinkHash.getHash();
        header.creationTime = uplinkHash.getTimestamp();
        header.signature = uplinkHash.getSignature();
        header.hashAlgorithm = uplinkHash.getHashAlgorithm();
        header.orderLimit = orderLimit;
        return header;
    }
    
    /**
     * Reconstructs the uplink-signed piece hash for a piece of the given size.
     */
    public PieceHash toUplinkHash(long pieceSize) {
        PieceHash pieceHash = new PieceHash(orderLimit == null ? null : orderLimit.getPieceId(),
                hash, pieceSize, creationTime, hashAlgorithm);
        pieceHash.setSignature(signature);
        return pieceHash;
    }
    
    public byte[] encode() {
        return new WireWriter()
                .writeInt(TAG_FORMAT_VERSION, formatVersion.getCode())
                .writeBytes(TAG_HASH, hash)
                .writeInstant(TAG_CREATION_TIME, creationTime)
                .writeBytes(TAG_SIGNATURE, signature)
                .writeBytes(TAG_ORDER_LIMIT, orderLimit == null ? null : orderLimit.encode())
                .writeInt(TAG_HASH_ALGORITHM, hashAlgorithm.getCode())
                .toByteArray();
    }
    
    public static PieceHeader decode(byte[] data) throws InvalidArgumentException {
        PieceHeader header = new PieceHeader();
        WireReader reader = new WireReader(data);
        try {
            while (reader.next()) {
                switch (reader.tag()) {
                    case TAG_FORMAT_VERSION:
                        header.formatVersion = FormatVersion.fromCode(reader.intValue());
                        break;
                    case TAG_HASH:
                        header.hash = reader.bytes();
                        break;
                    case TAG_CREATION_TIME:
                        header.creationTime = reader.instant();
                        break;
                    case TAG_SIGNATURE:
                        header.signature = reader.bytes();
                        break;
                    case TAG_ORDER_LIMIT:
                        header.orderLimit = OrderLimit.decode(reader.bytes());
                        break;
                    case TAG_HASH_ALGORITHM:
                        header.hashAlgorithm = PieceHashAlgorithm.fromCode(reader.intValue());
                        break;
                    default:
                        break;
                }
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("piece header: " + e.getMessage());
        }
        return header;
    }
    
    public FormatVersion getFormatVersion() {
        return formatVersion;
    }
    
    public void setFormatVersion(FormatVersion formatVersion) {
        this.formatVersion = formatVersion;
    }
    
    public byte[] getHash() {
        return hash;
    }
    
    public void setHash(byte[] hash) {
        this.hash = hash;
    }
    
    public Instant getCreationTime() {
        return creationTime;
    }
    
    public void setCreationTime(Instant creationTime) {
        this.creationTime = creationTime;
    }
    
    public byte[] getSignature() {
        return signature;
    }
    
    public void setSignature(byte[] signature) {
        this.signature = signature;
    }
    
    public OrderLimit getOrderLimit() {
        return orderLimit;
    }
    
    public void setOrderLimit(OrderLimit orderLimit) {
        this.orderLimit = orderLimit;
    }
    
    public PieceHashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }
    
    public void setHashAlgorithm(PieceHashAlgorithm hashAlgorithm) {
        this.hashAlgorithm = hashAlgorithm;
    }
    
    @Override
    public String toString() {
        return "PieceHeader{" +
                "formatVersion=" + formatVersion +
                ", creationTime=" + creationTime +
                ", hashAlgorithm=" + hashAlgorithm +
                ", orderLimit=" + orderLimit +
                '}';
    }
}
