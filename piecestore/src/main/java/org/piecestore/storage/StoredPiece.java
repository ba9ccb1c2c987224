package org.piecestore.storage;

import org.piecestore.identity.PieceID;

import java.time.Instant;

/**
 * Information about a piece found while walking a satellite's namespace.
 */
public class StoredPiece {
    
    private final PieceID pieceId;
    private final FormatVersion formatVersion;
    private final Instant creationTime;
    private final long contentSize;
    
    public StoredPiece(PieceID pieceId, FormatVersion formatVersion, Instant creationTime, long contentSize) {
        this.pieceId = pieceId;
        this.formatVersion = formatVersion;
        this.creationTime = creationTime;
        this.contentSize = contentSize;
    }
    
    public PieceID getPieceId() {
        return pieceId;
    }
    
    public FormatVersion getFormatVersion() {
        return formatVersion;
    }
    
    /**
     * Creation time as given in the uplink's piece hash.
     */
    public Instant getCreationTime() {
        return creationTime;
    }
    
    /**
     * Payload size, excluding any header.
     */
    public long getContentSize() {
        return contentSize;
    }
    
    @Override
    public String toString() {
        return "StoredPiece{" +
                "pieceId=" + pieceId +
                ", formatVersion=" + formatVersion +
                ", creationTime=" + creationTime +
                ", contentSize=" + contentSize +
                '}';
    }
}
