package org.piecestore.storage;

import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;

import java.util.Objects;

/**
 * Locates a piece: the satellite namespace it belongs to and its ID.
 */
public final class PieceKey {
    
    private final NodeID satelliteId;
    private final PieceID pieceId;
    
    public PieceKey(NodeID satelliteId, PieceID pieceId) {
        this.satelliteId = Objects.requireNonNull(satelliteId, "satelliteId");
        this.pieceId = Objects.requireNonNull(pieceId, "pieceId");
    }
    
    public NodeID getSatelliteId() {
        return satelliteId;
    }
    
    public PieceID getPieceId() {
        return pieceId;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PieceKey)) return false;
        PieceKey other = (PieceKey) o;
        return satelliteId.equals(other.satelliteId) && pieceId.equals(other.pieceId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(satelliteId, pieceId);
    }
    
    @Override
    public String toString() {
        return satelliteId + "/" + pieceId;
    }
}
