package org.piecestore.identity;

import org.piecestore.exception.PieceIdException;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * The unique identifier for pieces.
 * 
 * A piece ID is 32 raw bytes. Its textual form is unpadded base32 and is the
 * only representation used in logs and at human-facing boundaries. The
 * all-zero value denotes an unset identifier.
 */
public final class PieceID implements Comparable<PieceID> {
    
    public static final int SIZE = 32;
    
    public static final PieceID ZERO = new PieceID(new byte[SIZE]);
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final byte[] id;
    
    private PieceID(byte[] id) {
        this.id = id;
    }
    
    /**
     * Creates a random piece ID.
     * 
     * @throws IllegalStateException if the secure random source fails
     */
    public static PieceID newPieceID() {
        byte[] id = new byte[SIZE];
        try {
            RANDOM.nextBytes(id);
        } catch (RuntimeException e) {
            throw new IllegalStateException("secure random source unavailable", e);
        }
        return new PieceID(id);
    }
    
    /**
     * Decodes a base32 encoded piece ID.
     */
    public static PieceID fromString(String s) throws PieceIdException {
        if (s == null) {
            throw new PieceIdException("empty string");
        }
        byte[] idBytes;
        try {
            idBytes = Base32.decode(s);
        } catch (IllegalArgumentException e) {
            throw new PieceIdException(e.getMessage(), e);
        }
        return fromBytes(idBytes);
    }
    
    /**
     * Converts a byte array into a piece ID.
     */
    public static PieceID fromBytes(byte[] b) throws PieceIdException {
        if (b == null || b.length != SIZE) {
            throw new PieceIdException("not enough bytes to make a piece ID; have "
                    + (b == null ? 0 : b.length) + ", need " + SIZE);
        }
        return new PieceID(b.clone());
    }
    
    /**
     * Extracts a piece ID from a storage cell value, which must hold raw bytes.
     */
    public static PieceID fromCell(Object cell) throws PieceIdException {
        if (!(cell instanceof byte[])) {
            throw new PieceIdException("PieceID cell expects byte[]");
        }
        return fromBytes((byte[]) cell);
    }
    
    /**
     * Returns the value stored in a storage cell for this piece ID.
     */
    public Object toCell() {
        return getBytes();
    }
    
    public boolean isZero() {
        return equals(ZERO);
    }
    
    public byte[] getBytes() {
        return id.clone();
    }
    
    /**
     * Derives a new piece ID from this one, the given storage node ID and piece number.
     */
    public PieceID derive(NodeID storageNodeId, int pieceNum) {
        return deriver().derive(storageNodeId, pieceNum);
    }
    
    /**
     * Creates a deriver for multiple derive operations sharing this piece ID as key.
     */
    public PieceIDDeriver deriver() {
        return new PieceIDDeriver(id);
    }
    
    static PieceID wrap(byte[] id) {
        return new PieceID(id);
    }
    
    byte[] rawBytes() {
        return id;
    }
    
    @Override
    public int compareTo(PieceID other) {
        return Arrays.compareUnsigned(id, other.id);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PieceID)) return false;
        return Arrays.equals(id, ((PieceID) o).id);
    }
    
    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }
    
    @Override
    public String toString() {
        return Base32.encode(id);
    }
}
