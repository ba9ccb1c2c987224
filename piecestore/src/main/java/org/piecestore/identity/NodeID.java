package org.piecestore.identity;

import org.piecestore.exception.PieceIdException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.util.Arrays;

/**
 * Identifier of a storage node, satellite or uplink peer.
 * 
 * A node ID is the SHA-256 of the peer's encoded public key.
 */
public final class NodeID {
    
    public static final int SIZE = 32;
    
    private final byte[] id;
    
    private NodeID(byte[] id) {
        this.id = id;
    }
    
    public static NodeID fromPublicKey(PublicKey publicKey) {
        try {
            return new NodeID(MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    public static NodeID fromBytes(byte[] b) throws PieceIdException {
        if (b == null || b.length != SIZE) {
            throw new PieceIdException("node ID: not enough bytes; have "
                    + (b == null ? 0 : b.length) + ", need " + SIZE);
        }
        return new NodeID(b.clone());
    }
    
    public static NodeID fromString(String s) throws PieceIdException {
        try {
            return fromBytes(Base32.decode(s));
        } catch (IllegalArgumentException e) {
            throw new PieceIdException("node ID: " + e.getMessage(), e);
        }
    }
    
    public byte[] getBytes() {
        return id.clone();
    }
    
    byte[] rawBytes() {
        return id;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeID)) return false;
        return Arrays.equals(id, ((NodeID) o).id);
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
