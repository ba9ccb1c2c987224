package org.piecestore.identity;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;

/**
 * Derives node-specific piece IDs from one canonical piece ID.
 * 
 * The canonical ID keys an HMAC-SHA512 once at construction. Every
 * {@link #derive(NodeID, int)} call resets the MAC to that keyed state, so
 * reusing a deriver gives the same result as a fresh one per call.
 * 
 * Instances are not thread-safe. Use one deriver per thread.
 */
public final class PieceIDDeriver {
    
    private static final String ALGORITHM = "HmacSHA512";
    
    private final Mac mac;
    
    PieceIDDeriver(byte[] key) {
        try {
            this.mac = Mac.getInstance(ALGORITHM);
            this.mac.init(new SecretKeySpec(key, ALGORITHM));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
    
    /**
     * Derives a piece ID for the given storage node and piece number.
     */
    public PieceID derive(NodeID storageNodeId, int pieceNum) {
        mac.reset();
        mac.update(storageNodeId.rawBytes());
        mac.update(ByteBuffer.allocate(4).putInt(pieceNum).array());
        
        byte[] derived = new byte[PieceID.SIZE];
        System.arraycopy(mac.doFinal(), 0, derived, 0, PieceID.SIZE);
        return PieceID.wrap(derived);
    }
}
