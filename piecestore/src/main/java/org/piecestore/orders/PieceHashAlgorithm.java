package org.piecestore.orders;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.Blake3Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Content hash algorithms a piece may be hashed with.
 */
public enum PieceHashAlgorithm {
    
    /**
     * Default algorithm, used when an upload does not name one.
     */
    SHA256(0),
    
    BLAKE3(1);
    
    private final int code;
    
    PieceHashAlgorithm(int code) {
        this.code = code;
    }
    
    public int getCode() {
        return code;
    }
    
    /**
     * Creates a running hash for this algorithm.
     */
    public PieceHasher newHasher() {
        return new PieceHasher(this, newDigest());
    }
    
    private Digest newDigest() {
        switch (this) {
            case BLAKE3:
                return new Blake3Digest();
            case SHA256:
            default:
                return new SHA256Digest();
        }
    }
    
    public static PieceHashAlgorithm fromCode(int code) {
        for (PieceHashAlgorithm algorithm : values()) {
            if (algorithm.code == code) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("unknown piece hash algorithm: " + code);
    }
}
