package org.piecestore.orders;

import org.bouncycastle.crypto.Digest;

/**
 * Running content hash over piece bytes.
 */
public final class PieceHasher {
    
    private final PieceHashAlgorithm algorithm;
    private final Digest digest;
    private long size;
    
    PieceHasher(PieceHashAlgorithm algorithm, Digest digest) {
        this.algorithm = algorithm;
        this.digest = digest;
    }
    
    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
        size += length;
    }
    
    public void update(byte[] data) {
        update(data, 0, data.length);
    }
    
    /**
     * Seals the hash. The hasher is reset afterwards.
     */
    public byte[] digest() {
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        size = 0;
        return out;
    }
    
    /**
     * Number of bytes hashed since creation or the last {@link #digest()}.
     */
    public long size() {
        return size;
    }
    
    public PieceHashAlgorithm getAlgorithm() {
        return algorithm;
    }
    
    /**
     * Hashes a complete payload in one call.
     */
    public static byte[] hash(PieceHashAlgorithm algorithm, byte[] data) {
        PieceHasher hasher = algorithm.newHasher();
        hasher.update(data);
        return hasher.digest();
    }
}
