package org.piecestore.config;

import org.piecestore.orders.PieceHashAlgorithm;

/**
 * Options for {@link org.piecestore.PieceStoreClient}.
 *
 * Times are in milliseconds. The defaults suit a node with the default
 * stream timeout of 30 seconds.
 */
public class ClientConfig {

    private int maxConns = 10;
    private int connectTimeout = 5000;
    private int networkTimeout = 30000;
    private int idleTimeout = 20000;
    private int retryCount = 3;
    private long retryBackoff = 100;
    private int uploadChunkSize = 256 * 1024;
    private PieceHashAlgorithm hashAlgorithm = PieceHashAlgorithm.SHA256;

    /**
     * Idle connections kept per storage node. Default: 10
     */
    public int getMaxConns() {
        return maxConns;
    }

    public ClientConfig setMaxConns(int maxConns) {
        this.maxConns = maxConns;
        return this;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public ClientConfig setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    /**
     * Socket read timeout while waiting on a storage node. Default: 30000
     */
    public int getNetworkTimeout() {
        return networkTimeout;
    }

    public ClientConfig setNetworkTimeout(int networkTimeout) {
        this.networkTimeout = networkTimeout;
        return this;
    }

    /**
     * Pooled connections unused for longer are closed instead of reused.
     * Must stay below the node's stream timeout. Default: 20000
     */
    public int getIdleTimeout() {
        return idleTimeout;
    }

    public ClientConfig setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
        return this;
    }

    /**
     * Attempts for DeletePieces, Retain and RestoreTrash. Uploads and
     * downloads are never retried. Default: 3
     */
    public int getRetryCount() {
        return retryCount;
    }

    public ClientConfig setRetryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    /**
     * Base delay between attempts, multiplied by the attempt number. Default: 100
     */
    public long getRetryBackoff() {
        return retryBackoff;
    }

    public ClientConfig setRetryBackoff(long retryBackoff) {
        this.retryBackoff = retryBackoff;
        return this;
    }

    /**
     * Size of the chunks an upload is split into. Default: 256 KiB
     */
    public int getUploadChunkSize() {
        return uploadChunkSize;
    }

    public ClientConfig setUploadChunkSize(int uploadChunkSize) {
        this.uploadChunkSize = uploadChunkSize;
        return this;
    }

    /**
     * Piece hash used when an upload names none. Default: SHA-256
     */
    public PieceHashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    public ClientConfig setHashAlgorithm(PieceHashAlgorithm hashAlgorithm) {
        this.hashAlgorithm = hashAlgorithm;
        return this;
    }

    @Override
    public String toString() {
        return "ClientConfig{maxConns=" + maxConns
                + ", connectTimeout=" + connectTimeout
                + ", networkTimeout=" + networkTimeout
                + ", idleTimeout=" + idleTimeout
                + ", retryCount=" + retryCount
                + ", retryBackoff=" + retryBackoff
                + ", uploadChunkSize=" + uploadChunkSize
                + ", hashAlgorithm=" + hashAlgorithm
                + '}';
    }
}
