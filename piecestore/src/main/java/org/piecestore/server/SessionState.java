package org.piecestore.server;

/**
 * Lifecycle of an upload or download session.
 * 
 * <pre>
 * IDLE -> AWAITING_LIMIT -> ACTIVE -> FINALIZING -> DONE
 *                 \            \          \
 *                  +------------+----------+--> FAILED
 * </pre>
 */
public enum SessionState {
    
    IDLE,
    
    /**
     * Waiting for the first message carrying the order limit.
     */
    AWAITING_LIMIT,
    
    /**
     * Limit accepted, data is flowing.
     */
    ACTIVE,
    
    /**
     * Upload only: the uplink's hash arrived and is being checked and committed.
     */
    FINALIZING,
    
    DONE,
    
    FAILED
}
