package org.piecestore.config;

/**
 * How a storage node handles retain requests.
 */
public enum RetainStatus {
    
    /**
     * Retain requests are acknowledged and ignored.
     */
    DISABLED,
    
    /**
     * Pieces outside the filter are moved to trash.
     */
    ENABLED,
    
    /**
     * Pieces outside the filter are only logged.
     */
    DEBUG
}
