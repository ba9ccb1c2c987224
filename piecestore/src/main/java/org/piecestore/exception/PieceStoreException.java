package org.piecestore.exception;

/**
 * Base exception for all piece store errors.
 * 
 * This is the root exception class for identity, authorization, integrity,
 * sequencing, storage and transport failures. All specific piece store
 * exceptions extend from this class.
 */
public class PieceStoreException extends Exception {
    
    private static final long serialVersionUID = 1L;

    public PieceStoreException(String message) {
        super(message);
    }

    public PieceStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public PieceStoreException(Throwable cause) {
        super(cause);
    }
}
