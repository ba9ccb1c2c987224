package org.piecestore.exception;

/**
 * Exception thrown when piece content or its signed hash fails verification.
 */
public class IntegrityException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
