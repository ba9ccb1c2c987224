package org.piecestore.exception;

/**
 * Exception thrown when a piece or node identifier cannot be decoded,
 * either because of a wrong length or malformed textual encoding.
 */
public class PieceIdException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public PieceIdException(String details) {
        super("piece ID: " + details);
    }

    public PieceIdException(String details, Throwable cause) {
        super("piece ID: " + details, cause);
    }
}
