package org.piecestore.exception;

/**
 * Exception thrown when invalid argument is provided.
 */
public class InvalidArgumentException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public InvalidArgumentException() {
        super("Invalid argument");
    }

    public InvalidArgumentException(String details) {
        super("Invalid argument: " + details);
    }
}
