package org.piecestore.exception;

/**
 * Exception thrown when a requested piece does not exist.
 */
public class PieceNotFoundException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public PieceNotFoundException() {
        super("Piece not found");
    }

    public PieceNotFoundException(String pieceId) {
        super("Piece not found: " + pieceId);
    }
}
