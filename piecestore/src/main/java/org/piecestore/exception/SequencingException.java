package org.piecestore.exception;

/**
 * Exception thrown when stream messages arrive out of protocol order,
 * such as a chunk whose offset is not the expected write position.
 */
public class SequencingException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public SequencingException(String message) {
        super(message);
    }
}
