package org.piecestore.exception;

/**
 * Exception thrown when an upload or download session is cancelled
 * before it completes, for example because the server is shutting down.
 */
public class SessionCancelledException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public SessionCancelledException(String message) {
        super(message);
    }
}
