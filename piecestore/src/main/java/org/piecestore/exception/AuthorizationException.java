package org.piecestore.exception;

/**
 * Exception thrown when an order limit or order does not authorize the
 * requested transfer: bad signature, expiry, wrong action, untrusted
 * satellite, replayed serial number or exceeded byte allowance.
 * 
 * Terminal for the current session. The caller must obtain a fresh
 * order limit and open a new session.
 */
public class AuthorizationException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
