package org.piecestore.exception;

import java.net.SocketTimeoutException;

/**
 * Exception thrown when a storage node does not accept a connection in time.
 * Retried like any other network error.
 */
public class ConnectionTimeoutException extends NetworkException {
    
    private static final long serialVersionUID = 1L;

    public ConnectionTimeoutException(String addr, SocketTimeoutException cause) {
        super("connect", addr, cause);
    }
}
