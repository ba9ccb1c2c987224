package org.piecestore.exception;

/**
 * Exception thrown for protocol-level errors returned by a storage node
 * that do not map to a more specific exception.
 */
public class ProtocolException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;
    
    private final int code;

    public ProtocolException(int code, String message) {
        super(message != null ? message : "Unknown error code: " + code);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
