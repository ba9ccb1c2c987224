package org.piecestore.exception;

/**
 * Exception thrown when the underlying piece storage fails.
 */
public class StorageException extends PieceStoreException {
    
    private static final long serialVersionUID = 1L;
    
    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("Storage error during " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public StorageException(String message) {
        super(message);
        this.operation = null;
    }

    public String getOperation() {
        return operation;
    }
}
