package org.piecestore.orders;

/**
 * The transfer an order limit authorizes.
 */
public enum PieceAction {
    
    INVALID(0),
    PUT(1),
    GET(2),
    GET_AUDIT(3),
    GET_REPAIR(4),
    PUT_REPAIR(5),
    DELETE(6),
    PUT_GRACEFUL_EXIT(7);
    
    private final int code;
    
    PieceAction(int code) {
        this.code = code;
    }
    
    public int getCode() {
        return code;
    }
    
    public boolean isUpload() {
        return this == PUT || this == PUT_REPAIR || this == PUT_GRACEFUL_EXIT;
    }
    
    public boolean isDownload() {
        return this == GET || this == GET_AUDIT || this == GET_REPAIR;
    }
    
    /**
     * Returns the action for a wire code, or {@link #INVALID} for unknown codes.
     */
    public static PieceAction fromCode(int code) {
        for (PieceAction action : values()) {
            if (action.code == code) {
                return action;
            }
        }
        return INVALID;
    }
}
