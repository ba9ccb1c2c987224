package org.piecestore.protocol;

/**
 * Piece store protocol constants.
 * 
 * This class defines the frame layout, message commands and status codes
 * used between uplinks, satellites and storage nodes.
 */
public final class ProtocolConstants {
    
    // Protocol Ports
    public static final int STORAGE_NODE_DEFAULT_PORT = 28967;
    
    // Frame Header Size
    public static final int PROTO_HEADER_LEN = 10; // 8 bytes length + 1 byte cmd + 1 byte status
    
    // Field Encoding
    public static final int FIELD_HEADER_LEN = 5; // 1 byte tag + 4 bytes length
    public static final int INSTANT_LEN = 12; // 8 bytes seconds + 4 bytes nanos
    
    // Upper bound for a single frame body
    public static final int MAX_FRAME_BODY_LEN = 4 * 1024 * 1024;
    
    // Session Commands
    public static final byte CMD_HELLO = 1;
    public static final byte CMD_STREAM_END = 2;
    public static final byte CMD_CHALLENGE = 3;
    public static final byte CMD_HELLO_RESPONSE = 4;
    
    // Piece Store Commands
    public static final byte CMD_UPLOAD_REQUEST = 11;
    public static final byte CMD_UPLOAD_RESPONSE = 12;
    public static final byte CMD_DOWNLOAD_REQUEST = 13;
    public static final byte CMD_DOWNLOAD_RESPONSE = 14;
    public static final byte CMD_DELETE_REQUEST = 15;
    public static final byte CMD_DELETE_RESPONSE = 16;
    public static final byte CMD_DELETE_PIECES_REQUEST = 17;
    public static final byte CMD_DELETE_PIECES_RESPONSE = 18;
    public static final byte CMD_RETAIN_REQUEST = 19;
    public static final byte CMD_RETAIN_RESPONSE = 20;
    public static final byte CMD_RESTORE_TRASH_REQUEST = 21;
    public static final byte CMD_RESTORE_TRASH_RESPONSE = 22;
    
    // Error Status Codes
    public static final byte STATUS_SUCCESS = 0;
    public static final byte STATUS_NOT_FOUND = 2;
    public static final byte STATUS_IO_ERROR = 5;
    public static final byte STATUS_PERMISSION_DENIED = 13;
    public static final byte STATUS_INVALID_ARGUMENT = 22;
    public static final byte STATUS_PROTOCOL_ERROR = 71;
    public static final byte STATUS_INTEGRITY_ERROR = 74;
    public static final byte STATUS_INVALID_PIECE_ID = 84;
    
    private ProtocolConstants() {
        // Prevent instantiation
    }
}
