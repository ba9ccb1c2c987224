package org.piecestore.protocol;

/**
 * Message without fields: the delete, retain and restore-trash responses
 * and the restore-trash request.
 */
public final class EmptyMessage implements Message {
    
    private final byte command;
    
    private EmptyMessage(byte command) {
        this.command = command;
    }
    
    public static EmptyMessage deleteResponse() {
        return new EmptyMessage(ProtocolConstants.CMD_DELETE_RESPONSE);
    }
    
    public static EmptyMessage retainResponse() {
        return new EmptyMessage(ProtocolConstants.CMD_RETAIN_RESPONSE);
    }
    
    public static EmptyMessage restoreTrashRequest() {
        return new EmptyMessage(ProtocolConstants.CMD_RESTORE_TRASH_REQUEST);
    }
    
    public static EmptyMessage restoreTrashResponse() {
        return new EmptyMessage(ProtocolConstants.CMD_RESTORE_TRASH_RESPONSE);
    }
    
    @Override
    public byte command() {
        return command;
    }
    
    @Override
    public byte[] encode() {
        return new byte[0];
    }
}
