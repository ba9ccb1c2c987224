package org.piecestore.protocol;

/**
 * A piece store protocol message carried in the body of one frame.
 */
public interface Message {
    
    /**
     * Command code placed in the frame header.
     */
    byte command();
    
    byte[] encode();
}
