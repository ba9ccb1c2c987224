package org.piecestore.connection;

import org.piecestore.protocol.ProtocolHeader;

/**
 * One received frame: its header and body.
 */
public class Frame {
    
    private final ProtocolHeader header;
    private final byte[] body;
    
    public Frame(ProtocolHeader header, byte[] body) {
        this.header = header;
        this.body = body;
    }
    
    public byte getCmd() {
        return header.getCmd();
    }
    
    public byte getStatus() {
        return header.getStatus();
    }
    
    public byte[] getBody() {
        return body;
    }
    
    @Override
    public String toString() {
        return "Frame{" + header + '}';
    }
}
