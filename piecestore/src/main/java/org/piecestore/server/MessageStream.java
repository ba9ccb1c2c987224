package org.piecestore.server;

import org.piecestore.exception.PieceStoreException;

/**
 * One side of a bidirectional message stream carrying a streaming RPC.
 * 
 * @param <I> messages received from the peer
 * @param <O> messages sent to the peer
 */
public interface MessageStream<I, O> {
    
    /**
     * Blocks until the next message arrives.
     * 
     * @return the message, or null once the peer has ended its side of the stream
     */
    I receive() throws PieceStoreException;
    
    void send(O message) throws PieceStoreException;
}
