package org.piecestore.server;

import org.piecestore.connection.Connection;
import org.piecestore.connection.Frame;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.SequencingException;
import org.piecestore.protocol.Message;
import org.piecestore.protocol.ProtocolConstants;
import org.piecestore.protocol.ProtocolUtil;

/**
 * Carries one streaming RPC over a framed connection.
 * 
 * The stream ends when the peer sends STREAM_END or closes the connection.
 */
class ConnectionMessageStream<I, O extends Message> implements MessageStream<I, O> {
    
    /**
     * Decodes a frame body into a message.
     */
    interface Decoder<T> {
        T decode(byte[] body) throws InvalidArgumentException;
    }
    
    private final Connection connection;
    private final byte requestCmd;
    private final Decoder<I> decoder;
    private Frame pushedBack;
    private boolean ended;
    
    /**
     * @param first the frame that opened the RPC, returned by the first receive
     */
    ConnectionMessageStream(Connection connection, byte requestCmd, Decoder<I> decoder, Frame first) {
        this.connection = connection;
        this.requestCmd = requestCmd;
        this.decoder = decoder;
        this.pushedBack = first;
    }
    
    @Override
    public I receive() throws PieceStoreException {
        if (ended) {
            return null;
        }
        Frame frame;
        if (pushedBack != null) {
            frame = pushedBack;
            pushedBack = null;
        } else {
            frame = connection.receiveFrame();
        }
        
        if (frame == null || frame.getCmd() == ProtocolConstants.CMD_STREAM_END) {
            ended = true;
            return null;
        }
        PieceStoreException error = ProtocolUtil.mapStatusToException(frame.getStatus(),
                ProtocolUtil.decodeError(frame.getBody()));
        if (error != null) {
            throw error;
        }
        if (frame.getCmd() != requestCmd) {
            throw new SequencingException("unexpected command " + frame.getCmd() + " in stream of " + requestCmd);
        }
        return decoder.decode(frame.getBody());
    }
    
    @Override
    public void send(O message) throws PieceStoreException {
        connection.sendMessage(message);
    }
}
