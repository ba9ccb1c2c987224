package org.piecestore.connection;

import org.piecestore.exception.ConnectionTimeoutException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.NetworkException;
import org.piecestore.protocol.Message;
import org.piecestore.protocol.ProtocolConstants;
import org.piecestore.protocol.ProtocolHeader;
import org.piecestore.protocol.ProtocolUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * A framed connection between an uplink or satellite and a storage node.
 * 
 * Used on both ends: clients dial out with {@link #Connection(String, int, int)},
 * the server wraps accepted sockets with {@link #Connection(Socket, int)}.
 */
public class Connection implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(Connection.class);
    
    private final String addr;
    private final Socket socket;
    private final InputStream inputStream;
    private final OutputStream outputStream;
    private long lastActiveTime;
    
    /**
     * Creates a new connection to the specified address.
     * 
     * @param addr Server address in format "host:port"
     * @param connectTimeout Connection timeout in milliseconds
     * @param networkTimeout Timeout for each blocking read in milliseconds
     */
    public Connection(String addr, int connectTimeout, int networkTimeout)
            throws NetworkException {
        this.addr = addr;
        this.lastActiveTime = System.currentTimeMillis();
        
        String[] parts = addr.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid address format: " + addr);
        }
        
        String host = parts[0];
        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + addr);
        }
        
        try {
            socket = new Socket();
            socket.connect(new InetSocketAddress(host, port), connectTimeout);
            socket.setSoTimeout(networkTimeout);
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            
            inputStream = new BufferedInputStream(socket.getInputStream());
            outputStream = new BufferedOutputStream(socket.getOutputStream());
            
            logger.debug("Connected to {}", addr);
        } catch (SocketTimeoutException e) {
            throw new ConnectionTimeoutException(addr, e);
        } catch (IOException e) {
            throw new NetworkException("connect", addr, e);
        }
    }
    
    /**
     * Wraps a socket accepted by a server.
     * 
     * @param socket Accepted socket
     * @param streamTimeout Timeout for each blocking read in milliseconds
     */
    public Connection(Socket socket, int streamTimeout) throws NetworkException {
        this.socket = socket;
        this.addr = String.valueOf(socket.getRemoteSocketAddress());
        this.lastActiveTime = System.currentTimeMillis();
        try {
            socket.setSoTimeout(streamTimeout);
            socket.setTcpNoDelay(true);
            inputStream = new BufferedInputStream(socket.getInputStream());
            outputStream = new BufferedOutputStream(socket.getOutputStream());
        } catch (IOException e) {
            throw new NetworkException("accept", addr, e);
        }
    }
    
    /**
     * Sends a message as one frame with a success status.
     */
    public void sendMessage(Message message) throws NetworkException {
        byte[] body = message.encode();
        sendFrame(new ProtocolHeader(body.length, message.command(), ProtocolConstants.STATUS_SUCCESS), body);
    }
    
    /**
     * Sends an error frame. The body carries the error message.
     */
    public void sendError(byte cmd, byte status, String message) throws NetworkException {
        byte[] body = ProtocolUtil.encodeError(message);
        sendFrame(new ProtocolHeader(body.length, cmd, status), body);
    }
    
    /**
     * Sends a frame without a body, such as the end of an uplink stream.
     */
    public void sendCommand(byte cmd) throws NetworkException {
        sendFrame(new ProtocolHeader(0, cmd, ProtocolConstants.STATUS_SUCCESS), new byte[0]);
    }
    
    private void sendFrame(ProtocolHeader header, byte[] body) throws NetworkException {
        try {
            outputStream.write(header.encode());
            outputStream.write(body);
            outputStream.flush();
            lastActiveTime = System.currentTimeMillis();
        } catch (IOException e) {
            throw new NetworkException("send", addr, e);
        }
    }
    
    /**
     * Receives the next frame.
     * 
     * @return the frame, or null if the peer closed the connection cleanly between frames
     */
    public Frame receiveFrame() throws NetworkException, InvalidArgumentException {
        byte[] headerData = receive(ProtocolConstants.PROTO_HEADER_LEN, true);
        if (headerData == null) {
            return null;
        }
        ProtocolHeader header = ProtocolHeader.decode(headerData);
        byte[] body = receive((int) header.getLength(), false);
        return new Frame(header, body);
    }
    
    /**
     * Receives exactly the specified number of bytes.
     */
    private byte[] receive(int length, boolean allowCleanEof) throws NetworkException {
        if (length <= 0) {
            return new byte[0];
        }
        
        byte[] data = new byte[length];
        int totalRead = 0;
        
        try {
            while (totalRead < length) {
                int read = inputStream.read(data, totalRead, length - totalRead);
                if (read < 0) {
                    if (totalRead == 0 && allowCleanEof) {
                        return null;
                    }
                    throw new EOFException("Connection closed by peer");
                }
                totalRead += read;
            }
            
            lastActiveTime = System.currentTimeMillis();
            return data;
        } catch (IOException e) {
            throw new NetworkException("receive", addr, e);
        }
    }
    
    /**
     * Checks if the connection is idle for longer than the specified timeout.
     */
    public boolean isIdle(long idleTimeout) {
        return System.currentTimeMillis() - lastActiveTime > idleTimeout;
    }
    
    /**
     * Checks if the connection is still alive.
     */
    public boolean isAlive() {
        return socket != null && socket.isConnected() && !socket.isClosed();
    }
    
    
    public String getAddr() {
        return addr;
    }
    
    @Override
    public void close() {
        try {
            if (socket != null) {
                socket.close();
            }
        } catch (IOException e) {
            logger.warn("Error closing socket", e);
        }
        
        logger.debug("Closed connection to {}", addr);
    }
}
