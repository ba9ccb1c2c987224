package org.piecestore.connection;

import org.piecestore.config.ClientConfig;
import org.piecestore.exception.ClientClosedException;
import org.piecestore.exception.NetworkException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.ProtocolException;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.Challenge;
import org.piecestore.protocol.Hello;
import org.piecestore.protocol.ProtocolConstants;
import org.piecestore.protocol.ProtocolUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Idle connections to storage nodes, keyed by address.
 * 
 * Every connection handed out has completed the handshake, proving the
 * owner's node ID to the storage node, so callers can send requests right away. A storage node drops connections
 * that stay silent longer than its stream timeout, so connections idle past
 * the configured idle timeout are closed rather than reused.
 */
public class ConnectionPool {
    
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);
    
    private final ClientConfig config;
    private final NodeIdentity self;
    private final Map<String, Deque<Connection>> idle = new HashMap<>();
    private boolean closed;
    
    /**
     * @param config Timeouts and the number of idle connections kept per storage node
     * @param self Identity proven on every new connection
     */
    public ConnectionPool(ClientConfig config, NodeIdentity self) {
        this.config = config;
        this.self = self;
    }
    
    /**
     * Takes an idle connection to the storage node, or dials a new one.
     */
    public Connection acquire(String addr) throws PieceStoreException {
        Connection conn;
        while ((conn = pollIdle(addr)) != null) {
            if (conn.isAlive() && !conn.isIdle(config.getIdleTimeout())) {
                logger.debug("Reusing connection to {}", addr);
                return conn;
            }
            logger.debug("Closing stale connection to {}", addr);
            conn.close();
        }
        return dial(addr);
    }
    
    private synchronized Connection pollIdle(String addr) throws ClientClosedException {
        if (closed) {
            throw new ClientClosedException();
        }
        Deque<Connection> queue = idle.get(addr);
        return queue == null ? null : queue.pollFirst();
    }
    
    private Connection dial(String addr) throws PieceStoreException {
        Connection conn = new Connection(addr, config.getConnectTimeout(), config.getNetworkTimeout());
        try {
            Challenge challenge = Challenge.decode(expect(conn, ProtocolConstants.CMD_CHALLENGE).getBody());
            Hello hello = new Hello(self.getId(), Signing.encodePublicKey(self.getPublicKey()), challenge.getNonce());
            conn.sendMessage(Signing.signHello(self, hello));
            expect(conn, ProtocolConstants.CMD_HELLO_RESPONSE);
        } catch (PieceStoreException e) {
            conn.close();
            throw e;
        }
        logger.debug("Connected to storage node {} as {}", addr, self.getId());
        return conn;
    }
    
    private static Frame expect(Connection conn, byte cmd) throws PieceStoreException {
        Frame frame = conn.receiveFrame();
        if (frame == null) {
            throw new NetworkException("handshake", conn.getAddr(), new EOFException("Connection closed by storage node"));
        }
        PieceStoreException error = ProtocolUtil.mapStatusToException(frame.getStatus(),
                ProtocolUtil.decodeError(frame.getBody()));
        if (error != null) {
            throw error;
        }
        if (frame.getCmd() != cmd) {
            throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR,
                    "unexpected handshake command " + frame.getCmd() + ", expected " + cmd);
        }
        return frame;
    }
    
    /**
     * Hands a connection back after a call that left it at a frame boundary.
     * Connections in any other state must be closed by the caller instead.
     */
    public void release(Connection conn) {
        if (!conn.isAlive()) {
            return;
        }
        synchronized (this) {
            if (!closed) {
                Deque<Connection> queue = idle.computeIfAbsent(conn.getAddr(), a -> new ArrayDeque<>());
                if (queue.size() < config.getMaxConns()) {
                    queue.addFirst(conn);
                    return;
                }
            }
        }
        logger.debug("Not keeping connection to {}", conn.getAddr());
        conn.close();
    }
    
    /**
     * Number of idle connections kept for the storage node.
     */
    public synchronized int idleCount(String addr) {
        Deque<Connection> queue = idle.get(addr);
        return queue == null ? 0 : queue.size();
    }
    
    /**
     * Closes every idle connection. Connections in use are closed when released.
     */
    public void close() {
        Map<String, Deque<Connection>> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new HashMap<>(idle);
            idle.clear();
        }
        int count = 0;
        for (Deque<Connection> queue : toClose.values()) {
            for (Connection conn : queue) {
                conn.close();
                count++;
            }
        }
        logger.info("Connection pool closed, {} idle connections dropped", count);
    }
}
