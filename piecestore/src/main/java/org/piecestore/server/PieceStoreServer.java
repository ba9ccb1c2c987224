package org.piecestore.server;

import org.piecestore.connection.Connection;
import org.piecestore.connection.Frame;
import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.NetworkException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.ProtocolException;
import org.piecestore.identity.NodeID;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.Challenge;
import org.piecestore.protocol.DeletePiecesRequest;
import org.piecestore.protocol.Hello;
import org.piecestore.protocol.Message;
import org.piecestore.protocol.PieceDeleteRequest;
import org.piecestore.protocol.PieceDownloadRequest;
import org.piecestore.protocol.PieceDownloadResponse;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.protocol.ProtocolConstants;
import org.piecestore.protocol.ProtocolUtil;
import org.piecestore.protocol.RetainRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP transport for an {@link Endpoint}.
 * 
 * Each connection starts with a handshake: the node sends a CHALLENGE nonce,
 * the caller answers with a HELLO signed by the key behind its node ID, and
 * the node acknowledges. Any number of RPCs follow, one at a time. A failed RPC is answered with an error
 * frame and the connection is closed.
 */
public class PieceStoreServer implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PieceStoreServer.class);
    
    private final Endpoint endpoint;
    private final int port;
    private final int streamTimeout;
    private final ExecutorService workers;
    private final Set<Connection> connections = ConcurrentHashMap.newKeySet();
    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean closed;
    
    public PieceStoreServer(Endpoint endpoint, int port, int workerThreads, int streamTimeout) {
        this.endpoint = endpoint;
        this.port = port;
        this.streamTimeout = streamTimeout;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread thread = new Thread(r, "piecestore-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
    
    /**
     * Binds the listen socket and starts accepting connections.
     */
    public synchronized void start() throws IOException {
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(port));
        acceptThread = new Thread(this::acceptLoop, "piecestore-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        logger.info("Storage node {} listening on port {}", endpoint.getNodeId(), getPort());
    }
    
    /**
     * The bound port, useful when started on port 0.
     */
    public int getPort() {
        return serverSocket == null ? port : serverSocket.getLocalPort();
    }
    
    private void acceptLoop() {
        while (!closed) {
            try {
                Socket socket = serverSocket.accept();
                workers.execute(() -> serve(socket));
            } catch (SocketException e) {
                if (!closed) {
                    logger.error("Accept failed", e);
                }
                return;
            } catch (IOException e) {
                logger.warn("Accept failed: {}", e.getMessage());
            }
        }
    }
    
    private void serve(Socket socket) {
        Connection connection;
        try {
            connection = new Connection(socket, streamTimeout);
        } catch (NetworkException e) {
            logger.warn("Dropping connection: {}", e.getMessage());
            closeQuietly(socket);
            return;
        }
        
        connections.add(connection);
        byte responseCmd = ProtocolConstants.CMD_HELLO_RESPONSE;
        try {
            NodeID caller = handshake(connection);
            if (caller == null) {
                return;
            }
            logger.debug("Connection from {} as {}", connection.getAddr(), caller);
            
            while (!closed) {
                Frame frame = connection.receiveFrame();
                if (frame == null) {
                    break;
                }
                responseCmd = (byte) (frame.getCmd() + 1);
                dispatch(connection, caller, frame);
            }
        } catch (PieceStoreException e) {
            reportError(connection, responseCmd, e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error serving {}", connection.getAddr(), e);
            reportError(connection, responseCmd, new ProtocolException(ProtocolConstants.STATUS_IO_ERROR,
                    "internal error"));
        } finally {
            connections.remove(connection);
            connection.close();
        }
    }
    
    /**
     * Challenges the caller to sign a fresh nonce and returns the node ID it
     * proved, or null if the caller hung up first.
     */
    private NodeID handshake(Connection connection) throws PieceStoreException {
        Challenge challenge = Challenge.generate();
        connection.sendMessage(challenge);
        Frame frame = connection.receiveFrame();
        if (frame == null) {
            return null;
        }
        if (frame.getCmd() != ProtocolConstants.CMD_HELLO) {
            throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR,
                    "expected HELLO, got command " + frame.getCmd());
        }
        Hello hello = Hello.decode(frame.getBody());
        if (!Signing.verifyHello(hello, challenge.getNonce())) {
            throw new AuthorizationException("hello from " + hello.getNodeId() + " failed verification");
        }
        connection.sendCommand(ProtocolConstants.CMD_HELLO_RESPONSE);
        return hello.getNodeId();
    }
    
    private void dispatch(Connection connection, NodeID caller, Frame frame) throws PieceStoreException {
        switch (frame.getCmd()) {
            case ProtocolConstants.CMD_UPLOAD_REQUEST:
                endpoint.upload(new ConnectionMessageStream<PieceUploadRequest, PieceUploadResponse>(
                        connection, ProtocolConstants.CMD_UPLOAD_REQUEST, PieceUploadRequest::decode, frame));
                break;
            case ProtocolConstants.CMD_DOWNLOAD_REQUEST:
                endpoint.download(new ConnectionMessageStream<PieceDownloadRequest, PieceDownloadResponse>(
                        connection, ProtocolConstants.CMD_DOWNLOAD_REQUEST, PieceDownloadRequest::decode, frame));
                break;
            case ProtocolConstants.CMD_DELETE_REQUEST:
                reply(connection, deleteLegacy(frame));
                break;
            case ProtocolConstants.CMD_DELETE_PIECES_REQUEST:
                reply(connection, endpoint.deletePieces(caller, DeletePiecesRequest.decode(frame.getBody())));
                break;
            case ProtocolConstants.CMD_RETAIN_REQUEST:
                reply(connection, endpoint.retain(caller, RetainRequest.decode(frame.getBody())));
                break;
            case ProtocolConstants.CMD_RESTORE_TRASH_REQUEST:
                reply(connection, endpoint.restoreTrash(caller));
                break;
            default:
                throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR,
                        "unknown command " + frame.getCmd());
        }
    }
    
    @SuppressWarnings("deprecation")
    private Message deleteLegacy(Frame frame) throws PieceStoreException {
        return endpoint.delete(PieceDeleteRequest.decode(frame.getBody()));
    }
    
    private void reply(Connection connection, Message response) throws NetworkException {
        connection.sendMessage(response);
    }
    
    private void reportError(Connection connection, byte responseCmd, PieceStoreException e) {
        if (e instanceof NetworkException) {
            logger.debug("Connection {} lost: {}", connection.getAddr(), e.getMessage());
            return;
        }
        if (e instanceof InvalidArgumentException) {
            logger.info("Rejected request from {}: {}", connection.getAddr(), e.getMessage());
        } else {
            logger.warn("Request from {} failed: {}", connection.getAddr(), e.getMessage());
        }
        try {
            connection.sendError(responseCmd, ProtocolUtil.mapExceptionToStatus(e), e.getMessage());
        } catch (NetworkException sendFailure) {
            logger.debug("Could not report error to {}: {}", connection.getAddr(), sendFailure.getMessage());
        }
    }
    
    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket", e);
        }
    }
    
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        endpoint.cancelAll();
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.warn("Error closing server socket", e);
            }
        }
        for (Connection connection : connections) {
            connection.close();
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Storage node stopped");
    }
}
