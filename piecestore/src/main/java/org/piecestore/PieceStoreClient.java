package org.piecestore;

import org.piecestore.config.ClientConfig;
import org.piecestore.connection.Connection;
import org.piecestore.connection.ConnectionPool;
import org.piecestore.connection.Frame;
import org.piecestore.exception.ClientClosedException;
import org.piecestore.exception.IntegrityException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.NetworkException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.ProtocolException;
import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.orders.PieceHasher;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.DeletePiecesRequest;
import org.piecestore.protocol.DeletePiecesResponse;
import org.piecestore.protocol.EmptyMessage;
import org.piecestore.protocol.Message;
import org.piecestore.protocol.PieceDeleteRequest;
import org.piecestore.protocol.PieceDownloadRequest;
import org.piecestore.protocol.PieceDownloadResponse;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.protocol.ProtocolConstants;
import org.piecestore.protocol.ProtocolUtil;
import org.piecestore.protocol.RetainRequest;
import org.piecestore.storage.BloomFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.security.InvalidKeyException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client for the piece store protocol of storage nodes.
 * 
 * Uplinks use it to upload and download pieces under order limits issued by
 * a satellite; satellites use it for the administrative calls
 * (DeletePieces, Retain, RestoreTrash). Connections are pooled per storage
 * node and prove this client's node ID once, when they are opened.
 * 
 * Example usage:
 * <pre>
 * ClientConfig config = new ClientConfig();
 * config.setUploadChunkSize(64 * 1024);
 * 
 * PieceStoreClient client = new PieceStoreClient(config, uplinkIdentity);
 * try {
 *     PieceHash stored = client.upload("10.0.0.5:28967", putLimit, piecePrivateKey, data, PieceHashAlgorithm.SHA256);
 *     byte[] read = client.download("10.0.0.5:28967", getLimit, piecePrivateKey, 0, data.length);
 * } finally {
 *     client.close();
 * }
 * </pre>
 * 
 * Uploads and downloads are never retried: the caller needs a fresh order
 * limit for a new attempt. Administrative calls are idempotent and retried
 * up to {@link ClientConfig#getRetryCount()} times.
 */
public class PieceStoreClient implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PieceStoreClient.class);
    
    private final ClientConfig config;
    private final NodeIdentity self;
    private final ConnectionPool pool;
    private final AtomicBoolean closed;
    
    /**
     * Creates a new client.
     * 
     * @param config Client configuration
     * @param self Identity whose node ID is proven to storage nodes
     * @throws InvalidArgumentException if configuration is invalid
     */
    public PieceStoreClient(ClientConfig config, NodeIdentity self) throws InvalidArgumentException {
        validateConfig(config);
        if (self == null) {
            throw new InvalidArgumentException("Node identity is required");
        }
        
        this.config = config;
        this.self = self;
        this.closed = new AtomicBoolean(false);
        this.pool = new ConnectionPool(config, self);
        
        logger.info("Piece store client {} initialized with config: {}", self.getId(), config);
    }
    
    private void validateConfig(ClientConfig config) throws InvalidArgumentException {
        if (config == null) {
            throw new InvalidArgumentException("Config is required");
        }
        if (config.getMaxConns() <= 0) {
            throw new InvalidArgumentException("maxConns must be positive");
        }
        if (config.getConnectTimeout() <= 0 || config.getNetworkTimeout() <= 0 || config.getIdleTimeout() <= 0) {
            throw new InvalidArgumentException("Timeouts must be positive");
        }
        if (config.getRetryCount() < 1) {
            throw new InvalidArgumentException("retryCount must be at least 1");
        }
        if (config.getRetryBackoff() < 0) {
            throw new InvalidArgumentException("retryBackoff must not be negative");
        }
        if (config.getHashAlgorithm() == null) {
            throw new InvalidArgumentException("hashAlgorithm is required");
        }
        if (config.getUploadChunkSize() <= 0
                || config.getUploadChunkSize() > ProtocolConstants.MAX_FRAME_BODY_LEN / 2) {
            throw new InvalidArgumentException("Invalid upload chunk size: " + config.getUploadChunkSize());
        }
    }
    
    private void checkClosed() throws ClientClosedException {
        if (closed.get()) {
            throw new ClientClosedException();
        }
    }
    
    private static void checkAddr(String addr) throws InvalidArgumentException {
        if (addr == null || addr.isEmpty() || !addr.contains(":")) {
            throw new InvalidArgumentException("Invalid storage node address: " + addr);
        }
    }
    
    /**
     * Uploads a piece.
     * 
     * @param addr Storage node address "host:port"
     * @param limit Order limit for a PUT action, signed by the satellite
     * @param piecePrivateKey Private key matching the limit's uplink public key
     * @param data Piece content
     * @param hashAlgorithm Algorithm for the piece hash, or null for the configured default
     * @return The piece hash signed by the storage node
     */
    public PieceHash upload(String addr, OrderLimit limit, PrivateKey piecePrivateKey, byte[] data,
                            PieceHashAlgorithm hashAlgorithm) throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        if (limit == null || piecePrivateKey == null || data == null) {
            throw new InvalidArgumentException("Order limit, key and data are required");
        }
        if (data.length > limit.getLimit()) {
            throw new InvalidArgumentException("Piece of " + data.length + " bytes exceeds order limit of "
                    + limit.getLimit());
        }
        PieceHashAlgorithm algorithm = hashAlgorithm == null ? config.getHashAlgorithm() : hashAlgorithm;
        
        Connection conn = connect(addr);
        boolean ok = false;
        try {
            try {
                conn.sendMessage(PieceUploadRequest.ofLimit(limit, algorithm));
                int chunkSize = config.getUploadChunkSize();
                for (int offset = 0; offset < data.length; offset += chunkSize) {
                    int end = Math.min(data.length, offset + chunkSize);
                    Order order = Signing.signUplinkOrder(piecePrivateKey, new Order(limit.getSerialNumber(), end));
                    conn.sendMessage(PieceUploadRequest.ofOrder(order));
                    conn.sendMessage(PieceUploadRequest.ofChunk(offset, Arrays.copyOfRange(data, offset, end)));
                }
                
                PieceHash uplinkHash = new PieceHash(limit.getPieceId(), PieceHasher.hash(algorithm, data),
                        data.length, Instant.now(), algorithm);
                conn.sendMessage(PieceUploadRequest.ofDone(Signing.signPieceHash(piecePrivateKey, uplinkHash)));
            } catch (NetworkException e) {
                throw serverErrorOr(conn, ProtocolConstants.CMD_UPLOAD_RESPONSE, e);
            }
            
            Frame frame = receiveResponse(conn, ProtocolConstants.CMD_UPLOAD_RESPONSE);
            PieceHash stored = PieceUploadResponse.decode(frame.getBody()).getDone();
            if (stored == null || !Arrays.equals(stored.getHash(), PieceHasher.hash(algorithm, data))) {
                throw new IntegrityException("storage node acknowledged a different piece hash");
            }
            ok = true;
            logger.info("Piece uploaded successfully: {} ({} bytes) to {}", limit.getPieceId(), data.length, addr);
            return stored;
        } finally {
            release(conn, ok);
        }
    }
    
    /**
     * Downloads a range of a piece.
     * 
     * The storage node's copy of the uplink-signed piece hash is verified;
     * when the whole piece is requested the content is checked against it.
     * 
     * @param addr Storage node address "host:port"
     * @param limit Order limit for a GET action, signed by the satellite
     * @param piecePrivateKey Private key matching the limit's uplink public key
     * @param offset Offset of the first byte
     * @param size Number of bytes to read
     * @return The requested bytes
     */
    public byte[] download(String addr, OrderLimit limit, PrivateKey piecePrivateKey, long offset, int size)
            throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        if (limit == null || piecePrivateKey == null) {
            throw new InvalidArgumentException("Order limit and key are required");
        }
        if (offset < 0 || size <= 0) {
            throw new InvalidArgumentException("Invalid range offset=" + offset + " size=" + size);
        }
        
        Connection conn = connect(addr);
        boolean ok = false;
        try {
            try {
                conn.sendMessage(PieceDownloadRequest.ofLimit(limit, offset, size));
                Order order = Signing.signUplinkOrder(piecePrivateKey, new Order(limit.getSerialNumber(), size));
                conn.sendMessage(PieceDownloadRequest.ofOrder(order));
            } catch (NetworkException e) {
                throw serverErrorOr(conn, ProtocolConstants.CMD_DOWNLOAD_RESPONSE, e);
            }
            
            PieceDownloadResponse first = PieceDownloadResponse.decode(
                    receiveResponse(conn, ProtocolConstants.CMD_DOWNLOAD_RESPONSE).getBody());
            PieceHash pieceHash = first.getHash();
            verifyPieceHash(limit, pieceHash, first.getLimit());
            
            byte[] data = new byte[size];
            int received = 0;
            while (received < size) {
                PieceDownloadResponse response = PieceDownloadResponse.decode(
                        receiveResponse(conn, ProtocolConstants.CMD_DOWNLOAD_RESPONSE).getBody());
                PieceDownloadResponse.Chunk chunk = response.getChunk();
                if (chunk == null) {
                    throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR, "expected piece data");
                }
                long position = chunk.getOffset() - offset;
                if (position < 0 || position + chunk.getData().length > size) {
                    throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR,
                            "chunk at offset " + chunk.getOffset() + " outside requested range");
                }
                System.arraycopy(chunk.getData(), 0, data, (int) position, chunk.getData().length);
                received += chunk.getData().length;
            }
            conn.sendCommand(ProtocolConstants.CMD_STREAM_END);
            
            if (offset == 0 && size == pieceHash.getPieceSize()
                    && !Arrays.equals(PieceHasher.hash(pieceHash.getHashAlgorithm(), data), pieceHash.getHash())) {
                throw new IntegrityException("downloaded data doesn't match piece hash");
            }
            ok = true;
            logger.info("Piece downloaded successfully: {} ({} bytes) from {}", limit.getPieceId(), size, addr);
            return data;
        } finally {
            release(conn, ok);
        }
    }
    
    private void verifyPieceHash(OrderLimit limit, PieceHash pieceHash, OrderLimit originalLimit)
            throws IntegrityException {
        if (pieceHash == null || originalLimit == null) {
            throw new IntegrityException("storage node sent no piece hash");
        }
        if (pieceHash.getPieceId() == null || !pieceHash.getPieceId().equals(limit.getPieceId())) {
            throw new IntegrityException("piece hash is for piece " + pieceHash.getPieceId());
        }
        PublicKey uploaderKey;
        try {
            uploaderKey = Signing.decodePublicKey(originalLimit.getUplinkPublicKey());
        } catch (InvalidKeyException e) {
            throw new IntegrityException("original order limit has no valid uplink key", e);
        }
        if (!Signing.verifyPieceHashSignature(uploaderKey, pieceHash)) {
            throw new IntegrityException("invalid piece hash signature");
        }
    }
    
    /**
     * Deletes one piece under a DELETE order limit.
     * 
     * @deprecated satellites delete in batches with {@link #deletePieces(String, List)}
     */
    @Deprecated
    public void delete(String addr, OrderLimit limit) throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        if (limit == null) {
            throw new InvalidArgumentException("Order limit is required");
        }
        unary(addr, new PieceDeleteRequest(limit), ProtocolConstants.CMD_DELETE_RESPONSE);
        logger.info("Piece deleted successfully: {}", limit.getPieceId());
    }
    
    /**
     * Deletes pieces from this satellite's namespace on the storage node.
     * 
     * @return number of pieces the node failed to delete
     */
    public long deletePieces(String addr, List<PieceID> pieceIds) throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        if (pieceIds == null) {
            throw new InvalidArgumentException("Piece IDs are required");
        }
        DeletePiecesRequest request = new DeletePiecesRequest(pieceIds);
        int retryCount = config.getRetryCount();
        PieceStoreException lastException = null;
        
        for (int attempt = 0; attempt < retryCount; attempt++) {
            try {
                byte[] body = unary(addr, request, ProtocolConstants.CMD_DELETE_PIECES_RESPONSE);
                return DeletePiecesResponse.decode(body).getUnhandledCount();
            } catch (NetworkException e) {
                lastException = e;
                backoff("DeletePieces", attempt, e);
            }
        }
        throw lastException;
    }
    
    /**
     * Asks the storage node to trash this satellite's pieces created before
     * the given time that are not in the filter.
     */
    public void retain(String addr, Instant createdBefore, BloomFilter filter) throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        if (createdBefore == null || filter == null) {
            throw new InvalidArgumentException("Creation date and filter are required");
        }
        RetainRequest request = new RetainRequest(createdBefore, filter.toBytes());
        unaryWithRetry("Retain", addr, request, ProtocolConstants.CMD_RETAIN_RESPONSE);
    }
    
    /**
     * Asks the storage node to restore this satellite's trashed pieces.
     */
    public void restoreTrash(String addr) throws PieceStoreException {
        checkClosed();
        checkAddr(addr);
        unaryWithRetry("RestoreTrash", addr, EmptyMessage.restoreTrashRequest(),
                ProtocolConstants.CMD_RESTORE_TRASH_RESPONSE);
    }
    
    private void unaryWithRetry(String name, String addr, Message request, byte responseCmd)
            throws PieceStoreException {
        int retryCount = config.getRetryCount();
        PieceStoreException lastException = null;
        
        for (int attempt = 0; attempt < retryCount; attempt++) {
            try {
                unary(addr, request, responseCmd);
                return;
            } catch (NetworkException e) {
                lastException = e;
                backoff(name, attempt, e);
            }
        }
        throw lastException;
    }
    
    private void backoff(String name, int attempt, NetworkException e) throws PieceStoreException {
        if (attempt < config.getRetryCount() - 1) {
            logger.warn("{} attempt {} failed, retrying...", name, attempt + 1, e);
            try {
                Thread.sleep((attempt + 1) * config.getRetryBackoff());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new PieceStoreException(name + " interrupted", ie);
            }
        }
    }
    
    private byte[] unary(String addr, Message request, byte responseCmd) throws PieceStoreException {
        Connection conn = connect(addr);
        boolean ok = false;
        try {
            try {
                conn.sendMessage(request);
            } catch (NetworkException e) {
                throw serverErrorOr(conn, responseCmd, e);
            }
            byte[] body = receiveResponse(conn, responseCmd).getBody();
            ok = true;
            return body;
        } finally {
            release(conn, ok);
        }
    }
    
    private Connection connect(String addr) throws PieceStoreException {
        return pool.acquire(addr);
    }
    
    private void release(Connection conn, boolean ok) {
        if (ok) {
            pool.release(conn);
        } else {
            conn.close();
        }
    }
    
    /**
     * Receives the response frame, raising the error a storage node reported.
     */
    private Frame receiveResponse(Connection conn, byte expectedCmd) throws PieceStoreException {
        Frame frame = conn.receiveFrame();
        if (frame == null) {
            throw new NetworkException("receive", conn.getAddr(), new EOFException("Connection closed by storage node"));
        }
        PieceStoreException error = ProtocolUtil.mapStatusToException(frame.getStatus(),
                ProtocolUtil.decodeError(frame.getBody()));
        if (error != null) {
            throw error;
        }
        if (frame.getCmd() != expectedCmd) {
            throw new ProtocolException(ProtocolConstants.STATUS_PROTOCOL_ERROR,
                    "unexpected response command " + frame.getCmd() + ", expected " + expectedCmd);
        }
        return frame;
    }
    
    /**
     * A storage node rejecting a stream closes the connection after an error
     * frame, so a failed send usually has a better explanation waiting.
     */
    private PieceStoreException serverErrorOr(Connection conn, byte expectedCmd, NetworkException sendFailure) {
        try {
            receiveResponse(conn, expectedCmd);
        } catch (NetworkException e) {
            return sendFailure;
        } catch (PieceStoreException e) {
            return e;
        }
        return sendFailure;
    }
    
    public NodeID getNodeId() {
        return self.getId();
    }
    
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Closing piece store client");
            pool.close();
            logger.info("Piece store client closed");
        }
    }
}
