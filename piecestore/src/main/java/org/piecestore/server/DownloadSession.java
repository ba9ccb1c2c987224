package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.SequencingException;
import org.piecestore.exception.SessionCancelledException;
import org.piecestore.orders.OrderLimit;
import org.piecestore.protocol.PieceDownloadRequest;
import org.piecestore.protocol.PieceDownloadResponse;
import org.piecestore.storage.PieceHeader;
import org.piecestore.storage.PieceKey;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceReader;
import org.piecestore.storage.PieceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State machine for one download.
 * 
 * The first message carries the order limit and the first chunk request.
 * The node answers with the piece's uplink-signed hash and original order
 * limit, then streams the requested ranges while the bytes sent stay within
 * the amount ordered so far. The session ends when the downloader closes
 * its side of the stream.
 */
public class DownloadSession {
    
    private static final Logger logger = LoggerFactory.getLogger(DownloadSession.class);
    
    private final PieceStore store;
    private final PieceLocks locks;
    private final OrderLimitVerifier verifier;
    private final int maxChunkSize;
    
    private volatile SessionState state = SessionState.IDLE;
    private volatile boolean cancelled;
    
    private OrderLimit limit;
    private PublicKey uplinkKey;
    private final Deque<long[]> pending = new ArrayDeque<>();
    private long requested;
    private long allowance;
    private long sent;
    
    public DownloadSession(PieceStore store, PieceLocks locks, OrderLimitVerifier verifier, int maxChunkSize) {
        this.store = store;
        this.locks = locks;
        this.verifier = verifier;
        this.maxChunkSize = maxChunkSize;
    }
    
    /**
     * Runs the session to completion over the given stream.
     * 
     * @return number of payload bytes sent
     */
    public long run(MessageStream<PieceDownloadRequest, PieceDownloadResponse> stream) throws PieceStoreException {
        if (state != SessionState.IDLE) {
            throw new SequencingException("download session already used");
        }
        state = SessionState.AWAITING_LIMIT;
        try {
            execute(stream);
            state = SessionState.DONE;
            return sent;
        } catch (PieceStoreException | RuntimeException e) {
            state = SessionState.FAILED;
            throw e;
        }
    }
    
    private void execute(MessageStream<PieceDownloadRequest, PieceDownloadResponse> stream)
            throws PieceStoreException {
        PieceDownloadRequest first = stream.receive();
        if (first == null) {
            throw new InvalidArgumentException("stream ended before order limit");
        }
        if (first.getLimit() == null || first.getChunk() == null) {
            throw new InvalidArgumentException("expected order limit and chunk as the first message");
        }
        OrderLimit candidate = first.getLimit();
        if (!candidate.getAction().isDownload()) {
            throw new AuthorizationException("expected get or get repair or audit action got " + candidate.getAction());
        }
        verifier.verifyOrderLimit(candidate);
        uplinkKey = verifier.uplinkKey(candidate);
        limit = candidate;
        
        PieceKey key = new PieceKey(limit.getSatelliteId(), limit.getPieceId());
        try (PieceLocks.Handle busy = locks.acquire(key);
             PieceReader reader = store.reader(limit.getSatelliteId(), limit.getPieceId())) {
            state = SessionState.ACTIVE;
            
            accept(first, reader);
            PieceHeader header = reader.readHeader();
            stream.send(PieceDownloadResponse.ofHash(header.toUplinkHash(reader.size()), header.getOrderLimit()));
            
            while (true) {
                checkCancelled();
                if (!pending.isEmpty() && sent < allowance) {
                    sendNextChunk(stream, reader);
                    continue;
                }
                PieceDownloadRequest message = stream.receive();
                if (message == null) {
                    break;
                }
                if (message.getLimit() != null) {
                    throw new SequencingException("order limit already received");
                }
                accept(message, reader);
            }
            
            logger.info("Downloaded {} bytes of piece {} for satellite {}",
                    sent, limit.getPieceId(), limit.getSatelliteId());
        }
    }
    
    private void accept(PieceDownloadRequest message, PieceReader reader) throws PieceStoreException {
        if (message.getOrder() != null) {
            verifier.verifyOrder(limit, uplinkKey, message.getOrder(), allowance);
            allowance = message.getOrder().getAmount();
        }
        PieceDownloadRequest.Chunk chunk = message.getChunk();
        if (chunk != null) {
            if (chunk.getOffset() < 0 || chunk.getChunkSize() <= 0) {
                throw new InvalidArgumentException("invalid chunk request offset=" + chunk.getOffset()
                        + " size=" + chunk.getChunkSize());
            }
            if (chunk.getOffset() > reader.size() || chunk.getChunkSize() > reader.size() - chunk.getOffset()) {
                throw new InvalidArgumentException("requested more data than available, offset="
                        + chunk.getOffset() + " size=" + chunk.getChunkSize() + " available=" + reader.size());
            }
            if (chunk.getChunkSize() > limit.getLimit() - requested) {
                throw new AuthorizationException("requested more that order limit allows, limit="
                        + limit.getLimit() + " already requested=" + requested + " size=" + chunk.getChunkSize());
            }
            requested += chunk.getChunkSize();
            pending.addLast(new long[]{chunk.getOffset(), chunk.getChunkSize()});
        }
    }
    
    private void sendNextChunk(MessageStream<PieceDownloadRequest, PieceDownloadResponse> stream,
                               PieceReader reader) throws PieceStoreException {
        long[] range = pending.peekFirst();
        long size = Math.min(Math.min(range[1], maxChunkSize), allowance - sent);
        byte[] data = reader.read(range[0], (int) size);
        stream.send(PieceDownloadResponse.ofChunk(range[0], data));
        sent += size;
        range[0] += size;
        range[1] -= size;
        if (range[1] == 0) {
            pending.removeFirst();
        }
    }
    
    private void checkCancelled() throws SessionCancelledException {
        if (cancelled) {
            throw new SessionCancelledException("download cancelled");
        }
    }
    
    /**
     * Requests cancellation. No further bytes are sent and the piece is released.
     */
    public void cancel() {
        cancelled = true;
    }
    
    public SessionState getState() {
        return state;
    }
}
