package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.IntegrityException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.SequencingException;
import org.piecestore.exception.SessionCancelledException;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.storage.PieceHeader;
import org.piecestore.storage.PieceKey;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceStore;
import org.piecestore.storage.PieceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.time.Clock;

/**
 * State machine for one upload.
 * 
 * Data is appended to a piece writer as chunks arrive and only becomes
 * visible once the uplink's signed hash matches what was received. Any
 * failure, including the uplink going away, discards the partial piece.
 */
public class UploadSession {
    
    private static final Logger logger = LoggerFactory.getLogger(UploadSession.class);
    
    private final NodeIdentity identity;
    private final PieceStore store;
    private final PieceLocks locks;
    private final OrderLimitVerifier verifier;
    private final Clock clock;
    
    private volatile SessionState state = SessionState.IDLE;
    private volatile boolean cancelled;
    
    private OrderLimit limit;
    private PublicKey uplinkKey;
    private PieceHashAlgorithm hashAlgorithm;
    private long largestOrderAmount;
    
    public UploadSession(NodeIdentity identity, PieceStore store, PieceLocks locks,
                         OrderLimitVerifier verifier, Clock clock) {
        this.identity = identity;
        this.store = store;
        this.locks = locks;
        this.verifier = verifier;
        this.clock = clock;
    }
    
    /**
     * Runs the session to completion over the given stream.
     * 
     * @return the hash signed by this node, as sent to the uplink
     */
    public PieceHash run(MessageStream<PieceUploadRequest, PieceUploadResponse> stream)
            throws PieceStoreException {
        if (state != SessionState.IDLE) {
            throw new SequencingException("upload session already used");
        }
        state = SessionState.AWAITING_LIMIT;
        try {
            PieceHash result = execute(stream);
            state = SessionState.DONE;
            return result;
        } catch (PieceStoreException | RuntimeException e) {
            state = SessionState.FAILED;
            throw e;
        }
    }
    
    private PieceHash execute(MessageStream<PieceUploadRequest, PieceUploadResponse> stream)
            throws PieceStoreException {
        PieceUploadRequest first = stream.receive();
        if (first == null) {
            throw new InvalidArgumentException("stream ended before order limit");
        }
        if (first.getLimit() == null) {
            throw new InvalidArgumentException("expected order limit as the first message");
        }
        acceptLimit(first);
        
        PieceKey key = new PieceKey(limit.getSatelliteId(), limit.getPieceId());
        if (store.exists(limit.getSatelliteId(), limit.getPieceId())) {
            throw new InvalidArgumentException("piece " + limit.getPieceId() + " already exists");
        }
        try (PieceLocks.Handle busy = locks.acquire(key);
             PieceWriter writer = store.writer(limit.getSatelliteId(), limit.getPieceId(), hashAlgorithm)) {
            state = SessionState.ACTIVE;
            
            // the first message may already carry an order or a chunk
            PieceUploadRequest message = first;
            boolean firstMessage = true;
            while (true) {
                checkCancelled();
                if (!firstMessage) {
                    message = stream.receive();
                    if (message == null) {
                        throw new SequencingException("unexpected EOF before piece hash");
                    }
                    if (message.getLimit() != null) {
                        throw new SequencingException("order limit already received");
                    }
                }
                firstMessage = false;
                
                if (message.getOrder() != null) {
                    verifier.verifyOrder(limit, uplinkKey, message.getOrder(), largestOrderAmount);
                    largestOrderAmount = message.getOrder().getAmount();
                }
                if (message.getChunk() != null) {
                    acceptChunk(writer, message.getChunk());
                }
                if (message.getDone() != null) {
                    state = SessionState.FINALIZING;
                    PieceHash response = finish(writer, message.getDone());
                    stream.send(new PieceUploadResponse(response));
                    logger.info("Uploaded piece {} ({} bytes) for satellite {}",
                            limit.getPieceId(), writer.size(), limit.getSatelliteId());
                    return response;
                }
            }
        }
    }
    
    private void acceptLimit(PieceUploadRequest first) throws PieceStoreException {
        OrderLimit candidate = first.getLimit();
        if (!candidate.getAction().isUpload()) {
            throw new AuthorizationException("expected put or put repair action got " + candidate.getAction());
        }
        verifier.verifyOrderLimit(candidate);
        this.uplinkKey = verifier.uplinkKey(candidate);
        this.limit = candidate;
        this.hashAlgorithm = first.getHashAlgorithm() == null
                ? PieceHashAlgorithm.SHA256 : first.getHashAlgorithm();
        logger.debug("Upload of piece {} started, limit {} bytes, {}",
                limit.getPieceId(), limit.getLimit(), hashAlgorithm);
    }
    
    private void acceptChunk(PieceWriter writer, PieceUploadRequest.Chunk chunk) throws PieceStoreException {
        if (chunk.getOffset() != writer.size()) {
            throw new SequencingException("chunk out of order: expected offset " + writer.size()
                    + " got " + chunk.getOffset());
        }
        long newSize = writer.size() + chunk.getData().length;
        if (newSize > limit.getLimit()) {
            throw new AuthorizationException("chunk exceeds order limit of " + limit.getLimit() + " bytes");
        }
        if (largestOrderAmount < newSize) {
            throw new AuthorizationException("not enough allocated, allocated=" + largestOrderAmount
                    + " writing=" + newSize);
        }
        writer.write(chunk.getData());
    }
    
    private PieceHash finish(PieceWriter writer, PieceHash uplinkHash) throws PieceStoreException {
        byte[] calculatedHash = writer.hash();
        try {
            verifier.verifyPieceHash(limit, uplinkKey, uplinkHash, calculatedHash, writer.size());
            if (uplinkHash.getHashAlgorithm() != hashAlgorithm) {
                throw new IntegrityException("hash algorithm " + uplinkHash.getHashAlgorithm()
                        + " doesn't match session algorithm " + hashAlgorithm);
            }
        } catch (IntegrityException e) {
            logger.error("Integrity failure uploading piece {} for satellite {}: {}",
                    limit.getPieceId(), limit.getSatelliteId(), e.getMessage());
            throw e;
        }
        
        writer.commit(PieceHeader.fromUplinkHash(uplinkHash, limit));
        
        PieceHash nodeHash = new PieceHash(limit.getPieceId(), calculatedHash, writer.size(),
                clock.instant(), hashAlgorithm);
        return Signing.signPieceHash(identity.getPrivateKey(), nodeHash);
    }
    
    private void checkCancelled() throws SessionCancelledException {
        if (cancelled) {
            throw new SessionCancelledException("upload cancelled");
        }
    }
    
    /**
     * Requests cancellation. The session fails at its next step and discards
     * the partial piece.
     */
    public void cancel() {
        cancelled = true;
    }
    
    public SessionState getState() {
        return state;
    }
}
