package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceNotFoundException;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceAction;
import org.piecestore.orders.PieceHash;
import org.piecestore.protocol.DeletePiecesRequest;
import org.piecestore.protocol.DeletePiecesResponse;
import org.piecestore.protocol.EmptyMessage;
import org.piecestore.protocol.PieceDeleteRequest;
import org.piecestore.protocol.PieceDownloadRequest;
import org.piecestore.protocol.PieceDownloadResponse;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.protocol.RetainRequest;
import org.piecestore.storage.BloomFilter;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The piece store RPCs of a storage node, independent of the transport.
 * 
 * Each call is an independent unit of work and may run concurrently with
 * any other. Streaming calls are delegated to a fresh session per call.
 */
public class Endpoint {
    
    private static final Logger logger = LoggerFactory.getLogger(Endpoint.class);
    
    private final NodeIdentity identity;
    private final PieceStore store;
    private final PieceLocks locks;
    private final OrderLimitVerifier verifier;
    private final TrustedSatellites trustedSatellites;
    private final RetainService retainService;
    private final int maxDownloadChunkSize;
    private final Clock clock;
    private final Set<UploadSession> activeUploads = ConcurrentHashMap.newKeySet();
    private final Set<DownloadSession> activeDownloads = ConcurrentHashMap.newKeySet();
    
    public Endpoint(NodeIdentity identity, PieceStore store, PieceLocks locks, OrderLimitVerifier verifier,
                    TrustedSatellites trustedSatellites, RetainService retainService,
                    int maxDownloadChunkSize, Clock clock) {
        this.identity = identity;
        this.store = store;
        this.locks = locks;
        this.verifier = verifier;
        this.trustedSatellites = trustedSatellites;
        this.retainService = retainService;
        this.maxDownloadChunkSize = maxDownloadChunkSize;
        this.clock = clock;
    }
    
    /**
     * Handles an upload stream.
     * 
     * @return the hash signed by this node
     */
    public PieceHash upload(MessageStream<PieceUploadRequest, PieceUploadResponse> stream)
            throws PieceStoreException {
        UploadSession session = new UploadSession(identity, store, locks, verifier, clock);
        activeUploads.add(session);
        try {
            return session.run(stream);
        } finally {
            activeUploads.remove(session);
        }
    }
    
    /**
     * Handles a download stream.
     * 
     * @return number of payload bytes sent
     */
    public long download(MessageStream<PieceDownloadRequest, PieceDownloadResponse> stream)
            throws PieceStoreException {
        DownloadSession session = new DownloadSession(store, locks, verifier, maxDownloadChunkSize);
        activeDownloads.add(session);
        try {
            return session.run(stream);
        } finally {
            activeDownloads.remove(session);
        }
    }
    
    /**
     * Deletes a single piece authorized by a delete order limit.
     * 
     * @deprecated satellites delete in batches with {@link #deletePieces(NodeID, DeletePiecesRequest)}
     */
    @Deprecated
    public EmptyMessage delete(PieceDeleteRequest request) throws PieceStoreException {
        OrderLimit limit = request.getLimit();
        if (limit == null) {
            throw new InvalidArgumentException("missing order limit");
        }
        if (limit.getAction() != PieceAction.DELETE) {
            throw new AuthorizationException("expected delete action got " + limit.getAction());
        }
        verifier.verifyOrderLimit(limit);
        
        if (!store.delete(limit.getSatelliteId(), limit.getPieceId())) {
            throw new PieceNotFoundException(limit.getPieceId().toString());
        }
        logger.info("Deleted piece {} for satellite {}", limit.getPieceId(), limit.getSatelliteId());
        return EmptyMessage.deleteResponse();
    }
    
    /**
     * Deletes a batch of pieces from the calling satellite's namespace.
     * 
     * Pieces that are already absent count as handled. Only pieces whose
     * deletion failed are reported as unhandled.
     */
    public DeletePiecesResponse deletePieces(NodeID caller, DeletePiecesRequest request)
            throws PieceStoreException {
        requireTrusted(caller);
        long unhandled = 0;
        int deleted = 0;
        for (PieceID pieceId : request.getPieceIds()) {
            try {
                if (store.delete(caller, pieceId)) {
                    deleted++;
                }
            } catch (StorageException e) {
                unhandled++;
                logger.warn("Failed to delete piece {} for satellite {}: {}", pieceId, caller, e.getMessage());
            }
        }
        logger.info("Deleted {} of {} requested pieces for satellite {}, {} unhandled",
                deleted, request.getPieceIds().size(), caller, unhandled);
        return new DeletePiecesResponse(unhandled);
    }
    
    /**
     * Queues a retain request for the calling satellite's namespace.
     */
    public EmptyMessage retain(NodeID caller, RetainRequest request) throws PieceStoreException {
        requireTrusted(caller);
        if (request.getCreationDate() == null) {
            throw new InvalidArgumentException("missing retain creation date");
        }
        BloomFilter filter = BloomFilter.fromBytes(request.getFilter());
        if (retainService.queue(caller, request.getCreationDate(), filter)) {
            logger.info("Queued retain for satellite {} before {}", caller, request.getCreationDate());
        }
        return EmptyMessage.retainResponse();
    }
    
    /**
     * Moves the calling satellite's trash back into its live pieces.
     */
    public EmptyMessage restoreTrash(NodeID caller) throws PieceStoreException {
        requireTrusted(caller);
        int restored = store.restoreTrash(caller);
        logger.info("Restored {} pieces for satellite {}", restored, caller);
        return EmptyMessage.restoreTrashResponse();
    }
    
    /**
     * Cancels every session in progress.
     */
    public void cancelAll() {
        for (UploadSession session : activeUploads) {
            session.cancel();
        }
        for (DownloadSession session : activeDownloads) {
            session.cancel();
        }
    }
    
    public int activeSessionCount() {
        return activeUploads.size() + activeDownloads.size();
    }
    
    public NodeID getNodeId() {
        return identity.getId();
    }
    
    private void requireTrusted(NodeID caller) throws AuthorizationException {
        if (!trustedSatellites.isTrusted(caller)) {
            throw new AuthorizationException("requester is not a trusted satellite: " + caller);
        }
    }
}
