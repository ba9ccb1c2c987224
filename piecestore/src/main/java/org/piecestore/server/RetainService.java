package org.piecestore.server;

import org.piecestore.config.RetainStatus;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.NodeID;
import org.piecestore.storage.BloomFilter;
import org.piecestore.storage.PieceKey;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceStore;
import org.piecestore.storage.StoredPiece;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves pieces the satellites no longer want into trash, in the background.
 * 
 * At most one request per satellite is queued; a newer request replaces the
 * queued one. Requests are processed one at a time so a sweep never competes
 * with another for the disk.
 */
public class RetainService implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RetainService.class);
    
    private final PieceStore store;
    private final PieceLocks locks;
    private final RetainStatus status;
    private final Duration timeSkew;
    private final ExecutorService executor;
    private final Map<NodeID, Request> queued = new LinkedHashMap<>();
    
    public RetainService(PieceStore store, PieceLocks locks, RetainStatus status, Duration timeSkew) {
        this.store = store;
        this.locks = locks;
        this.status = status;
        this.timeSkew = timeSkew;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "retain");
            thread.setDaemon(true);
            return thread;
        });
    }
    
    /**
     * Queues a retain request for background processing.
     * 
     * @return false if retain is disabled and the request was dropped
     */
    public boolean queue(NodeID satelliteId, Instant createdBefore, BloomFilter filter) {
        if (status == RetainStatus.DISABLED) {
            logger.debug("Retain disabled, ignoring request from {}", satelliteId);
            return false;
        }
        synchronized (queued) {
            Request previous = queued.put(satelliteId, new Request(createdBefore, filter));
            if (previous != null) {
                logger.info("Replaced queued retain request for satellite {}", satelliteId);
                return true;
            }
        }
        executor.submit(() -> processQueued(satelliteId));
        return true;
    }
    
    private void processQueued(NodeID satelliteId) {
        Request request;
        synchronized (queued) {
            request = queued.remove(satelliteId);
        }
        if (request == null) {
            return;
        }
        try {
            retain(satelliteId, request.createdBefore, request.filter);
        } catch (StorageException e) {
            logger.error("Retain for satellite {} failed", satelliteId, e);
        }
    }
    
    /**
     * Trashes every piece of the satellite created before the threshold,
     * shifted back by the configured time skew, that is not in the filter.
     * 
     * @return number of pieces trashed, or that would have been in debug mode
     */
    public int retain(NodeID satelliteId, Instant createdBefore, BloomFilter filter) throws StorageException {
        Instant threshold = createdBefore.minus(timeSkew);
        int trashed = 0;
        int skipped = 0;
        int kept = 0;
        
        for (StoredPiece piece : store.listPieces(satelliteId)) {
            if (piece.getCreationTime() == null || !piece.getCreationTime().isBefore(threshold)) {
                kept++;
                continue;
            }
            if (filter.contains(piece.getPieceId())) {
                kept++;
                continue;
            }
            if (locks.isBusy(new PieceKey(satelliteId, piece.getPieceId()))) {
                logger.debug("Skipping piece {} with a transfer in progress", piece.getPieceId());
                skipped++;
                continue;
            }
            
            if (status == RetainStatus.DEBUG) {
                logger.info("Retain would trash piece {} created {}", piece.getPieceId(), piece.getCreationTime());
                trashed++;
                continue;
            }
            try {
                if (store.trash(satelliteId, piece.getPieceId())) {
                    trashed++;
                }
            } catch (StorageException e) {
                logger.warn("Failed to trash piece {}: {}", piece.getPieceId(), e.getMessage());
            }
        }
        
        logger.info("Retain for satellite {} before {}: {} trashed, {} kept, {} busy",
                satelliteId, threshold, trashed, kept, skipped);
        return trashed;
    }
    
    public RetainStatus getStatus() {
        return status;
    }
    
    /**
     * Blocks until every request queued so far has been processed.
     */
    public void awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> barrier = executor.submit(() -> { });
        try {
            barrier.get(timeout, unit);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("retain queue did not drain", e);
        }
    }
    
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Retain worker did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
    
    private static final class Request {
        
        private final Instant createdBefore;
        private final BloomFilter filter;
        
        private Request(Instant createdBefore, BloomFilter filter) {
            this.createdBefore = createdBefore;
            this.filter = filter;
        }
    }
}
