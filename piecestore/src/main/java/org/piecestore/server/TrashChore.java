package org.piecestore.server;

import org.piecestore.exception.StorageException;
import org.piecestore.storage.PieceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic maintenance: permanently deletes expired trash and forgets
 * serial numbers of expired order limits.
 */
public class TrashChore implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(TrashChore.class);
    
    private final PieceStore store;
    private final UsedSerials usedSerials;
    private final Duration trashExpiration;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    
    public TrashChore(PieceStore store, UsedSerials usedSerials, Duration trashExpiration, Clock clock) {
        this.store = store;
        this.usedSerials = usedSerials;
        this.trashExpiration = trashExpiration;
        this.clock = clock;
    }
    
    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "trash-chore");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::runSafely, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }
    
    /**
     * Runs one maintenance cycle.
     * 
     * @return number of pieces deleted from trash
     */
    public int runOnce() throws StorageException {
        Instant now = clock.instant();
        int emptied = store.emptyTrash(now.minus(trashExpiration));
        int serials = usedSerials.deleteExpired(now);
        logger.debug("Trash chore deleted {} pieces and {} expired serials", emptied, serials);
        return emptied;
    }
    
    private void runSafely() {
        try {
            runOnce();
        } catch (StorageException e) {
            logger.error("Trash chore failed", e);
        }
    }
    
    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
