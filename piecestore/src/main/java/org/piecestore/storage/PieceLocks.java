package org.piecestore.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Advisory registry of pieces with a transfer in flight.
 * 
 * Sessions mark the piece they work on for their lifetime. Background
 * maintenance skips marked pieces instead of blocking on them.
 */
public class PieceLocks {
    
    private final Map<PieceKey, AtomicInteger> active = new ConcurrentHashMap<>();
    
    /**
     * Marks the piece busy until the returned handle is closed.
     */
    public Handle acquire(PieceKey key) {
        active.compute(key, (k, count) -> {
            if (count == null) {
                return new AtomicInteger(1);
            }
            count.incrementAndGet();
            return count;
        });
        return new Handle(key);
    }
    
    public boolean isBusy(PieceKey key) {
        return active.containsKey(key);
    }
    
    public int activeCount() {
        return active.size();
    }
    
    private void release(PieceKey key) {
        active.computeIfPresent(key, (k, count) -> count.decrementAndGet() == 0 ? null : count);
    }
    
    /**
     * Marks a piece busy while open.
     */
    public final class Handle implements AutoCloseable {
        
        private final PieceKey key;
        private boolean released;
        
        private Handle(PieceKey key) {
            this.key = key;
        }
        
        @Override
        public void close() {
            if (!released) {
                released = true;
                release(key);
            }
        }
    }
}
