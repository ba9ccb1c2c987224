package org.piecestore.server;

import org.piecestore.identity.NodeID;
import org.piecestore.orders.SerialNumber;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serial numbers of order limits already used, kept until the limits expire.
 */
public class UsedSerials {
    
    private final Map<NodeID, Map<SerialNumber, Instant>> serials = new ConcurrentHashMap<>();
    
    /**
     * Records a serial number.
     * 
     * @return false if the serial was already used for this satellite
     */
    public boolean add(NodeID satelliteId, SerialNumber serialNumber, Instant expiration) {
        Map<SerialNumber, Instant> perSatellite =
                serials.computeIfAbsent(satelliteId, k -> new ConcurrentHashMap<>());
        return perSatellite.putIfAbsent(serialNumber, expiration) == null;
    }
    
    /**
     * Forgets serials whose order limits expired before the given time.
     * 
     * @return number of removed serials
     */
    public int deleteExpired(Instant now) {
        int removed = 0;
        for (Map<SerialNumber, Instant> perSatellite : serials.values()) {
            for (Map.Entry<SerialNumber, Instant> entry : perSatellite.entrySet()) {
                if (entry.getValue().isBefore(now) && perSatellite.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
        }
        return removed;
    }
    
    public int count() {
        int count = 0;
        for (Map<SerialNumber, Instant> perSatellite : serials.values()) {
            count += perSatellite.size();
        }
        return count;
    }
}
