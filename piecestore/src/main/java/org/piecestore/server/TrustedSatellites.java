package org.piecestore.server;

import org.piecestore.identity.NodeID;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Satellites whose order limits and administrative requests this node accepts.
 */
public class TrustedSatellites {
    
    private final Map<NodeID, PublicKey> satellites = new ConcurrentHashMap<>();
    
    public void add(PublicKey publicKey) {
        satellites.put(NodeID.fromPublicKey(publicKey), publicKey);
    }
    
    public boolean isTrusted(NodeID satelliteId) {
        return satelliteId != null && satellites.containsKey(satelliteId);
    }
    
    /**
     * @return the satellite's signing key, or null if it is not trusted
     */
    public PublicKey getPublicKey(NodeID satelliteId) {
        return satelliteId == null ? null : satellites.get(satelliteId);
    }
    
    public List<NodeID> getIds() {
        return new ArrayList<>(satellites.keySet());
    }
}
