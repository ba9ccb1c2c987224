package org.piecestore.server;

import org.piecestore.config.StorageNodeConfig;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.Base32;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.Signing;
import org.piecestore.storage.FilePieceStore;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.InvalidKeyException;
import java.time.Clock;

/**
 * A storage node: piece store, endpoint, background services and TCP server
 * wired together from one configuration.
 */
public class StorageNode implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(StorageNode.class);
    
    private final StorageNodeConfig config;
    private final PieceStore store;
    private final TrustedSatellites trustedSatellites;
    private final RetainService retainService;
    private final TrashChore trashChore;
    private final Endpoint endpoint;
    private final PieceStoreServer server;
    
    public StorageNode(StorageNodeConfig config, NodeIdentity identity, Clock clock)
            throws StorageException, InvalidArgumentException {
        this.config = config;
        this.store = new FilePieceStore(config.getStorageDir().resolve("pieces"), clock);
        this.trustedSatellites = new TrustedSatellites();
        for (String encoded : config.getTrustedSatellites()) {
            try {
                trustedSatellites.add(Signing.decodePublicKey(Base32.decode(encoded)));
            } catch (InvalidKeyException | IllegalArgumentException e) {
                throw new InvalidArgumentException("trusted satellite key " + encoded + ": " + e.getMessage());
            }
        }
        
        PieceLocks locks = new PieceLocks();
        UsedSerials usedSerials = new UsedSerials();
        OrderLimitVerifier verifier = new OrderLimitVerifier(identity.getId(), trustedSatellites, usedSerials,
                config.getOrderLimitGracePeriod(), clock);
        this.retainService = new RetainService(store, locks, config.getRetainStatus(), config.getRetainTimeSkew());
        this.trashChore = new TrashChore(store, usedSerials, config.getTrashExpiration(), clock);
        this.endpoint = new Endpoint(identity, store, locks, verifier, trustedSatellites, retainService,
                config.getMaxDownloadChunkSize(), clock);
        this.server = new PieceStoreServer(endpoint, config.getPort(), config.getWorkerThreads(),
                config.getStreamTimeout());
    }
    
    public void start() throws IOException {
        server.start();
        trashChore.start(config.getMaintenanceInterval());
        logger.info("Storage node started with {} trusted satellites, retain {}",
                trustedSatellites.getIds().size(), retainService.getStatus());
    }
    
    public int getPort() {
        return server.getPort();
    }
    
    public PieceStore getStore() {
        return store;
    }
    
    public Endpoint getEndpoint() {
        return endpoint;
    }
    
    public TrustedSatellites getTrustedSatellites() {
        return trustedSatellites;
    }
    
    public RetainService getRetainService() {
        return retainService;
    }
    
    @Override
    public void close() {
        server.close();
        trashChore.close();
        retainService.close();
    }
}
