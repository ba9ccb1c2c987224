package org.piecestore.server;

import org.piecestore.config.StorageNodeConfig;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.orders.NodeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.InvalidKeyException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Runs a storage node.
 * 
 * Usage: {@code StorageNodeMain [config.properties] [--key=value ...]}
 */
public final class StorageNodeMain {
    
    private static final Logger logger = LoggerFactory.getLogger(StorageNodeMain.class);
    
    private static final String PRIVATE_KEY_FILE = "identity.key";
    private static final String PUBLIC_KEY_FILE = "identity.pub";
    
    private StorageNodeMain() {
    }
    
    public static void main(String[] args) throws Exception {
        StorageNodeConfig config = args.length > 0 && !args[0].startsWith("--")
                ? StorageNodeConfig.load(Paths.get(args[0]))
                : new StorageNodeConfig();
        config.applyArgs(args);
        logger.info("Starting with {}", config);
        
        NodeIdentity identity = loadOrCreateIdentity(config.getStorageDir());
        StorageNode node = new StorageNode(config, identity, Clock.systemUTC());
        node.start();
        
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            node.close();
            stopped.countDown();
        }, "shutdown"));
        stopped.await();
    }
    
    /**
     * Loads the node identity from the storage directory, generating and
     * saving one on first start.
     */
    static NodeIdentity loadOrCreateIdentity(Path storageDir) throws IOException, PieceStoreException {
        Path privateKey = storageDir.resolve(PRIVATE_KEY_FILE);
        Path publicKey = storageDir.resolve(PUBLIC_KEY_FILE);
        
        if (Files.exists(privateKey) && Files.exists(publicKey)) {
            try {
                NodeIdentity identity = NodeIdentity.fromEncoded(Files.readAllBytes(publicKey),
                        Files.readAllBytes(privateKey));
                logger.info("Loaded identity {}", identity.getId());
                return identity;
            } catch (InvalidKeyException e) {
                throw new PieceStoreException("corrupted identity in " + storageDir, e);
            }
        }
        
        NodeIdentity identity = NodeIdentity.generate();
        Files.createDirectories(storageDir);
        Files.write(publicKey, identity.getPublicKey().getEncoded());
        Files.write(privateKey, identity.getPrivateKey().getEncoded());
        logger.info("Generated new identity {}", identity.getId());
        return identity;
    }
}
