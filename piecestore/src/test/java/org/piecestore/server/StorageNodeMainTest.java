package org.piecestore.server;

import org.piecestore.exception.PieceStoreException;
import org.piecestore.orders.NodeIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StorageNodeMain.
 */
class StorageNodeMainTest {
    
    @TempDir
    Path storageDir;
    
    @Test
    void testLoadOrCreateIdentity_StableAcrossRestarts() throws Exception {
        NodeIdentity created = StorageNodeMain.loadOrCreateIdentity(storageDir.resolve("node"));
        assertTrue(Files.exists(storageDir.resolve("node").resolve("identity.key")));
        
        NodeIdentity loaded = StorageNodeMain.loadOrCreateIdentity(storageDir.resolve("node"));
        assertEquals(created.getId(), loaded.getId());
        assertArrayEquals(created.getPrivateKey().getEncoded(), loaded.getPrivateKey().getEncoded());
    }
    
    @Test
    void testLoadOrCreateIdentity_Corrupted() throws Exception {
        Files.write(storageDir.resolve("identity.key"), new byte[]{1, 2, 3});
        Files.write(storageDir.resolve("identity.pub"), new byte[]{4, 5, 6});
        assertThrows(PieceStoreException.class, () -> StorageNodeMain.loadOrCreateIdentity(storageDir));
    }
}
