package org.piecestore.config;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.protocol.ProtocolConstants;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StorageNodeConfig.
 */
class StorageNodeConfigTest {
    
    @TempDir
    Path tempDir;
    
    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(StorageNodeConfigTest.class.getResource("/" + name).toURI());
    }
    
    @Test
    void testDefaults() {
        StorageNodeConfig config = new StorageNodeConfig();
        assertEquals(ProtocolConstants.STORAGE_NODE_DEFAULT_PORT, config.getPort());
        assertEquals(RetainStatus.ENABLED, config.getRetainStatus());
        assertEquals(Duration.ofHours(72), config.getRetainTimeSkew());
        assertEquals(Duration.ofDays(7), config.getTrashExpiration());
        assertEquals(Duration.ofHours(1), config.getOrderLimitGracePeriod());
        assertTrue(config.getTrustedSatellites().isEmpty());
    }
    
    @Test
    void testLoad_AllKeys() throws Exception {
        StorageNodeConfig config = StorageNodeConfig.load(resource("storagenode-test.properties"));
        
        assertEquals(Paths.get("/var/lib/piecestore"), config.getStorageDir());
        assertEquals(7777, config.getPort());
        assertEquals(8, config.getWorkerThreads());
        assertEquals(15000, config.getStreamTimeout());
        assertEquals(Duration.ofMinutes(30), config.getOrderLimitGracePeriod());
        assertEquals(65536, config.getMaxDownloadChunkSize());
        assertEquals(RetainStatus.DEBUG, config.getRetainStatus());
        assertEquals(Duration.ofHours(24), config.getRetainTimeSkew());
        assertEquals(Duration.ofDays(3), config.getTrashExpiration());
        assertEquals(Duration.ofMinutes(10), config.getMaintenanceInterval());
        assertEquals(Arrays.asList("AAAA", "BBBB", "CCCC"), config.getTrustedSatellites());
    }
    
    @Test
    void testLoad_MissingFile() {
        assertThrows(InvalidArgumentException.class,
                () -> StorageNodeConfig.load(tempDir.resolve("missing.properties")));
    }
    
    @Test
    void testApplyArgs_Overrides() throws Exception {
        StorageNodeConfig config = StorageNodeConfig.load(resource("storagenode-test.properties"));
        config.applyArgs(new String[]{"config.properties", "--server.port=0", "--retain.status=disabled",
                "--ignored", "--storage.dir=" + tempDir});
        
        assertEquals(0, config.getPort());
        assertEquals(RetainStatus.DISABLED, config.getRetainStatus());
        assertEquals(tempDir, config.getStorageDir());
        assertEquals(8, config.getWorkerThreads());
    }
    
    @Test
    void testApply_BadValues() {
        StorageNodeConfig config = new StorageNodeConfig();
        
        Properties port = new Properties();
        port.setProperty("server.port", "eighty");
        assertThrows(InvalidArgumentException.class, () -> config.apply(port));
        
        Properties skew = new Properties();
        skew.setProperty("retain.time-skew", "72h");
        assertThrows(InvalidArgumentException.class, () -> config.apply(skew));
        
        Properties status = new Properties();
        status.setProperty("retain.status", "sometimes");
        assertThrows(InvalidArgumentException.class, () -> config.apply(status));
    }
}
