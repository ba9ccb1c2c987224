package org.piecestore;

import org.piecestore.config.ClientConfig;
import org.piecestore.exception.ClientClosedException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.protocol.ProtocolConstants;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PieceStoreClient.
 */
class PieceStoreClientTest {
    
    private final NodeIdentity self = NodeIdentity.generate();
    
    @Test
    void testConfigValidation_NullConfig() {
        assertThrows(InvalidArgumentException.class, () -> {
            new PieceStoreClient(null, self);
        });
    }
    
    @Test
    void testConfigValidation_NullNodeId() {
        assertThrows(InvalidArgumentException.class, () -> {
            new PieceStoreClient(new ClientConfig(), null);
        });
    }
    
    @Test
    void testConfigValidation_InvalidValues() {
        ClientConfig conns = new ClientConfig();
        conns.setMaxConns(0);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(conns, self));
        
        ClientConfig timeout = new ClientConfig();
        timeout.setNetworkTimeout(-1);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(timeout, self));
        
        ClientConfig retries = new ClientConfig();
        retries.setRetryCount(0);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(retries, self));
        
        ClientConfig chunk = new ClientConfig();
        chunk.setUploadChunkSize(ProtocolConstants.MAX_FRAME_BODY_LEN);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(chunk, self));
        
        ClientConfig backoff = new ClientConfig().setRetryBackoff(-1);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(backoff, self));
        
        ClientConfig hash = new ClientConfig().setHashAlgorithm(null);
        assertThrows(InvalidArgumentException.class, () -> new PieceStoreClient(hash, self));
    }
    
    @Test
    void testConfigValidation_ValidConfig() {
        assertDoesNotThrow(() -> {
            PieceStoreClient client = new PieceStoreClient(new ClientConfig(), self);
            assertEquals(self.getId(), client.getNodeId());
            client.close();
        });
    }
    
    @Test
    void testInvalidAddress() throws Exception {
        try (PieceStoreClient client = new PieceStoreClient(new ClientConfig(), self)) {
            assertThrows(InvalidArgumentException.class, () -> client.restoreTrash("localhost"));
            assertThrows(InvalidArgumentException.class,
                    () -> client.deletePieces(null, Collections.singletonList(PieceID.newPieceID())));
        }
    }
    
    @Test
    void testClientClose_MultipleCloses() {
        assertDoesNotThrow(() -> {
            PieceStoreClient client = new PieceStoreClient(new ClientConfig(), self);
            client.close();
            client.close(); // Should not throw
        });
    }
    
    @Test
    void testClosedClientRejectsCalls() throws Exception {
        PieceStoreClient client = new PieceStoreClient(new ClientConfig(), self);
        client.close();
        assertThrows(ClientClosedException.class, () -> client.restoreTrash("127.0.0.1:28967"));
    }
}
