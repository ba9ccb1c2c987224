package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.IntegrityException;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceAction;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.orders.PieceHasher;
import org.piecestore.orders.SerialNumber;
import org.piecestore.orders.Signing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.security.PublicKey;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderLimitVerifier.
 */
class OrderLimitVerifierTest {
    
    @TempDir
    Path root;
    
    private NodeFixture fixture;
    private OrderLimitVerifier verifier;
    
    @BeforeEach
    void setUp() throws Exception {
        fixture = new NodeFixture(root);
        verifier = fixture.verifier;
    }
    
    private void assertRejected(OrderLimit limit, String reason) {
        AuthorizationException e = assertThrows(AuthorizationException.class, () -> verifier.verifyOrderLimit(limit));
        assertTrue(e.getMessage().contains(reason), e.getMessage());
    }
    
    @Test
    void testVerifyOrderLimit_Valid() throws Exception {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        verifier.verifyOrderLimit(limit);
        assertEquals(1, fixture.usedSerials.count());
    }
    
    @Test
    void testVerifyOrderLimit_OtherStorageNode() {
        OrderLimit limit = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setStorageNodeId(NodeIdentity.generate().getId());
        assertRejected(fixture.satellite.sign(limit), "other storagenode");
    }
    
    @Test
    void testVerifyOrderLimit_MissingPieceId() {
        OrderLimit limit = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setPieceId(null);
        assertRejected(fixture.satellite.sign(limit), "missing piece id");
    }
    
    @Test
    void testVerifyOrderLimit_NegativeLimit() {
        assertRejected(fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, -1), "negative");
    }
    
    @Test
    void testVerifyOrderLimit_Expired() {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        fixture.clock.advance(Duration.ofHours(1));
        assertRejected(limit, "order expired");
    }
    
    @Test
    void testVerifyOrderLimit_CreatedTooLongAgo() {
        OrderLimit limit = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setOrderCreation(fixture.clock.instant().minus(Duration.ofHours(2)));
        assertRejected(fixture.satellite.sign(limit), "too long ago");
    }
    
    @Test
    void testVerifyOrderLimit_PieceExpired() {
        OrderLimit limit = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setPieceExpiration(fixture.clock.instant().minus(Duration.ofSeconds(1)));
        assertRejected(fixture.satellite.sign(limit), "piece expired");
    }
    
    @Test
    void testVerifyOrderLimit_MissingSerial() {
        OrderLimit limit = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setSerialNumber(null);
        assertRejected(fixture.satellite.sign(limit), "missing serial number");
    }
    
    @Test
    void testVerifyOrderLimit_UntrustedSatellite() {
        OrderLimit limit = Signing.signOrderLimit(NodeIdentity.generate(),
                fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.PUT, 100));
        assertRejected(limit, "untrusted satellite");
    }
    
    @Test
    void testVerifyOrderLimit_TamperedAfterSigning() {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        limit.setLimit(1000000);
        assertRejected(limit, "invalid order limit signature");
        assertEquals(0, fixture.usedSerials.count());
    }
    
    @Test
    void testVerifyOrderLimit_SerialReuse() throws Exception {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.GET, 100);
        verifier.verifyOrderLimit(limit);
        assertRejected(limit, "already used");
        
        OrderLimit sameSerial = fixture.satellite.unsigned(PieceID.newPieceID(), PieceAction.GET, 100);
        sameSerial.setSerialNumber(limit.getSerialNumber());
        assertRejected(fixture.satellite.sign(sameSerial), "already used");
    }
    
    @Test
    void testUplinkKey() throws Exception {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        assertNotNull(verifier.uplinkKey(limit));
        
        limit.setUplinkPublicKey(null);
        assertThrows(AuthorizationException.class, () -> verifier.uplinkKey(limit));
        limit.setUplinkPublicKey(new byte[]{1, 2, 3});
        assertThrows(AuthorizationException.class, () -> verifier.uplinkKey(limit));
    }
    
    @Test
    void testVerifyOrder() throws Exception {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        PublicKey uplinkKey = verifier.uplinkKey(limit);
        
        verifier.verifyOrder(limit, uplinkKey, fixture.order(limit, 50), 0);
        verifier.verifyOrder(limit, uplinkKey, fixture.order(limit, 50), 50);
        
        assertThrows(AuthorizationException.class,
                () -> verifier.verifyOrder(limit, uplinkKey, fixture.order(limit, 40), 50));
        assertThrows(AuthorizationException.class,
                () -> verifier.verifyOrder(limit, uplinkKey, fixture.order(limit, 101), 50));
        
        Order foreign = Signing.signUplinkOrder(fixture.satellite.getUplinkPrivateKey(),
                new Order(SerialNumber.random(), 60));
        assertThrows(AuthorizationException.class, () -> verifier.verifyOrder(limit, uplinkKey, foreign, 50));
        
        Order forged = Signing.signUplinkOrder(NodeIdentity.generate().getPrivateKey(),
                new Order(limit.getSerialNumber(), 60));
        assertThrows(AuthorizationException.class, () -> verifier.verifyOrder(limit, uplinkKey, forged, 50));
    }
    
    @Test
    void testVerifyPieceHash() throws Exception {
        byte[] data = NodeFixture.payload(100);
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        PublicKey uplinkKey = verifier.uplinkKey(limit);
        byte[] expected = PieceHasher.hash(PieceHashAlgorithm.SHA256, data);
        
        PieceHash hash = fixture.uplinkHash(limit, data, PieceHashAlgorithm.SHA256);
        verifier.verifyPieceHash(limit, uplinkKey, hash, expected, 100);
        
        assertThrows(IntegrityException.class, () -> verifier.verifyPieceHash(limit, uplinkKey, hash, expected, 99));
        assertThrows(IntegrityException.class, () -> verifier.verifyPieceHash(limit, uplinkKey, hash,
                PieceHasher.hash(PieceHashAlgorithm.SHA256, new byte[1]), 100));
        
        OrderLimit other = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.PUT, 100);
        assertThrows(IntegrityException.class, () -> verifier.verifyPieceHash(other, uplinkKey, hash, expected, 100));
        
        hash.setPieceSize(99);
        assertThrows(IntegrityException.class, () -> verifier.verifyPieceHash(limit, uplinkKey, hash, expected, 99));
    }
}
