package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.IntegrityException;
import org.piecestore.identity.NodeID;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.Signing;

import java.security.InvalidKeyException;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Checks order limits, orders and piece hashes presented to this storage node.
 */
public class OrderLimitVerifier {
    
    private final NodeID self;
    private final TrustedSatellites trustedSatellites;
    private final UsedSerials usedSerials;
    private final Duration gracePeriod;
    private final Clock clock;
    
    public OrderLimitVerifier(NodeID self, TrustedSatellites trustedSatellites, UsedSerials usedSerials,
                              Duration gracePeriod, Clock clock) {
        this.self = self;
        this.trustedSatellites = trustedSatellites;
        this.usedSerials = usedSerials;
        this.gracePeriod = gracePeriod;
        this.clock = clock;
    }
    
    /**
     * Verifies that the order limit may be used on this node now and records
     * its serial number so it cannot be used again.
     */
    public void verifyOrderLimit(OrderLimit limit) throws AuthorizationException {
        Instant now = clock.instant();
        
        if (limit.getStorageNodeId() == null || !limit.getStorageNodeId().equals(self)) {
            throw new AuthorizationException("order intended for other storagenode: " + limit.getStorageNodeId());
        }
        if (limit.getPieceId() == null || limit.getPieceId().isZero()) {
            throw new AuthorizationException("missing piece id");
        }
        if (limit.getLimit() < 0) {
            throw new AuthorizationException("order limit is negative");
        }
        if (limit.getOrderExpiration() == null || !limit.getOrderExpiration().isAfter(now)) {
            throw new AuthorizationException("order expired: " + limit.getOrderExpiration());
        }
        if (limit.getOrderCreation() != null && limit.getOrderCreation().isBefore(now.minus(gracePeriod))) {
            throw new AuthorizationException("order created too long ago: " + limit.getOrderCreation());
        }
        if (limit.getPieceExpiration() != null && limit.getPieceExpiration().isBefore(now)) {
            throw new AuthorizationException("piece expired: " + limit.getPieceExpiration());
        }
        if (limit.getSerialNumber() == null) {
            throw new AuthorizationException("missing serial number");
        }
        
        PublicKey satelliteKey = trustedSatellites.getPublicKey(limit.getSatelliteId());
        if (satelliteKey == null) {
            throw new AuthorizationException("untrusted satellite: " + limit.getSatelliteId());
        }
        if (!Signing.verifyOrderLimitSignature(satelliteKey, limit)) {
            throw new AuthorizationException("invalid order limit signature");
        }
        
        if (!usedSerials.add(limit.getSatelliteId(), limit.getSerialNumber(), limit.getOrderExpiration())) {
            throw new AuthorizationException("serial number is already used: " + limit.getSerialNumber());
        }
    }
    
    /**
     * Decodes the uplink key the order limit delegates signing to.
     */
    public PublicKey uplinkKey(OrderLimit limit) throws AuthorizationException {
        if (limit.getUplinkPublicKey() == null || limit.getUplinkPublicKey().length == 0) {
            throw new AuthorizationException("missing uplink public key");
        }
        try {
            return Signing.decodePublicKey(limit.getUplinkPublicKey());
        } catch (InvalidKeyException e) {
            throw new AuthorizationException("invalid uplink public key", e);
        }
    }
    
    /**
     * Verifies an order against its limit and the largest amount ordered so far.
     */
    public void verifyOrder(OrderLimit limit, PublicKey uplinkKey, Order order, long largestOrderAmount)
            throws AuthorizationException {
        if (order.getSerialNumber() == null || !order.getSerialNumber().equals(limit.getSerialNumber())) {
            throw new AuthorizationException("order serial number changed during upload");
        }
        if (order.getAmount() < largestOrderAmount) {
            throw new AuthorizationException("order contained smaller amount " + order.getAmount()
                    + ", previous was " + largestOrderAmount);
        }
        if (order.getAmount() > limit.getLimit()) {
            throw new AuthorizationException("order exceeded allowed amount " + order.getAmount()
                    + ", limit is " + limit.getLimit());
        }
        if (!Signing.verifyUplinkOrderSignature(uplinkKey, order)) {
            throw new AuthorizationException("invalid order signature");
        }
    }
    
    /**
     * Verifies the uplink's final piece hash against what this node received.
     */
    public void verifyPieceHash(OrderLimit limit, PublicKey uplinkKey, PieceHash hash,
                                byte[] expectedHash, long expectedSize) throws IntegrityException {
        if (!Signing.verifyPieceHashSignature(uplinkKey, hash)) {
            throw new IntegrityException("invalid piece hash signature");
        }
        if (hash.getPieceId() == null || !hash.getPieceId().equals(limit.getPieceId())) {
            throw new IntegrityException("piece id changed from " + limit.getPieceId() + " to " + hash.getPieceId());
        }
        if (!Arrays.equals(hash.getHash(), expectedHash)) {
            throw new IntegrityException("hashes don't match");
        }
        if (hash.getPieceSize() != expectedSize) {
            throw new IntegrityException("piece size " + hash.getPieceSize()
                    + " doesn't match received " + expectedSize + " bytes");
        }
    }
}
