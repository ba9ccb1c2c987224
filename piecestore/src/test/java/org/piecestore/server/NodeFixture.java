package org.piecestore.server;

import org.piecestore.MutableClock;
import org.piecestore.SatelliteFixture;
import org.piecestore.config.RetainStatus;
import org.piecestore.exception.PieceStoreException;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.NodeIdentity;
import org.piecestore.orders.Order;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceAction;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.orders.PieceHasher;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.storage.FilePieceStore;
import org.piecestore.storage.PieceHeader;
import org.piecestore.storage.PieceLocks;
import org.piecestore.storage.PieceStore;
import org.piecestore.storage.PieceWriter;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A storage node's server-side components wired together for tests,
 * with one trusted satellite.
 */
class NodeFixture {
    
    final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
    final NodeIdentity node = NodeIdentity.generate();
    final SatelliteFixture satellite = new SatelliteFixture(node.getId(), clock);
    final PieceLocks locks = new PieceLocks();
    final TrustedSatellites trusted = new TrustedSatellites();
    final UsedSerials usedSerials = new UsedSerials();
    final OrderLimitVerifier verifier;
    final PieceStore store;
    
    NodeFixture(Path root) throws StorageException {
        this(root, null);
    }
    
    NodeFixture(Path root, PieceStore store) throws StorageException {
        this.store = store != null ? store : new FilePieceStore(root, clock);
        this.trusted.add(satellite.getSatellite().getPublicKey());
        this.verifier = new OrderLimitVerifier(node.getId(), trusted, usedSerials, Duration.ofHours(1), clock);
    }
    
    UploadSession uploadSession() {
        return new UploadSession(node, store, locks, verifier, clock);
    }
    
    DownloadSession downloadSession(int maxChunkSize) {
        return new DownloadSession(store, locks, verifier, maxChunkSize);
    }
    
    RetainService retainService(RetainStatus status, Duration timeSkew) {
        return new RetainService(store, locks, status, timeSkew);
    }
    
    Endpoint endpoint(RetainService retainService) {
        return new Endpoint(node, store, locks, verifier, trusted, retainService, 256, clock);
    }
    
    Order order(OrderLimit limit, long amount) {
        return Signing.signUplinkOrder(satellite.getUplinkPrivateKey(), new Order(limit.getSerialNumber(), amount));
    }
    
    PieceHash uplinkHash(OrderLimit limit, byte[] data, PieceHashAlgorithm algorithm) {
        PieceHash hash = new PieceHash(limit.getPieceId(), PieceHasher.hash(algorithm, data), data.length,
                clock.instant(), algorithm);
        return Signing.signPieceHash(satellite.getUplinkPrivateKey(), hash);
    }
    
    /**
     * The messages of a well-behaved upload sending the data in chunks of the given size.
     */
    List<PieceUploadRequest> uploadScript(OrderLimit limit, byte[] data, int chunkSize) {
        List<PieceUploadRequest> script = new ArrayList<>();
        script.add(PieceUploadRequest.ofLimit(limit, PieceHashAlgorithm.SHA256));
        for (int offset = 0; offset < data.length; offset += chunkSize) {
            int end = Math.min(data.length, offset + chunkSize);
            script.add(PieceUploadRequest.ofOrder(order(limit, end)));
            script.add(PieceUploadRequest.ofChunk(offset, Arrays.copyOfRange(data, offset, end)));
        }
        script.add(PieceUploadRequest.ofDone(uplinkHash(limit, data, PieceHashAlgorithm.SHA256)));
        return script;
    }
    
    /**
     * Uploads a piece through a real session.
     */
    PieceID upload(byte[] data) throws PieceStoreException {
        PieceID pieceId = PieceID.newPieceID();
        OrderLimit limit = satellite.limit(pieceId, PieceAction.PUT, data.length);
        uploadSession().run(new ScriptedStream<PieceUploadRequest, PieceUploadResponse>(
                uploadScript(limit, data, 500)));
        return pieceId;
    }
    
    /**
     * Stores a piece directly, with the given creation time in its header.
     */
    PieceID storeCreatedAt(Instant created) throws StorageException {
        PieceID pieceId = PieceID.newPieceID();
        try (PieceWriter writer = store.writer(satellite.getSatelliteId(), pieceId, PieceHashAlgorithm.SHA256)) {
            writer.write(new byte[]{1, 2, 3});
            PieceHeader header = new PieceHeader();
            header.setHash(writer.hash());
            header.setCreationTime(created);
            header.setOrderLimit(satellite.unsigned(pieceId, PieceAction.PUT, 3));
            writer.commit(header);
        }
        return pieceId;
    }
    
    static byte[] payload(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i % 251);
        }
        return data;
    }
}
