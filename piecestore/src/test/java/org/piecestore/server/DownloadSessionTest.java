package org.piecestore.server;

import org.piecestore.exception.AuthorizationException;
import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceNotFoundException;
import org.piecestore.exception.SequencingException;
import org.piecestore.exception.SessionCancelledException;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.OrderLimit;
import org.piecestore.orders.PieceAction;
import org.piecestore.orders.PieceHash;
import org.piecestore.orders.Signing;
import org.piecestore.protocol.PieceDownloadRequest;
import org.piecestore.protocol.PieceDownloadResponse;
import org.piecestore.protocol.PieceUploadRequest;
import org.piecestore.protocol.PieceUploadResponse;
import org.piecestore.storage.PieceKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DownloadSession.
 */
class DownloadSessionTest {
    
    @TempDir
    Path root;
    
    private NodeFixture fixture;
    private byte[] data;
    private PieceID pieceId;
    
    @BeforeEach
    void setUp() throws Exception {
        fixture = new NodeFixture(root);
        data = NodeFixture.payload(1000);
        pieceId = fixture.upload(data);
    }
    
    private static byte[] payloadOf(List<PieceDownloadResponse> responses) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (PieceDownloadResponse response : responses) {
            if (response.getChunk() != null) {
                byte[] chunk = response.getChunk().getData();
                out.write(chunk, 0, chunk.length);
            }
        }
        return out.toByteArray();
    }
    
    private static int chunkCount(List<PieceDownloadResponse> responses) {
        int count = 0;
        for (PieceDownloadResponse response : responses) {
            if (response.getChunk() != null) {
                count++;
            }
        }
        return count;
    }
    
    @Test
    void testDownload_PartialRange() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 100, 200),
                PieceDownloadRequest.ofOrder(fixture.order(limit, 200)));
        
        DownloadSession session = fixture.downloadSession(4096);
        assertEquals(200, session.run(stream));
        assertEquals(SessionState.DONE, session.getState());
        
        PieceDownloadResponse first = stream.getSent().get(0);
        assertNotNull(first.getHash());
        assertNull(first.getChunk());
        assertEquals(100, stream.getSent().get(1).getChunk().getOffset());
        assertArrayEquals(Arrays.copyOfRange(data, 100, 300), payloadOf(stream.getSent()));
        assertEquals(0, fixture.locks.activeCount());
    }
    
    @Test
    void testDownload_HashSignedByUplink() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET_REPAIR, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 0, 10));
        fixture.downloadSession(4096).run(stream);
        
        PieceDownloadResponse first = stream.getSent().get(0);
        PieceHash hash = first.getHash();
        assertEquals(pieceId, hash.getPieceId());
        assertEquals(1000, hash.getPieceSize());
        assertEquals(PieceAction.PUT, first.getLimit().getAction());
        assertTrue(Signing.verifyPieceHashSignature(
                Signing.decodePublicKey(first.getLimit().getUplinkPublicKey()), hash));
        assertTrue(Signing.verifyOrderLimitSignature(
                fixture.satellite.getSatellite().getPublicKey(), first.getLimit()));
    }
    
    @Test
    void testDownload_ChunksCappedByMaxSize() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 0, 1000),
                PieceDownloadRequest.ofOrder(fixture.order(limit, 1000)));
        
        assertEquals(1000, fixture.downloadSession(256).run(stream));
        assertEquals(4, chunkCount(stream.getSent()));
        for (PieceDownloadResponse response : stream.getSent()) {
            if (response.getChunk() != null) {
                assertTrue(response.getChunk().getData().length <= 256);
            }
        }
        assertArrayEquals(data, payloadOf(stream.getSent()));
    }
    
    @Test
    void testDownload_StopsAtOrderedAmount() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 0, 1000),
                PieceDownloadRequest.ofOrder(fixture.order(limit, 300)));
        
        assertEquals(300, fixture.downloadSession(4096).run(stream));
        assertArrayEquals(Arrays.copyOfRange(data, 0, 300), payloadOf(stream.getSent()));
    }
    
    @Test
    void testDownload_NothingSentWithoutOrder() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 0, 500));
        
        assertEquals(0, fixture.downloadSession(4096).run(stream));
        assertEquals(1, stream.getSent().size());
    }
    
    @Test
    void testDownload_FurtherRangesOnSameStream() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream = new ScriptedStream<>(
                PieceDownloadRequest.ofLimit(limit, 0, 100),
                PieceDownloadRequest.ofOrder(fixture.order(limit, 100)),
                PieceDownloadRequest.ofChunk(900, 100),
                PieceDownloadRequest.ofOrder(fixture.order(limit, 200)));
        
        assertEquals(200, fixture.downloadSession(4096).run(stream));
        byte[] expected = new byte[200];
        System.arraycopy(data, 0, expected, 0, 100);
        System.arraycopy(data, 900, expected, 100, 100);
        assertArrayEquals(expected, payloadOf(stream.getSent()));
    }
    
    @Test
    void testDownload_MoreThanAvailable() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 5000);
        DownloadSession session = fixture.downloadSession(4096);
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> session.run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 500, 1000))));
        assertTrue(e.getMessage().contains("requested more data than available"));
        assertEquals(SessionState.FAILED, session.getState());
        assertEquals(0, fixture.locks.activeCount());
    }
    
    @Test
    void testDownload_ChunkSizeOverflow() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        DownloadSession session = fixture.downloadSession(4096);
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> session.run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 1, Long.MAX_VALUE))));
        assertTrue(e.getMessage().contains("requested more data than available"));
        assertEquals(0, fixture.locks.activeCount());
    }
    
    @Test
    void testDownload_CancelAfterFirstChunk() throws Exception {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        DownloadSession session = fixture.downloadSession(256);
        ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream =
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 1000),
                        PieceDownloadRequest.ofOrder(fixture.order(limit, 1000))) {
                    @Override
                    public void send(PieceDownloadResponse message) {
                        super.send(message);
                        if (message.getChunk() != null) {
                            session.cancel();
                        }
                    }
                };
        
        assertThrows(SessionCancelledException.class, () -> session.run(stream));
        assertEquals(SessionState.FAILED, session.getState());
        assertEquals(1, chunkCount(stream.getSent()));
        assertArrayEquals(Arrays.copyOfRange(data, 0, 256), payloadOf(stream.getSent()));
        assertFalse(fixture.locks.isBusy(new PieceKey(fixture.satellite.getSatelliteId(), pieceId)));
        assertTrue(fixture.store.delete(fixture.satellite.getSatelliteId(), pieceId));
    }
    
    @Test
    void testDownload_ConcurrentSessionsOnOnePiece() throws Exception {
        PieceKey key = new PieceKey(fixture.satellite.getSatelliteId(), pieceId);
        CountDownLatch bothActive = new CountDownLatch(2);
        CountDownLatch checked = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
                DownloadSession session = fixture.downloadSession(256);
                ScriptedStream<PieceDownloadRequest, PieceDownloadResponse> stream =
                        new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                                PieceDownloadRequest.ofLimit(limit, 0, 1000),
                                PieceDownloadRequest.ofOrder(fixture.order(limit, 1000))) {
                            @Override
                            public PieceDownloadRequest receive() {
                                if (remaining() == 1) {
                                    bothActive.countDown();
                                    awaitQuietly(checked);
                                }
                                return super.receive();
                            }
                        };
                results.add(executor.submit(() -> {
                    session.run(stream);
                    return stream;
                }));
            }
            
            assertTrue(bothActive.await(5, TimeUnit.SECONDS));
            assertTrue(fixture.locks.isBusy(key));
            OrderLimit put = fixture.satellite.limit(pieceId, PieceAction.PUT, 1000);
            assertThrows(InvalidArgumentException.class, () -> fixture.uploadSession().run(
                    new ScriptedStream<PieceUploadRequest, PieceUploadResponse>(
                            fixture.uploadScript(put, NodeFixture.payload(1000), 500))));
            checked.countDown();
            
            for (Future<ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>> result : results) {
                assertArrayEquals(data, payloadOf(result.get(5, TimeUnit.SECONDS).getSent()));
            }
        } finally {
            executor.shutdownNow();
        }
        assertFalse(fixture.locks.isBusy(key));
        assertEquals(0, fixture.locks.activeCount());
    }
    
    private static void awaitQuietly(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrupted");
        }
    }
    
    @Test
    void testDownload_RequestsBeyondLimit() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 150);
        assertThrows(AuthorizationException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 100),
                        PieceDownloadRequest.ofChunk(100, 100))));
    }
    
    @Test
    void testDownload_InvalidChunk() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        assertThrows(InvalidArgumentException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, -1, 100))));
    }
    
    @Test
    void testDownload_MissingPiece() {
        OrderLimit limit = fixture.satellite.limit(PieceID.newPieceID(), PieceAction.GET, 1000);
        assertThrows(PieceNotFoundException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 10))));
        assertEquals(0, fixture.locks.activeCount());
    }
    
    @Test
    void testDownload_WrongAction() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.PUT, 1000);
        assertThrows(AuthorizationException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 10))));
    }
    
    @Test
    void testDownload_FirstMessageWithoutChunk() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        PieceDownloadRequest request = new PieceDownloadRequest();
        request.setLimit(limit);
        assertThrows(InvalidArgumentException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(request)));
    }
    
    @Test
    void testDownload_SecondLimit() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        OrderLimit other = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        assertThrows(SequencingException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 10),
                        PieceDownloadRequest.ofLimit(other, 10, 10))));
    }
    
    @Test
    void testDownload_OrderWithForeignSerial() {
        OrderLimit limit = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        OrderLimit other = fixture.satellite.limit(pieceId, PieceAction.GET, 1000);
        assertThrows(AuthorizationException.class, () -> fixture.downloadSession(4096).run(
                new ScriptedStream<PieceDownloadRequest, PieceDownloadResponse>(
                        PieceDownloadRequest.ofLimit(limit, 0, 10),
                        PieceDownloadRequest.ofOrder(fixture.order(other, 10)))));
    }
}
