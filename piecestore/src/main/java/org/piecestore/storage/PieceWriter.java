package org.piecestore.storage;

import org.piecestore.exception.StorageException;
import org.piecestore.orders.PieceHashAlgorithm;
import org.piecestore.orders.PieceHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes one piece to a temporary file and atomically moves it into place on commit.
 * 
 * The payload is appended contiguously and hashed as it is written. Closing
 * a writer that was not committed discards everything written.
 */
public class PieceWriter implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PieceWriter.class);
    
    private final Path tempFile;
    private final Path target;
    private final FileChannel channel;
    private final PieceHasher hasher;
    private long size;
    private byte[] hash;
    private boolean done;
    
    PieceWriter(Path tempFile, Path target, PieceHashAlgorithm hashAlgorithm) throws StorageException {
        this.tempFile = tempFile;
        this.target = target;
        this.hasher = hashAlgorithm.newHasher();
        try {
            this.channel = FileChannel.open(tempFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            this.channel.position(PieceHeader.V1_HEADER_SIZE);
        } catch (IOException e) {
            throw new StorageException("create piece", e);
        }
    }
    
    /**
     * Appends payload bytes at the current end of the piece.
     */
    public void write(byte[] data) throws StorageException {
        checkOpen();
        if (hash != null) {
            throw new StorageException("piece hash already sealed");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            throw new StorageException("write piece", e);
        }
        hasher.update(data);
        size += data.length;
    }
    
    /**
     * Number of payload bytes written so far.
     */
    public long size() {
        return size;
    }
    
    /**
     * Seals and returns the content hash. No further writes are accepted.
     */
    public byte[] hash() {
        if (hash == null) {
            hash = hasher.digest();
        }
        return hash.clone();
    }
    
    /**
     * Writes the header into the reserved area and makes the piece visible.
     * Fails if a piece is already stored under the same name.
     */
    public void commit(PieceHeader header) throws StorageException {
        checkOpen();
        header.setFormatVersion(FormatVersion.FORMAT_V1);
        byte[] encoded = header.encode();
        if (encoded.length > PieceHeader.V1_HEADER_SIZE - PieceHeader.V1_LENGTH_PREFIX_SIZE) {
            throw new StorageException("piece header too large: " + encoded.length + " bytes");
        }
        
        ByteBuffer headerArea = ByteBuffer.allocate(PieceHeader.V1_HEADER_SIZE);
        headerArea.putShort((short) encoded.length);
        headerArea.put(encoded);
        headerArea.rewind();
        
        try {
            while (headerArea.hasRemaining()) {
                channel.write(headerArea, headerArea.position());
            }
            channel.force(true);
            channel.close();
            Files.createDirectories(target.getParent());
            // linking fails if the piece exists, so a stored piece is never replaced
            Files.createLink(target, tempFile);
        } catch (FileAlreadyExistsException e) {
            discard();
            throw new StorageException("piece already stored at " + target);
        } catch (IOException e) {
            discard();
            throw new StorageException("commit piece", e);
        }
        done = true;
        try {
            Files.delete(tempFile);
        } catch (IOException e) {
            logger.warn("Error deleting temporary piece {}", tempFile, e);
        }
        logger.debug("Committed piece to {}", target);
    }
    
    /**
     * Discards everything written. Safe to call more than once.
     */
    public void cancel() {
        if (done) {
            return;
        }
        discard();
    }
    
    private void discard() {
        done = true;
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing temporary piece {}", tempFile, e);
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Error deleting temporary piece {}", tempFile, e);
        }
    }
    
    private void checkOpen() throws StorageException {
        if (done) {
            throw new StorageException("piece writer already closed");
        }
    }
    
    @Override
    public void close() {
        cancel();
    }
}
