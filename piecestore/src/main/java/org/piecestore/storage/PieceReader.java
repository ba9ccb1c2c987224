package org.piecestore.storage;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads the payload and header of one stored piece.
 * 
 * Payload offsets are relative to the start of the piece content, whatever
 * the storage format puts in front of it.
 */
public class PieceReader implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PieceReader.class);
    
    private final Path blob;
    private final FormatVersion formatVersion;
    private final Path sidecar;
    private final FileChannel channel;
    private final long contentOffset;
    private final long contentSize;
    
    PieceReader(Path blob, FormatVersion formatVersion, Path sidecar) throws IOException {
        this.blob = blob;
        this.formatVersion = formatVersion;
        this.sidecar = sidecar;
        this.channel = FileChannel.open(blob, StandardOpenOption.READ);
        this.contentOffset = formatVersion == FormatVersion.FORMAT_V1 ? PieceHeader.V1_HEADER_SIZE : 0;
        long fileSize = channel.size();
        if (fileSize < contentOffset) {
            channel.close();
            throw new IOException("piece file " + blob + " shorter than its header");
        }
        this.contentSize = fileSize - contentOffset;
    }
    
    public FormatVersion getFormatVersion() {
        return formatVersion;
    }
    
    /**
     * Payload size, excluding the header.
     */
    public long size() {
        return contentSize;
    }
    
    /**
     * Reads the persisted header.
     */
    public PieceHeader readHeader() throws StorageException {
        byte[] encoded;
        try {
            if (formatVersion == FormatVersion.FORMAT_V1) {
                ByteBuffer area = ByteBuffer.allocate(PieceHeader.V1_HEADER_SIZE);
                readFully(area, 0);
                area.flip();
                int length = area.getShort() & 0xFFFF;
                if (length > PieceHeader.V1_HEADER_SIZE - PieceHeader.V1_LENGTH_PREFIX_SIZE) {
                    throw new StorageException("corrupted piece header in " + blob);
                }
                encoded = new byte[length];
                area.get(encoded);
            } else {
                encoded = Files.readAllBytes(sidecar);
            }
        } catch (IOException e) {
            throw new StorageException("read piece header", e);
        }
        
        try {
            PieceHeader header = PieceHeader.decode(encoded);
            header.setFormatVersion(formatVersion);
            return header;
        } catch (InvalidArgumentException e) {
            throw new StorageException("corrupted piece header in " + blob + ": " + e.getMessage());
        }
    }
    
    /**
     * Reads a range of the payload.
     */
    public byte[] read(long offset, int length) throws StorageException {
        if (offset < 0 || length < 0 || offset + length > contentSize) {
            throw new StorageException("read of " + length + " bytes at " + offset
                    + " outside piece of " + contentSize + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try {
            readFully(buffer, contentOffset + offset);
        } catch (IOException e) {
            throw new StorageException("read piece", e);
        }
        return buffer.array();
    }
    
    private void readFully(ByteBuffer buffer, long position) throws IOException {
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0) {
                throw new IOException("unexpected end of piece file " + blob);
            }
        }
    }
    
    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing piece {}", blob, e);
        }
    }
}
