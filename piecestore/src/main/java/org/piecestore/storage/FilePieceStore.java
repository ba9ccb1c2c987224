package org.piecestore.storage;

import org.piecestore.exception.PieceIdException;
import org.piecestore.exception.PieceNotFoundException;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.PieceHashAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Piece store keeping every piece in its own file.
 * 
 * Directory layout under the root:
 * <pre>
 * blobs/&lt;satellite&gt;/&lt;first two chars of piece ID&gt;/&lt;rest of piece ID&gt;.sj1   V1 piece
 * blobs/&lt;satellite&gt;/&lt;first two chars of piece ID&gt;/&lt;rest of piece ID&gt;       V0 payload
 * blobs/&lt;satellite&gt;/&lt;first two chars of piece ID&gt;/&lt;rest of piece ID&gt;.v0hdr V0 header
 * trash/...   same layout as blobs, file times record when a piece was trashed
 * temp/       uploads in progress
 * </pre>
 */
public class FilePieceStore implements PieceStore {
    
    private static final Logger logger = LoggerFactory.getLogger(FilePieceStore.class);
    
    static final String V0_HEADER_EXTENSION = ".v0hdr";
    private static final String PARTIAL_EXTENSION = ".partial";
    private static final int PREFIX_LEN = 2;
    
    private final Path blobsDir;
    private final Path trashDir;
    private final Path tempDir;
    private final Clock clock;
    
    public FilePieceStore(Path root) throws StorageException {
        this(root, Clock.systemUTC());
    }
    
    public FilePieceStore(Path root, Clock clock) throws StorageException {
        this.blobsDir = root.resolve("blobs");
        this.trashDir = root.resolve("trash");
        this.tempDir = root.resolve("temp");
        this.clock = clock;
        try {
            Files.createDirectories(blobsDir);
            Files.createDirectories(trashDir);
            Files.createDirectories(tempDir);
        } catch (IOException e) {
            throw new StorageException("initialize piece store", e);
        }
        logger.info("Piece store initialized at {}", root);
    }
    
    @Override
    public PieceWriter writer(NodeID satelliteId, PieceID pieceId, PieceHashAlgorithm hashAlgorithm)
            throws StorageException {
        Path temp = tempDir.resolve(UUID.randomUUID() + PARTIAL_EXTENSION);
        return new PieceWriter(temp, blobPath(blobsDir, satelliteId, pieceId, FormatVersion.FORMAT_V1), hashAlgorithm);
    }
    
    @Override
    public PieceReader reader(NodeID satelliteId, PieceID pieceId) throws PieceNotFoundException, StorageException {
        for (FormatVersion version : new FormatVersion[]{FormatVersion.FORMAT_V1, FormatVersion.FORMAT_V0}) {
            Path blob = blobPath(blobsDir, satelliteId, pieceId, version);
            if (!Files.exists(blob)) {
                continue;
            }
            try {
                return new PieceReader(blob, version, sidecarPath(blob));
            } catch (NoSuchFileException e) {
                throw new PieceNotFoundException(pieceId.toString());
            } catch (IOException e) {
                throw new StorageException("open piece", e);
            }
        }
        throw new PieceNotFoundException(pieceId.toString());
    }
    
    @Override
    public boolean exists(NodeID satelliteId, PieceID pieceId) {
        return Files.exists(blobPath(blobsDir, satelliteId, pieceId, FormatVersion.FORMAT_V1))
                || Files.exists(blobPath(blobsDir, satelliteId, pieceId, FormatVersion.FORMAT_V0));
    }
    
    @Override
    public boolean delete(NodeID satelliteId, PieceID pieceId) throws StorageException {
        boolean deleted = false;
        try {
            for (FormatVersion version : FormatVersion.values()) {
                Path blob = blobPath(blobsDir, satelliteId, pieceId, version);
                deleted |= Files.deleteIfExists(blob);
                if (version == FormatVersion.FORMAT_V0) {
                    Files.deleteIfExists(sidecarPath(blob));
                }
            }
        } catch (IOException e) {
            throw new StorageException("delete piece", e);
        }
        if (deleted) {
            logger.debug("Deleted piece {}/{}", satelliteId, pieceId);
        }
        return deleted;
    }
    
    @Override
    public boolean trash(NodeID satelliteId, PieceID pieceId) throws StorageException {
        FileTime now = FileTime.from(clock.instant());
        boolean trashed = false;
        try {
            for (FormatVersion version : FormatVersion.values()) {
                Path blob = blobPath(blobsDir, satelliteId, pieceId, version);
                if (!Files.exists(blob)) {
                    continue;
                }
                Path target = blobPath(trashDir, satelliteId, pieceId, version);
                moveFile(blob, target);
                Files.setLastModifiedTime(target, now);
                if (version == FormatVersion.FORMAT_V0 && Files.exists(sidecarPath(blob))) {
                    moveFile(sidecarPath(blob), sidecarPath(target));
                }
                trashed = true;
            }
        } catch (IOException e) {
            throw new StorageException("trash piece", e);
        }
        return trashed;
    }
    
    @Override
    public int restoreTrash(NodeID satelliteId) throws StorageException {
        Path namespace = trashDir.resolve(satelliteId.toString());
        if (!Files.isDirectory(namespace)) {
            return 0;
        }
        int restored = 0;
        for (Path file : listFiles(namespace)) {
            try {
                moveFile(file, blobsDir.resolve(trashDir.relativize(file)));
            } catch (IOException e) {
                throw new StorageException("restore piece", e);
            }
            if (!isSidecar(file)) {
                restored++;
            }
        }
        logger.info("Restored {} pieces from trash for satellite {}", restored, satelliteId);
        return restored;
    }
    
    @Override
    public int emptyTrash(Instant trashedBefore) throws StorageException {
        int deleted = 0;
        for (Path file : listFiles(trashDir)) {
            if (isSidecar(file)) {
                continue;
            }
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(trashedBefore)) {
                    Files.deleteIfExists(file);
                    Files.deleteIfExists(sidecarPath(file));
                    deleted++;
                }
            } catch (IOException e) {
                throw new StorageException("empty trash", e);
            }
        }
        if (deleted > 0) {
            logger.info("Emptied {} pieces trashed before {}", deleted, trashedBefore);
        }
        return deleted;
    }
    
    @Override
    public List<StoredPiece> listPieces(NodeID satelliteId) throws StorageException {
        Path namespace = blobsDir.resolve(satelliteId.toString());
        List<StoredPiece> pieces = new ArrayList<>();
        if (!Files.isDirectory(namespace)) {
            return pieces;
        }
        for (Path file : listFiles(namespace)) {
            if (isSidecar(file)) {
                continue;
            }
            String name = file.getFileName().toString();
            FormatVersion version = name.endsWith(FormatVersion.FORMAT_V1.getExtension())
                    ? FormatVersion.FORMAT_V1 : FormatVersion.FORMAT_V0;
            String rest = name.substring(0, name.length() - version.getExtension().length());
            String encoded = file.getParent().getFileName().toString() + rest;
            
            PieceID pieceId;
            try {
                pieceId = PieceID.fromString(encoded);
            } catch (PieceIdException e) {
                logger.warn("Skipping unrecognized file {} in piece store", file);
                continue;
            }
            
            try (PieceReader reader = new PieceReader(file, version, sidecarPath(file))) {
                PieceHeader header = reader.readHeader();
                pieces.add(new StoredPiece(pieceId, version, header.getCreationTime(), reader.size()));
            } catch (IOException | StorageException e) {
                logger.warn("Skipping piece {} with unreadable header: {}", pieceId, e.getMessage());
            }
        }
        return pieces;
    }
    
    @Override
    public List<NodeID> listSatellites() throws StorageException {
        List<NodeID> satellites = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(blobsDir)) {
            for (Path dir : stream) {
                try {
                    satellites.add(NodeID.fromString(dir.getFileName().toString()));
                } catch (PieceIdException e) {
                    logger.warn("Skipping unrecognized namespace {}", dir);
                }
            }
        } catch (IOException e) {
            throw new StorageException("list satellites", e);
        }
        return satellites;
    }
    
    static Path blobPath(Path base, NodeID satelliteId, PieceID pieceId, FormatVersion version) {
        String encoded = pieceId.toString();
        return base.resolve(satelliteId.toString())
                .resolve(encoded.substring(0, PREFIX_LEN))
                .resolve(encoded.substring(PREFIX_LEN) + version.getExtension());
    }
    
    static Path sidecarPath(Path blob) {
        return blob.resolveSibling(blob.getFileName().toString() + V0_HEADER_EXTENSION);
    }
    
    private static boolean isSidecar(Path file) {
        return file.getFileName().toString().endsWith(V0_HEADER_EXTENSION);
    }
    
    private static void moveFile(Path source, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
    
    private static List<Path> listFiles(Path dir) throws StorageException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("walk " + dir, e);
        }
    }
}
