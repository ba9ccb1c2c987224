package org.piecestore.storage;

import org.piecestore.exception.PieceNotFoundException;
import org.piecestore.exception.StorageException;
import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;
import org.piecestore.orders.PieceHashAlgorithm;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage for piece payloads and their headers, partitioned by satellite.
 * 
 * Implementations must be safe for concurrent use by many sessions.
 */
public interface PieceStore {
    
    /**
     * Starts writing a new piece. Nothing becomes visible until the writer is committed.
     */
    PieceWriter writer(NodeID satelliteId, PieceID pieceId, PieceHashAlgorithm hashAlgorithm)
            throws StorageException;
    
    /**
     * Opens a stored piece for reading.
     */
    PieceReader reader(NodeID satelliteId, PieceID pieceId) throws PieceNotFoundException, StorageException;
    
    boolean exists(NodeID satelliteId, PieceID pieceId) throws StorageException;
    
    /**
     * Permanently deletes a piece in whichever format it is stored.
     * 
     * @return false if the piece was not stored
     */
    boolean delete(NodeID satelliteId, PieceID pieceId) throws StorageException;
    
    /**
     * Moves a piece to the satellite's trash.
     * 
     * @return false if the piece was not stored
     */
    boolean trash(NodeID satelliteId, PieceID pieceId) throws StorageException;
    
    /**
     * Moves every trashed piece of the satellite back into the live set.
     * 
     * @return number of restored pieces
     */
    int restoreTrash(NodeID satelliteId) throws StorageException;
    
    /**
     * Permanently deletes trashed pieces of every satellite trashed before the given time.
     * 
     * @return number of deleted pieces
     */
    int emptyTrash(Instant trashedBefore) throws StorageException;
    
    /**
     * Lists the live pieces of a satellite.
     */
    List<StoredPiece> listPieces(NodeID satelliteId) throws StorageException;
    
    /**
     * Lists satellites with a namespace in this store.
     */
    List<NodeID> listSatellites() throws StorageException;
}
