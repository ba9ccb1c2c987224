package org.piecestore.orders;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceIdException;
import org.piecestore.identity.NodeID;
import org.piecestore.identity.PieceID;
import org.piecestore.protocol.WireReader;
import org.piecestore.protocol.WireWriter;

import java.time.Instant;

/**
 * Signed authorization, issued by a satellite, bounding how many bytes of a
 * piece one uplink may transfer to or from one storage node within a time window.
 * 
 * The satellite signature covers the encoding of every other field.
 */
public class OrderLimit {
    
    private static final int TAG_SERIAL_NUMBER = 1;
    private static final int TAG_SATELLITE_ID = 2;
    private static final int TAG_UPLINK_PUBLIC_KEY = 3;
    private static final int TAG_STORAGE_NODE_ID = 4;
    private static final int TAG_PIECE_ID = 5;
    private static final int TAG_LIMIT = 6;
    private static final int TAG_ACTION = 7;
    private static final int TAG_PIECE_EXPIRATION = 8;
    private static final int TAG_ORDER_EXPIRATION = 9;
    private static final int TAG_ORDER_CREATION = 10;
    private static final int TAG_SATELLITE_SIGNATURE = 11;
    
    private SerialNumber serialNumber;
    private NodeID satelliteId;
    private byte[] uplinkPublicKey;
    private NodeID storageNodeId;
    private PieceID pieceId;
    private long limit;
    private PieceAction action = PieceAction.INVALID;
    private Instant pieceExpiration;
    private Instant orderExpiration;
    private Instant orderCreation;
    private byte[] satelliteSignature;
    
    public OrderLimit() {
    }
    
    /**
     * Encodes the order limit including its signature.
     */
    public byte[] encode() {
        return encode(true);
    }
    
    /**
     * Encodes the bytes the satellite signs: every field except the signature.
     */
    public byte[] encodeForSigning() {
        return encode(false);
    }
    
    private byte[] encode(boolean withSignature) {
        WireWriter writer = new WireWriter()
                .writeBytes(TAG_SERIAL_NUMBER, serialNumber == null ? null : serialNumber.getBytes())
                .writeBytes(TAG_SATELLITE_ID, satelliteId == null ? null : satelliteId.getBytes())
                .writeBytes(TAG_UPLINK_PUBLIC_KEY, uplinkPublicKey)
                .writeBytes(TAG_STORAGE_NODE_ID, storageNodeId == null ? null : storageNodeId.getBytes())
                .writeBytes(TAG_PIECE_ID, pieceId == null ? null : pieceId.getBytes())
                .writeLong(TAG_LIMIT, limit)
                .writeInt(TAG_ACTION, action.getCode())
                .writeInstant(TAG_PIECE_EXPIRATION, pieceExpiration)
                .writeInstant(TAG_ORDER_EXPIRATION, orderExpiration)
                .writeInstant(TAG_ORDER_CREATION, orderCreation);
        if (withSignature) {
            writer.writeBytes(TAG_SATELLITE_SIGNATURE, satelliteSignature);
        }
        return writer.toByteArray();
    }
    
    public static OrderLimit decode(byte[] data) throws InvalidArgumentException {
        OrderLimit limit = new OrderLimit();
        WireReader reader = new WireReader(data);
        try {
            while (reader.next()) {
                switch (reader.tag()) {
                    case TAG_SERIAL_NUMBER:
                        limit.serialNumber = SerialNumber.fromBytes(reader.bytes());
                        break;
                    case TAG_SATELLITE_ID:
                        limit.satelliteId = NodeID.fromBytes(reader.bytes());
                        break;
                    case TAG_UPLINK_PUBLIC_KEY:
                        limit.uplinkPublicKey = reader.bytes();
                        break;
                    case TAG_STORAGE_NODE_ID:
                        limit.storageNodeId = NodeID.fromBytes(reader.bytes());
                        break;
                    case TAG_PIECE_ID:
                        limit.pieceId = PieceID.fromBytes(reader.bytes());
                        break;
                    case TAG_LIMIT:
                        limit.limit = reader.longValue();
                        break;
                    case TAG_ACTION:
                        limit.action = PieceAction.fromCode(reader.intValue());
                        break;
                    case TAG_PIECE_EXPIRATION:
                        limit.pieceExpiration = reader.instant();
                        break;
                    case TAG_ORDER_EXPIRATION:
                        limit.orderExpiration = reader.instant();
                        break;
                    case TAG_ORDER_CREATION:
                        limit.orderCreation = reader.instant();
                        break;
                    case TAG_SATELLITE_SIGNATURE:
                        limit.satelliteSignature = reader.bytes();
                        break;
                    default:
                        break;
                }
            }
        } catch (PieceIdException | IllegalArgumentException e) {
            throw new InvalidArgumentException("order limit: " + e.getMessage());
        }
        return limit;
    }
    
    public SerialNumber getSerialNumber() {
        return serialNumber;
    }
    
    public void setSerialNumber(SerialNumber serialNumber) {
        this.serialNumber = serialNumber;
    }
    
    public NodeID getSatelliteId() {
        return satelliteId;
    }
    
    public void setSatelliteId(NodeID satelliteId) {
        this.satelliteId = satelliteId;
    }
    
    public byte[] getUplinkPublicKey() {
        return uplinkPublicKey;
    }
    
    public void setUplinkPublicKey(byte[] uplinkPublicKey) {
        this.uplinkPublicKey = uplinkPublicKey;
    }
    
    public NodeID getStorageNodeId() {
        return storageNodeId;
    }
    
    public void setStorageNodeId(NodeID storageNodeId) {
        this.storageNodeId = storageNodeId;
    }
    
    public PieceID getPieceId() {
        return pieceId;
    }
    
    public void setPieceId(PieceID pieceId) {
        this.pieceId = pieceId;
    }
    
    /**
     * Maximum number of bytes this order limit allows to transfer.
     */
    public long getLimit() {
        return limit;
    }
    
    public void setLimit(long limit) {
        this.limit = limit;
    }
    
    public PieceAction getAction() {
        return action;
    }
    
    public void setAction(PieceAction action) {
        this.action = action;
    }
    
    /**
     * When the stored piece may be removed; null if it never expires.
     */
    public Instant getPieceExpiration() {
        return pieceExpiration;
    }
    
    public void setPieceExpiration(Instant pieceExpiration) {
        this.pieceExpiration = pieceExpiration;
    }
    
    public Instant getOrderExpiration() {
        return orderExpiration;
    }
    
    public void setOrderExpiration(Instant orderExpiration) {
        this.orderExpiration = orderExpiration;
    }
    
    public Instant getOrderCreation() {
        return orderCreation;
    }
    
    public void setOrderCreation(Instant orderCreation) {
        this.orderCreation = orderCreation;
    }
    
    public byte[] getSatelliteSignature() {
        return satelliteSignature;
    }
    
    public void setSatelliteSignature(byte[] satelliteSignature) {
        this.satelliteSignature = satelliteSignature;
    }
    
    @Override
    public String toString() {
        return "OrderLimit{" +
                "serialNumber=" + serialNumber +
                ", satelliteId=" + satelliteId +
                ", storageNodeId=" + storageNodeId +
                ", pieceId=" + pieceId +
                ", limit=" + limit +
                ", action=" + action +
                ", orderExpiration=" + orderExpiration +
                '}';
    }
}
