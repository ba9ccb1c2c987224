package org.piecestore.orders;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.protocol.WireReader;
import org.piecestore.protocol.WireWriter;

/**
 * Incremental, uplink-signed claim against an order limit's byte allowance.
 * 
 * The amount is cumulative: each order in a session covers every byte
 * transferred so far, so amounts never decrease.
 */
public class Order {
    
    private static final int TAG_SERIAL_NUMBER = 1;
    private static final int TAG_AMOUNT = 2;
    private static final int TAG_UPLINK_SIGNATURE = 3;
    
    private SerialNumber serialNumber;
    private long amount;
    private byte[] uplinkSignature;
    
    public Order() {
    }
    
    public Order(SerialNumber serialNumber, long amount) {
        this.serialNumber = serialNumber;
        this.amount = amount;
    }
    
    public byte[] encode() {
        return encode(true);
    }
    
    public byte[] encodeForSigning() {
        return encode(false);
    }
    
    private byte[] encode(boolean withSignature) {
        WireWriter writer = new WireWriter()
                .writeBytes(TAG_SERIAL_NUMBER, serialNumber == null ? null : serialNumber.getBytes())
                .writeLong(TAG_AMOUNT, amount);
        if (withSignature) {
            writer.writeBytes(TAG_UPLINK_SIGNATURE, uplinkSignature);
        }
        return writer.toByteArray();
    }
    
    public static Order decode(byte[] data) throws InvalidArgumentException {
        Order order = new Order();
        WireReader reader = new WireReader(data);
        try {
            while (reader.next()) {
                switch (reader.tag()) {
                    case TAG_SERIAL_NUMBER:
                        order.serialNumber = SerialNumber.fromBytes(reader.bytes());
                        break;
                    case TAG_AMOUNT:
                        order.amount = reader.longValue();
                        break;
                    case TAG_UPLINK_SIGNATURE:
                        order.uplinkSignature = reader.bytes();
                        break;
                    default:
                        break;
                }
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("order: " + e.getMessage());
        }
        return order;
    }
    
    public SerialNumber getSerialNumber() {
        return serialNumber;
    }
    
    public void setSerialNumber(SerialNumber serialNumber) {
        this.serialNumber = serialNumber;
    }
    
    public long getAmount() {
        return amount;
    }
    
    public void setAmount(long amount) {
        this.amount = amount;
    }
    
    public byte[] getUplinkSignature() {
        return uplinkSignature;
    }
    
    public void setUplinkSignature(byte[] uplinkSignature) {
        this.uplinkSignature = uplinkSignature;
    }
    
    @Override
    public String toString() {
        return "Order{serialNumber=" + serialNumber + ", amount=" + amount + '}';
    }
}
