package org.piecestore.orders;

import org.piecestore.identity.Base32;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * 16-byte serial number identifying one order limit.
 */
public final class SerialNumber {
    
    public static final int SIZE = 16;
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final byte[] serial;
    
    private SerialNumber(byte[] serial) {
        this.serial = serial;
    }
    
    public static SerialNumber random() {
        byte[] serial = new byte[SIZE];
        RANDOM.nextBytes(serial);
        return new SerialNumber(serial);
    }
    
    public static SerialNumber fromBytes(byte[] b) {
        if (b == null || b.length != SIZE) {
            throw new IllegalArgumentException("serial number must be " + SIZE + " bytes");
        }
        return new SerialNumber(b.clone());
    }
    
    public byte[] getBytes() {
        return serial.clone();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerialNumber)) return false;
        return Arrays.equals(serial, ((SerialNumber) o).serial);
    }
    
    @Override
    public int hashCode() {
        return Arrays.hashCode(serial);
    }
    
    @Override
    public String toString() {
        return Base32.encode(serial);
    }
}
