package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;

import java.security.SecureRandom;

/**
 * First frame a storage node sends on a connection. The caller proves its
 * node ID by signing the nonce in its {@link Hello}.
 */
public class Challenge implements Message {
    
    public static final int NONCE_LEN = 32;
    
    private static final int TAG_NONCE = 1;
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final byte[] nonce;
    
    public Challenge(byte[] nonce) {
        this.nonce = nonce;
    }
    
    public static Challenge generate() {
        byte[] nonce = new byte[NONCE_LEN];
        RANDOM.nextBytes(nonce);
        return new Challenge(nonce);
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_CHALLENGE;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_NONCE, nonce)
                .toByteArray();
    }
    
    public static Challenge decode(byte[] data) throws InvalidArgumentException {
        byte[] nonce = null;
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            if (reader.tag() == TAG_NONCE) {
                nonce = reader.bytes();
            }
        }
        if (nonce == null || nonce.length != NONCE_LEN) {
            throw new InvalidArgumentException("challenge without a valid nonce");
        }
        return new Challenge(nonce);
    }
    
    public byte[] getNonce() {
        return nonce;
    }
}
