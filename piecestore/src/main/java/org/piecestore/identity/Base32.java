package org.piecestore.identity;

import java.util.Arrays;

/**
 * Unpadded base32 codec over the RFC 4648 standard alphabet.
 * 
 * Used for the canonical textual form of piece and node identifiers.
 */
public final class Base32 {
    
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
    private static final int[] DECODE_TABLE = new int[128];
    
    static {
        Arrays.fill(DECODE_TABLE, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            DECODE_TABLE[ALPHABET.charAt(i)] = i;
        }
    }
    
    private Base32() {
        // Prevent instantiation
    }
    
    /**
     * Encodes bytes without trailing padding characters.
     */
    public static String encode(byte[] input) {
        StringBuilder sb = new StringBuilder((input.length * 8 + 4) / 5);
        int buffer = 0;
        int bits = 0;
        for (byte b : input) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                sb.append(ALPHABET.charAt((buffer >> (bits - 5)) & 0x1F));
                bits -= 5;
            }
        }
        if (bits > 0) {
            sb.append(ALPHABET.charAt((buffer << (5 - bits)) & 0x1F));
        }
        return sb.toString();
    }
    
    /**
     * Decodes unpadded base32 text.
     * 
     * @throws IllegalArgumentException if the text contains a character outside
     *         the alphabet or has a length no byte sequence encodes to
     */
    public static byte[] decode(String input) {
        int remainder = input.length() % 8;
        if (remainder == 1 || remainder == 3 || remainder == 6) {
            throw new IllegalArgumentException("illegal base32 data at input byte " + input.length());
        }
        
        byte[] output = new byte[input.length() * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int index = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            int value = c < DECODE_TABLE.length ? DECODE_TABLE[c] : -1;
            if (value < 0) {
                throw new IllegalArgumentException("illegal base32 data at input byte " + i);
            }
            buffer = (buffer << 5) | value;
            bits += 5;
            if (bits >= 8) {
                output[index++] = (byte) (buffer >> (bits - 8));
                bits -= 8;
            }
        }
        return output;
    }
}
