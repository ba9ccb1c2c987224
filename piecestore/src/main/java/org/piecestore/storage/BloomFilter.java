package org.piecestore.storage;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.identity.PieceID;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.SecureRandom;

/**
 * Bloom filter over piece IDs, used by retain requests to describe the pieces to keep.
 * 
 * Piece IDs are already uniformly random, so hash positions are read
 * directly from sub-ranges of the ID bytes instead of hashing them again.
 * 
 * Serialized form:
 * - 1 byte: version (1)
 * - 1 byte: seed, the first ID offset to read from
 * - 1 byte: hash count
 * - remaining bytes: the bit table
 */
public class BloomFilter {
    
    public static final int VERSION = 1;
    
    private static final int HEADER_LEN = 3;
    private static final int MAX_HASH_COUNT = 32;
    private static final int SUBRANGE_LEN = 9;
    private static final int[] RANGE_OFFSETS = {9, 13, 19, 23};
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final int seed;
    private final int hashCount;
    private final byte[] table;
    
    BloomFilter(int seed, int hashCount, int sizeInBytes) {
        this(seed, hashCount, new byte[sizeInBytes]);
    }
    
    private BloomFilter(int seed, int hashCount, byte[] table) {
        this.seed = seed;
        this.hashCount = hashCount;
        this.table = table;
    }
    
    /**
     * Creates a filter sized for the expected number of elements and false positive rate.
     */
    public static BloomFilter newOptimal(int expectedElements, double falsePositiveRate) {
        if (expectedElements <= 0 || falsePositiveRate <= 0 || falsePositiveRate >= 1) {
            throw new IllegalArgumentException("invalid bloom filter parameters");
        }
        double bitsPerElement = -1.44 * Math.log(falsePositiveRate) / Math.log(2);
        int hashCount = Math.min(MAX_HASH_COUNT, (int) Math.ceil(bitsPerElement * Math.log(2)));
        int sizeInBytes = Math.max(1, (int) Math.ceil(expectedElements * bitsPerElement / 8));
        return new BloomFilter(RANDOM.nextInt(PieceID.SIZE), Math.max(1, hashCount), sizeInBytes);
    }
    
    /**
     * Parses a serialized filter.
     */
    public static BloomFilter fromBytes(byte[] data) throws InvalidArgumentException {
        if (data == null || data.length <= HEADER_LEN) {
            throw new InvalidArgumentException("bloom filter: not enough data");
        }
        if ((data[0] & 0xFF) != VERSION) {
            throw new InvalidArgumentException("bloom filter: unsupported version " + (data[0] & 0xFF));
        }
        int seed = data[1] & 0xFF;
        int hashCount = data[2] & 0xFF;
        if (seed >= PieceID.SIZE) {
            throw new InvalidArgumentException("bloom filter: invalid seed " + seed);
        }
        if (hashCount == 0 || hashCount > MAX_HASH_COUNT) {
            throw new InvalidArgumentException("bloom filter: invalid hash count " + hashCount);
        }
        byte[] table = new byte[data.length - HEADER_LEN];
        System.arraycopy(data, HEADER_LEN, table, 0, table.length);
        return new BloomFilter(seed, hashCount, table);
    }
    
    public void add(PieceID pieceId) {
        byte[] id = pieceId.getBytes();
        int offset = seed;
        int rangeOffset = RANGE_OFFSETS[seed % RANGE_OFFSETS.length];
        for (int k = 0; k < hashCount; k++) {
            ByteBuffer range = subrange(offset, id);
            long hash = range.getLong();
            int bit = range.get() & 0xFF;
            offset = nextOffset(offset, rangeOffset);
            int bucket = (int) Long.remainderUnsigned(hash, table.length);
            table[bucket] |= (byte) (1 << (bit % 8));
        }
    }
    
    /**
     * Returns true if the piece may be in the set. False positives are possible,
     * false negatives are not.
     */
    public boolean contains(PieceID pieceId) {
        byte[] id = pieceId.getBytes();
        int offset = seed;
        int rangeOffset = RANGE_OFFSETS[seed % RANGE_OFFSETS.length];
        for (int k = 0; k < hashCount; k++) {
            ByteBuffer range = subrange(offset, id);
            long hash = range.getLong();
            int bit = range.get() & 0xFF;
            offset = nextOffset(offset, rangeOffset);
            int bucket = (int) Long.remainderUnsigned(hash, table.length);
            if ((table[bucket] & (1 << (bit % 8))) == 0) {
                return false;
            }
        }
        return true;
    }
    
    public byte[] toBytes() {
        byte[] data = new byte[HEADER_LEN + table.length];
        data[0] = (byte) VERSION;
        data[1] = (byte) seed;
        data[2] = (byte) hashCount;
        System.arraycopy(table, 0, data, HEADER_LEN, table.length);
        return data;
    }
    
    public int getHashCount() {
        return hashCount;
    }
    
    public int getSizeInBytes() {
        return table.length;
    }
    
    private static int nextOffset(int offset, int rangeOffset) {
        offset += rangeOffset;
        if (offset >= PieceID.SIZE) {
            offset -= PieceID.SIZE;
        }
        return offset;
    }
    
    /**
     * Reads 9 bytes of the ID starting at the offset, wrapping around its end.
     * The first 8 are a little-endian hash and the last selects the bit.
     */
    private static ByteBuffer subrange(int offset, byte[] id) {
        byte[] range = new byte[SUBRANGE_LEN];
        for (int i = 0; i < SUBRANGE_LEN; i++) {
            range[i] = id[(offset + i) % id.length];
        }
        return ByteBuffer.wrap(range).order(ByteOrder.LITTLE_ENDIAN);
    }
}
