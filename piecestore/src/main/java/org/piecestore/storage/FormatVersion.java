package org.piecestore.storage;

/**
 * On-disk storage format of a piece.
 */
public enum FormatVersion {
    
    /**
     * Payload only; the header lives in a sidecar file next to the blob.
     */
    FORMAT_V0(0, ""),
    
    /**
     * Fixed-size header area followed by the payload in one file.
     */
    FORMAT_V1(1, ".sj1");
    
    private final int code;
    private final String extension;
    
    FormatVersion(int code, String extension) {
        this.code = code;
        this.extension = extension;
    }
    
    public int getCode() {
        return code;
    }
    
    /**
     * File name extension of blobs stored in this format.
     */
    public String getExtension() {
        return extension;
    }
    
    public static FormatVersion fromCode(int code) {
        for (FormatVersion version : values()) {
            if (version.code == code) {
                return version;
            }
        }
        throw new IllegalArgumentException("unknown storage format version: " + code);
    }
}
