package org.piecestore.protocol;

import org.piecestore.exception.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Protocol utility methods for encoding and decoding piece store frames.
 */
public final class ProtocolUtil {
    
    private ProtocolUtil() {
        // Prevent instantiation
    }
    
    /**
     * Maps protocol status codes to exceptions.
     * 
     * @param status Status byte from the frame header
     * @param message Error message carried in the frame body
     * @return the exception to raise, or null on success
     */
    public static PieceStoreException mapStatusToException(byte status, String message) {
        switch (status) {
            case ProtocolConstants.STATUS_SUCCESS:
                return null;
            case ProtocolConstants.STATUS_NOT_FOUND:
                return new PieceNotFoundException(message);
            case ProtocolConstants.STATUS_IO_ERROR:
                return new StorageException(message);
            case ProtocolConstants.STATUS_PERMISSION_DENIED:
                return new AuthorizationException(message);
            case ProtocolConstants.STATUS_INVALID_ARGUMENT:
                return new InvalidArgumentException(message);
            case ProtocolConstants.STATUS_PROTOCOL_ERROR:
                return new SequencingException(message);
            case ProtocolConstants.STATUS_INTEGRITY_ERROR:
                return new IntegrityException(message);
            case ProtocolConstants.STATUS_INVALID_PIECE_ID:
                return new PieceIdException(message);
            default:
                return new ProtocolException(status, message);
        }
    }
    
    /**
     * Maps an exception raised while serving a request to its status code.
     */
    public static byte mapExceptionToStatus(PieceStoreException e) {
        if (e instanceof PieceNotFoundException) {
            return ProtocolConstants.STATUS_NOT_FOUND;
        } else if (e instanceof StorageException) {
            return ProtocolConstants.STATUS_IO_ERROR;
        } else if (e instanceof AuthorizationException) {
            return ProtocolConstants.STATUS_PERMISSION_DENIED;
        } else if (e instanceof InvalidArgumentException) {
            return ProtocolConstants.STATUS_INVALID_ARGUMENT;
        } else if (e instanceof SequencingException) {
            return ProtocolConstants.STATUS_PROTOCOL_ERROR;
        } else if (e instanceof IntegrityException) {
            return ProtocolConstants.STATUS_INTEGRITY_ERROR;
        } else if (e instanceof PieceIdException) {
            return ProtocolConstants.STATUS_INVALID_PIECE_ID;
        } else if (e instanceof ProtocolException) {
            return (byte) ((ProtocolException) e).getCode();
        }
        return ProtocolConstants.STATUS_IO_ERROR;
    }
    
    /**
     * Encodes an error message for the body of an error frame.
     */
    public static byte[] encodeError(String message) {
        return message == null ? new byte[0] : message.getBytes(StandardCharsets.UTF_8);
    }
    
    /**
     * Decodes the body of an error frame.
     */
    public static String decodeError(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        return new String(body, StandardCharsets.UTF_8);
    }
    
    /**
     * Encodes a long value to 8 bytes (big-endian).
     */
    public static byte[] encodeLong(long value) {
        ByteBuffer buffer = ByteBuffer.allocate(8);
        buffer.putLong(value);
        return buffer.array();
    }
    
    /**
     * Decodes 8 bytes to a long value (big-endian).
     */
    public static long decodeLong(byte[] data, int offset) {
        ByteBuffer buffer = ByteBuffer.wrap(data, offset, 8);
        return buffer.getLong();
    }
}
