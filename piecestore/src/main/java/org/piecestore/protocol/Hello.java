package org.piecestore.protocol;

import org.piecestore.exception.InvalidArgumentException;
import org.piecestore.exception.PieceIdException;
import org.piecestore.identity.NodeID;

/**
 * Answer to a {@link Challenge}: the caller's node ID, the public key it
 * is derived from, and a signature over the challenge nonce.
 */
public class Hello implements Message {
    
    private static final int TAG_NODE_ID = 1;
    private static final int TAG_PUBLIC_KEY = 2;
    private static final int TAG_NONCE = 3;
    private static final int TAG_SIGNATURE = 4;
    
    private final NodeID nodeId;
    private final byte[] publicKey;
    private final byte[] nonce;
    private byte[] signature;
    
    public Hello(NodeID nodeId, byte[] publicKey, byte[] nonce) {
        this.nodeId = nodeId;
        this.publicKey = publicKey;
        this.nonce = nonce;
    }
    
    @Override
    public byte command() {
        return ProtocolConstants.CMD_HELLO;
    }
    
    @Override
    public byte[] encode() {
        return new WireWriter()
                .writeBytes(TAG_NODE_ID, nodeId.getBytes())
                .writeBytes(TAG_PUBLIC_KEY, publicKey)
                .writeBytes(TAG_NONCE, nonce)
                .writeBytes(TAG_SIGNATURE, signature)
                .toByteArray();
    }
    
    public byte[] encodeForSigning() {
        return new WireWriter()
                .writeBytes(TAG_NODE_ID, nodeId.getBytes())
                .writeBytes(TAG_PUBLIC_KEY, publicKey)
                .writeBytes(TAG_NONCE, nonce)
                .toByteArray();
    }
    
    public static Hello decode(byte[] data) throws InvalidArgumentException {
        NodeID nodeId = null;
        byte[] publicKey = null;
        byte[] nonce = null;
        byte[] signature = null;
        WireReader reader = new WireReader(data);
        while (reader.next()) {
            switch (reader.tag()) {
                case TAG_NODE_ID:
                    try {
                        nodeId = NodeID.fromBytes(reader.bytes());
                    } catch (PieceIdException e) {
                        throw new InvalidArgumentException(e.getMessage());
                    }
                    break;
                case TAG_PUBLIC_KEY:
                    publicKey = reader.bytes();
                    break;
                case TAG_NONCE:
                    nonce = reader.bytes();
                    break;
                case TAG_SIGNATURE:
                    signature = reader.bytes();
                    break;
                default:
                    break;
            }
        }
        if (nodeId == null) {
            throw new InvalidArgumentException("hello without node ID");
        }
        if (publicKey == null || nonce == null || signature == null) {
            throw new InvalidArgumentException("hello from " + nodeId + " is not signed");
        }
        Hello hello = new Hello(nodeId, publicKey, nonce);
        hello.signature = signature;
        return hello;
    }
    
    public NodeID getNodeId() {
        return nodeId;
    }
    
    public byte[] getPublicKey() {
        return publicKey;
    }
    
    public byte[] getNonce() {
        return nonce;
    }
    
    public byte[] getSignature() {
        return signature;
    }
    
    public void setSignature(byte[] signature) {
        this.signature = signature;
    }
}
