package org.piecestore.orders;

import org.piecestore.identity.NodeID;
import org.piecestore.protocol.Hello;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;

/**
 * Signs and verifies order limits, orders, piece hashes and connection
 * greetings with Ed25519.
 * 
 * A signature always covers the message's encoding without its own
 * signature field.
 */
public final class Signing {
    
    static final String ALGORITHM = "Ed25519";
    
    private Signing() {
        // Prevent instantiation
    }
    
    /**
     * Signs an order limit as the issuing satellite.
     */
    public static OrderLimit signOrderLimit(NodeIdentity satellite, OrderLimit limit) {
        limit.setSatelliteId(satellite.getId());
        limit.setSatelliteSignature(sign(satellite.getPrivateKey(), limit.encodeForSigning()));
        return limit;
    }
    
    public static boolean verifyOrderLimitSignature(PublicKey satelliteKey, OrderLimit limit) {
        return verify(satelliteKey, limit.encodeForSigning(), limit.getSatelliteSignature());
    }
    
    /**
     * Signs an order with the uplink's piece private key.
     */
    public static Order signUplinkOrder(PrivateKey uplinkKey, Order order) {
        order.setUplinkSignature(sign(uplinkKey, order.encodeForSigning()));
        return order;
    }
    
    public static boolean verifyUplinkOrderSignature(PublicKey uplinkKey, Order order) {
        return verify(uplinkKey, order.encodeForSigning(), order.getUplinkSignature());
    }
    
    /**
     * Signs a piece hash, either as uplink or as storage node.
     */
    public static PieceHash signPieceHash(PrivateKey key, PieceHash hash) {
        hash.setSignature(sign(key, hash.encodeForSigning()));
        return hash;
    }
    
    public static boolean verifyPieceHashSignature(PublicKey key, PieceHash hash) {
        return verify(key, hash.encodeForSigning(), hash.getSignature());
    }
    
    /**
     * Signs a connection HELLO with the caller's identity key.
     */
    public static Hello signHello(NodeIdentity identity, Hello hello) {
        hello.setSignature(sign(identity.getPrivateKey(), hello.encodeForSigning()));
        return hello;
    }
    
    /**
     * Checks that a HELLO answers the given nonce, that its public key hashes
     * to the claimed node ID, and that the key signed it.
     */
    public static boolean verifyHello(Hello hello, byte[] nonce) {
        if (!MessageDigest.isEqual(nonce, hello.getNonce())) {
            return false;
        }
        PublicKey key;
        try {
            key = decodePublicKey(hello.getPublicKey());
        } catch (InvalidKeyException e) {
            return false;
        }
        return NodeID.fromPublicKey(key).equals(hello.getNodeId())
                && verify(key, hello.encodeForSigning(), hello.getSignature());
    }
    
    /**
     * Decodes an X.509 encoded Ed25519 public key.
     */
    public static PublicKey decodePublicKey(byte[] encoded) throws InvalidKeyException {
        if (encoded == null || encoded.length == 0) {
            throw new InvalidKeyException("public key is missing");
        }
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyException("invalid public key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
    
    public static byte[] encodePublicKey(PublicKey key) {
        return key.getEncoded();
    }
    
    private static byte[] sign(PrivateKey key, byte[] data) {
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(key);
            signature.update(data);
            return signature.sign();
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("cannot sign with key: " + e.getMessage(), e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " signing failed", e);
        }
    }
    
    private static boolean verify(PublicKey key, byte[] data, byte[] sig) {
        if (key == null || sig == null) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(key);
            signature.update(data);
            return signature.verify(sig);
        } catch (InvalidKeyException | SignatureException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " verification failed", e);
        }
    }
}
