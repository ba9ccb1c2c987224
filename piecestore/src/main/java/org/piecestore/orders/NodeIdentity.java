package org.piecestore.orders;

import org.piecestore.identity.NodeID;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;

/**
 * A peer's signing key pair together with the node ID derived from it.
 */
public final class NodeIdentity {
    
    private final NodeID id;
    private final KeyPair keyPair;
    
    public NodeIdentity(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.id = NodeID.fromPublicKey(keyPair.getPublic());
    }
    
    /**
     * Generates a fresh Ed25519 identity.
     */
    public static NodeIdentity generate() {
        return new NodeIdentity(generateKeyPair());
    }
    
    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(Signing.ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(Signing.ALGORITHM + " not available", e);
        }
    }
    
    /**
     * Restores an identity from its X.509 public key and PKCS#8 private key encodings.
     */
    public static NodeIdentity fromEncoded(byte[] publicKey, byte[] privateKey) throws InvalidKeyException {
        PublicKey pub = Signing.decodePublicKey(publicKey);
        try {
            PrivateKey priv = KeyFactory.getInstance(Signing.ALGORITHM)
                    .generatePrivate(new PKCS8EncodedKeySpec(privateKey));
            return new NodeIdentity(new KeyPair(pub, priv));
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyException("invalid private key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(Signing.ALGORITHM + " not available", e);
        }
    }
    
    public NodeID getId() {
        return id;
    }
    
    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }
    
    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }
    
    @Override
    public String toString() {
        return "NodeIdentity{id=" + id + '}';
    }
}
