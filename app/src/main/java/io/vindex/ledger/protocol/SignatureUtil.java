package io.vindex.ledger.protocol;

import java.security.*;
import java.security.spec.X509EncodedKeySpec;

public final class SignatureUtil {
    private static final String ALGORITHM = "SHA256withECDSA";

    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (pub == null || signature == null || signature.length == 0) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    /** Address = first 20 bytes of SHA-256(encoded public key), hex. */
    public static String deriveAddress(PublicKey pub) {
        byte[] hash = Hashes.sha256(pub.getEncoded());
        byte[] head = new byte[20];
        System.arraycopy(hash, 0, head, 0, head.length);
        return Hashes.toHex(head);
    }

    public static PublicKey decodePublicKey(byte[] encoded) {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Malformed EC public key", e);
        }
    }
}
