package io.vindex.ledger.protocol;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * HMAC-SHA256 block signer. Each validator key is HMAC(nodeSecret, validatorAddress),
 * so any holder of the node secret can re-derive and check signatures.
 */
public final class HmacBlockSigner implements BlockSigner {
    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] nodeSecret;

    public HmacBlockSigner(String nodeSecret) {
        Objects.requireNonNull(nodeSecret, "nodeSecret");
        if (nodeSecret.isEmpty()) {
            throw new IllegalArgumentException("nodeSecret must not be empty");
        }
        this.nodeSecret = nodeSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] sign(String validator, String blockHash) {
        byte[] key = hmac(nodeSecret, validator.getBytes(StandardCharsets.UTF_8));
        return hmac(key, blockHash.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean verify(String validator, String blockHash, byte[] signature) {
        if (signature == null || signature.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(sign(validator, blockHash), signature);
    }

    private static byte[] hmac(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC signing failed", e);
        }
    }
}
