package io.vindex.ledger.wallet;

import io.vindex.ledger.protocol.SignatureUtil;
import io.vindex.ledger.protocol.Transaction;

import java.security.*;
import java.security.spec.ECGenParameterSpec;

/** In-process EC key pair whose address is derived from the public key. No custody or storage. */
public class Wallet {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    /** Fresh secp256r1 key pair. */
    public static Wallet generate() {
        try {
            KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
            gen.initialize(new ECGenParameterSpec("secp256r1"));
            return new Wallet(gen.generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation unavailable", e);
        }
    }

    public String getAddress() {
        return address;
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    /** Returns a copy of {@code tx} carrying this wallet's signature and public key. */
    public Transaction signTransaction(Transaction tx) {
        if (!address.equals(tx.from())) {
            throw new IllegalArgumentException("Wallet " + address + " cannot sign for " + tx.from());
        }
        return tx.sign(keyPair.getPrivate(), keyPair.getPublic());
    }
}
