package io.vindex.ledger.protocol;

/** Produces and checks validator signatures over block hashes. */
public interface BlockSigner {

    byte[] sign(String validator, String blockHash);

    boolean verify(String validator, String blockHash, byte[] signature);
}
