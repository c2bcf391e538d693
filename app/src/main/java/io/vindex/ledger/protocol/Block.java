package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Block = header + ordered transactions + the hash and validator signature it was sealed with.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;
    private final String hash;
    private final byte[] signature;

    public Block(BlockHeader header, List<Transaction> txs, String hash, byte[] signature) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.hash = hash;
        this.signature = signature != null ? signature.clone() : new byte[0];
        basicValidate();
    }

    /** Computes the header hash and has the signer sign it on behalf of the header's validator. */
    public static Block seal(BlockHeader header, List<Transaction> txs, BlockSigner signer) {
        String hash = header.hash();
        return new Block(header, txs, hash, signer.sign(header.validator(), hash));
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public String hash() { return hash; }
    public byte[] signature() { return signature.clone(); }

    public long index() { return header.index(); }
    public long timestamp() { return header.timestamp(); }
    public String previousHash() { return header.previousHash(); }
    public String validator() { return header.validator(); }
    public long totalFees() { return header.totalFees(); }
    public long reward() { return header.reward(); }
    public int transactionCount() { return header.transactionCount(); }

    /** Deterministic encoding: header || hash || count || tx[i].serialize() */
    public byte[] serialize() {
        byte[] headerBytes = header.serialize();
        byte[] hashBytes = hash.getBytes(StandardCharsets.UTF_8);
        int size = headerBytes.length + 4 + hashBytes.length + 4 + signature.length + 4;
        for (Transaction tx : transactions) size += 4 + tx.serialize().length;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(headerBytes);
        buf.putInt(hashBytes.length);
        buf.put(hashBytes);
        buf.putInt(signature.length);
        buf.put(signature);
        buf.putInt(transactions.size());
        for (Transaction tx : transactions) {
            byte[] b = tx.serialize();
            buf.putInt(b.length);
            buf.put(b);
        }
        buf.flip();
        byte[] out = new byte[buf.remaining()];
        buf.get(out);
        return out;
    }

    public String computeMerkleRoot() {
        return Merkle.rootOfTransactions(transactions);
    }

    public long computeTotalFees() {
        long total = 0L;
        for (Transaction tx : transactions) total = Math.addExact(total, tx.feeMinor());
        return total;
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (hash == null || hash.isBlank()) throw new IllegalArgumentException("missing hash");
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public String toString() {
        return "Block{index=" + header.index() + ", txs=" + transactions.size() + ", validator=" + header.validator() + "}";
    }
}
