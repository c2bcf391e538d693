package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Everything the block hash commits to.
 * - previousHash: hex hash of the prior block ("0" for genesis)
 * - merkleRoot: commitment to the included tx ids
 * - stateRoot: digest of ledger + staking state after the block was applied
 * - validator: producer chosen by stake-weighted rotation
 * - nonce: sealing value, unused by proof-of-stake and kept at 0
 */
public final class BlockHeader {
    private final long index;
    private final long timestamp;
    private final String previousHash;
    private final String merkleRoot;
    private final String stateRoot;
    private final String validator;
    private final long nonce;
    private final int transactionCount;
    private final long totalFees;
    private final long reward;

    public BlockHeader(long index,
                       long timestamp,
                       String previousHash,
                       String merkleRoot,
                       String stateRoot,
                       String validator,
                       long nonce,
                       int transactionCount,
                       long totalFees,
                       long reward) {
        this.index = index;
        this.timestamp = timestamp;
        this.previousHash = previousHash;
        this.merkleRoot = merkleRoot;
        this.stateRoot = stateRoot;
        this.validator = validator;
        this.nonce = nonce;
        this.transactionCount = transactionCount;
        this.totalFees = totalFees;
        this.reward = reward;
        basicValidate();
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public String previousHash() { return previousHash; }
    public String merkleRoot() { return merkleRoot; }
    public String stateRoot() { return stateRoot; }
    public String validator() { return validator; }
    public long nonce() { return nonce; }
    public int transactionCount() { return transactionCount; }
    public long totalFees() { return totalFees; }
    public long reward() { return reward; }

    public BlockHeader withPreviousHash(String newPreviousHash) {
        return new BlockHeader(index, timestamp, newPreviousHash, merkleRoot, stateRoot, validator,
                nonce, transactionCount, totalFees, reward);
    }

    // Deterministic header bytes; the block hash is SHA-256 over these.
    public byte[] serialize() {
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        byte[] merkle = merkleRoot.getBytes(StandardCharsets.UTF_8);
        byte[] state = stateRoot.getBytes(StandardCharsets.UTF_8);
        byte[] producer = validator.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(8 + 8 + (4 + prev.length) + (4 + merkle.length)
                + (4 + state.length) + (4 + producer.length) + 8 + 4 + 8 + 8);
        buf.putLong(index);
        buf.putLong(timestamp);
        putBytes(buf, prev);
        putBytes(buf, merkle);
        putBytes(buf, state);
        putBytes(buf, producer);
        buf.putLong(nonce);
        buf.putInt(transactionCount);
        buf.putLong(totalFees);
        buf.putLong(reward);
        return slice(buf);
    }

    public String hash() {
        return Hashes.sha256Hex(serialize());
    }

    public void basicValidate() {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (previousHash == null || previousHash.isEmpty()) throw new IllegalArgumentException("missing previousHash");
        if (merkleRoot == null || merkleRoot.isEmpty()) throw new IllegalArgumentException("missing merkleRoot");
        if (stateRoot == null || stateRoot.isEmpty()) throw new IllegalArgumentException("missing stateRoot");
        if (validator == null || validator.isBlank()) throw new IllegalArgumentException("missing validator");
        if (transactionCount < 0) throw new IllegalArgumentException("transactionCount must be >= 0");
        if (totalFees < 0) throw new IllegalArgumentException("totalFees must be >= 0");
        if (reward < 0) throw new IllegalArgumentException("reward must be >= 0");
    }

    private static void putBytes(ByteBuffer b, byte[] a){
        b.putInt(a.length);
        b.put(a);
    }
    private static byte[] slice(ByteBuffer b){ b.flip(); byte[] out = new byte[b.remaining()]; b.get(out); return out; }

    @Override public String toString() {
        return "BlockHeader{index=" + index + ", ts=" + timestamp + ", validator=" + validator + "}";
    }
}
