package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Immutable ledger transaction.
 * The id is SHA-256 over the unsigned bytes, so it is fixed at construction and survives signing.
 */
public final class Transaction {

    public static final int VERSION = 1;

    private final int version;
    private final TransactionType type;

    private final String from;
    private final String to;
    private final long amountMinor;
    private final long feeMinor;
    private final long timestamp;

    private final TxPayload payload;
    private final byte[] signature;

    private final PublicKey publicKey;
    private final String id;

    private Transaction(int version,
                        TransactionType type,
                        String from,
                        String to,
                        long amountMinor,
                        long feeMinor,
                        long timestamp,
                        TxPayload payload,
                        byte[] signature,
                        PublicKey publicKey) {
        this.version = version;
        this.type = type;
        this.from = from;
        this.to = to;
        this.amountMinor = amountMinor;
        this.feeMinor = feeMinor;
        this.timestamp = timestamp;
        this.payload = payload;
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.publicKey = publicKey;
        basicValidate();
        this.id = Hashes.sha256Hex(toUnsignedBytes());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = VERSION;
        private TransactionType type = TransactionType.TRANSFER;
        private String from;
        private String to;
        private long amountMinor;
        private Long feeMinor;
        private long timestamp = System.currentTimeMillis();
        private TxPayload payload;
        private byte[] signature = new byte[0];
        private PublicKey publicKey;

        public Builder version(int v) { this.version = v; return this; }
        public Builder type(TransactionType t) { this.type = t; return this; }
        public Builder type(String wireName) { this.type = TransactionType.fromWireName(wireName); return this; }
        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder amountMinor(long a) { this.amountMinor = a; return this; }
        /** Explicit fee; when omitted the {@link FeeSchedule} fee for type and amount is used. */
        public Builder feeMinor(long f) { this.feeMinor = f; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder payload(TxPayload p) { this.payload = p; return this; }
        public Builder signature(byte[] s) { this.signature = s != null ? s.clone() : new byte[0]; return this; }
        public Builder publicKey(PublicKey pk) { this.publicKey = pk; return this; }

        public Transaction build() {
            if (type == null) throw new IllegalArgumentException("Missing type");
            long fee = feeMinor != null ? feeMinor : FeeSchedule.feeFor(type, amountMinor);
            return new Transaction(version, type, from, to, amountMinor, fee,
                                   timestamp, payload, signature, publicKey);
        }
    }

    public Builder toBuilder() {
        return builder()
                .version(version)
                .type(type)
                .from(from)
                .to(to)
                .amountMinor(amountMinor)
                .feeMinor(feeMinor)
                .timestamp(timestamp)
                .payload(payload)
                .signature(signature)
                .publicKey(publicKey);
    }

    // -------------------- getters --------------------
    public String id() { return id; }
    public int version() { return version; }
    public TransactionType type() { return type; }
    public String from() { return from; }
    public String to() { return to; }
    public long amountMinor() { return amountMinor; }
    public long feeMinor() { return feeMinor; }
    public long timestamp() { return timestamp; }
    public TxPayload payload() { return payload; }
    public byte[] signature() { return signature.clone(); }
    public PublicKey publicKey() { return publicKey; }
    public boolean isSigned() { return signature.length > 0; }

    /** Validator addressed by a stake/unstake: the payload target if present, else the recipient. */
    public String targetValidator() {
        if (payload instanceof ValidatorTarget) {
            return ((ValidatorTarget) payload).validator();
        }
        return to;
    }

    public SwapOrder swapOrder() {
        return payload instanceof SwapOrder ? (SwapOrder) payload : null;
    }

    /** Total spendable balance this transaction moves out of the sender for transfers and stakes. */
    public long totalCostMinor() {
        return Math.addExact(amountMinor, feeMinor);
    }

    // -------------------- signing --------------------
    public Transaction sign(PrivateKey privateKey, PublicKey pub) {
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(pub, "publicKey");
        byte[] sig = SignatureUtil.sign(toUnsignedBytes(), privateKey);
        return toBuilder().signature(sig).publicKey(pub).build();
    }

    /** Checks the signature against the key carried by the transaction. */
    public boolean verifySignature() {
        return verifySignature(publicKey);
    }

    /** Checks the signature against a claimed signer. */
    public boolean verifySignature(PublicKey signer) {
        return SignatureUtil.verify(toUnsignedBytes(), signature, signer);
    }

    // -------------------- core methods --------------------
    public byte[] serialize() {
        byte[] pub = publicKey != null ? publicKey.getEncoded() : new byte[0];
        byte[] unsigned = toUnsignedBytes();
        ByteBuffer buf = ByteBuffer.allocate(unsigned.length + 4 + signature.length + 4 + pub.length);
        buf.put(unsigned);
        putBytes(buf, signature);
        putBytes(buf, pub);
        return sliceToArray(buf);
    }

    public byte[] toUnsignedBytes() {
        byte[] payloadBytes = payload != null ? payload.encode() : new byte[0];
        ByteBuffer buf = ByteBuffer.allocate(estimateUnsignedSize(payloadBytes));
        putInt(buf, version);
        putStr(buf, type.wireName());
        putStr(buf, from);
        putStr(buf, to);
        putLong(buf, amountMinor);
        putLong(buf, feeMinor);
        putLong(buf, timestamp);
        putBytes(buf, payloadBytes);
        return sliceToArray(buf);
    }

    public void basicValidate() {
        if (version != VERSION) throw new IllegalArgumentException("Unsupported version: " + version);
        if (type == null) throw new IllegalArgumentException("Missing type");
        if (from == null || from.isBlank()) throw new IllegalArgumentException("Missing from");
        if (to == null || to.isBlank()) throw new IllegalArgumentException("Missing to");
        if (Objects.equals(from, to) && !type.allowsSelfTarget()) throw new IllegalArgumentException("from == to");
        if (amountMinor <= 0) throw new IllegalArgumentException("amount must be > 0");
        if (feeMinor < 0) throw new IllegalArgumentException("fee must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (type == TransactionType.SWAP && !(payload instanceof SwapOrder)) {
            throw new IllegalArgumentException("swap requires a SwapOrder payload");
        }
        if (payload instanceof SwapOrder && type != TransactionType.SWAP) {
            throw new IllegalArgumentException("SwapOrder payload only allowed on swap");
        }
        if (payload instanceof ValidatorTarget && !type.allowsSelfTarget()) {
            throw new IllegalArgumentException("ValidatorTarget payload only allowed on stake/unstake");
        }
    }

    // -------------------- helpers --------------------
    private int estimateUnsignedSize(byte[] payloadBytes) {
        int size = 4;
        size += 4 + type.wireName().getBytes(StandardCharsets.UTF_8).length;
        size += 4 + (from == null ? 0 : from.getBytes(StandardCharsets.UTF_8).length);
        size += 4 + (to == null ? 0 : to.getBytes(StandardCharsets.UTF_8).length);
        size += 8 * 3;
        size += 4 + payloadBytes.length;
        return size;
    }

    private static void putInt(ByteBuffer buf, int v){ buf.putInt(v); }
    private static void putLong(ByteBuffer buf, long v){ buf.putLong(v); }
    private static void putStr(ByteBuffer buf, String s){
        byte[] b = s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        putBytes(buf, b);
    }
    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }
    private static byte[] sliceToArray(ByteBuffer buf){
        buf.flip(); byte[] out = new byte[buf.remaining()]; buf.get(out); return out;
    }

    @Override public boolean equals(Object o) {
        return o instanceof Transaction && id.equals(((Transaction) o).id);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{" + type.wireName() + " " + id.substring(0, 12) + " " + from + "->" + to
                + " amount=" + amountMinor + " fee=" + feeMinor + "}";
    }
}
