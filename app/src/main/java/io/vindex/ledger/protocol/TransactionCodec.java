package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);

            int version = buf.getInt();
            TransactionType type = TransactionType.fromWireName(readString(buf));
            String from = readString(buf);
            String to = readString(buf);
            long amountMinor = buf.getLong();
            long feeMinor = buf.getLong();
            long timestamp = buf.getLong();
            TxPayload payload = TxPayload.decode(readBytes(buf));

            byte[] signature = new byte[0];
            if (buf.hasRemaining()) {
                signature = readBytes(buf);
            }
            byte[] publicKey = new byte[0];
            if (buf.hasRemaining()) {
                publicKey = readBytes(buf);
            }

            return Transaction.builder()
                    .version(version)
                    .type(type)
                    .from(from)
                    .to(to)
                    .amountMinor(amountMinor)
                    .feeMinor(feeMinor)
                    .timestamp(timestamp)
                    .payload(payload)
                    .signature(signature)
                    .publicKey(publicKey.length == 0 ? null : SignatureUtil.decodePublicKey(publicKey))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    private static String readString(ByteBuffer b) {
        byte[] arr = readBytes(b);
        return new String(arr, StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(ByteBuffer b) {
        if (b.remaining() < 4) return new byte[0];
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
