package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Typed transaction payload. Each transaction type reads only the variant it owns:
 * stake/unstake carry a {@link ValidatorTarget}, swaps carry a {@link SwapOrder}.
 * Anything else travels as {@link OpaquePayload}.
 */
public interface TxPayload {

    byte TAG_OPAQUE = 0;
    byte TAG_VALIDATOR = 1;
    byte TAG_SWAP = 2;

    byte tag();

    /** Canonical bytes including the leading tag. */
    byte[] encode();

    static TxPayload decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        byte tag = buf.get();
        switch (tag) {
            case TAG_VALIDATOR:
                return new ValidatorTarget(readString(buf));
            case TAG_SWAP:
                String in = readString(buf);
                String out = readString(buf);
                return new SwapOrder(in, out, buf.getLong());
            case TAG_OPAQUE:
                byte[] rest = new byte[buf.remaining()];
                buf.get(rest);
                return new OpaquePayload(rest);
            default:
                throw new IllegalArgumentException("Unknown payload tag: " + tag);
        }
    }

    static void putString(ByteBuffer buf, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        buf.putInt(b.length);
        buf.put(b);
    }

    static int stringSize(String s) {
        return 4 + s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String readString(ByteBuffer buf) {
        int len = buf.getInt();
        if (len < 0 || len > buf.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        byte[] b = new byte[len];
        buf.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }
}
