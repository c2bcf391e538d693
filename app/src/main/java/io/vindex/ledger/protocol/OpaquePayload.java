package io.vindex.ledger.protocol;

import java.util.Arrays;

public record OpaquePayload(byte[] data) implements TxPayload {

    public OpaquePayload {
        data = data != null ? data.clone() : new byte[0];
    }

    @Override
    public byte[] data() { return data.clone(); }

    @Override
    public byte tag() { return TAG_OPAQUE; }

    @Override
    public byte[] encode() {
        byte[] out = new byte[1 + data.length];
        out[0] = TAG_OPAQUE;
        System.arraycopy(data, 0, out, 1, data.length);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OpaquePayload && Arrays.equals(data, ((OpaquePayload) o).data);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(data); }

    @Override
    public String toString() { return "OpaquePayload[" + data.length + " bytes]"; }
}
