package io.vindex.ledger.protocol;

import java.nio.ByteBuffer;

/** Names the validator a stake or unstake transaction targets. */
public record ValidatorTarget(String validator) implements TxPayload {

    public ValidatorTarget {
        if (validator == null || validator.isBlank()) {
            throw new IllegalArgumentException("Missing validator address");
        }
    }

    @Override
    public byte tag() { return TAG_VALIDATOR; }

    @Override
    public byte[] encode() {
        ByteBuffer buf = ByteBuffer.allocate(1 + TxPayload.stringSize(validator));
        buf.put(TAG_VALIDATOR);
        TxPayload.putString(buf, validator);
        return buf.array();
    }
}
