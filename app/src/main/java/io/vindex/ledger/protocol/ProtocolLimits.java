package io.vindex.ledger.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_TXS_PER_BLOCK = 1_000_000;
    /** Submitted transactions older than this are rejected. */
    public static final long MAX_TX_AGE_MILLIS = 10 * 60 * 1000L;
    /** Allowed clock skew for timestamps ahead of the node clock. */
    public static final long MAX_FUTURE_DRIFT_MILLIS = 60_000L;
    /** Same sender/recipient/amount inside this window counts as a duplicate submission. */
    public static final long DUPLICATE_WINDOW_MILLIS = 60_000L;
}
