package io.vindex.ledger.protocol;

public enum RejectReason {
    MALFORMED,
    STALE_TIMESTAMP,
    BAD_SIGNATURE,
    SIGNATURE_REQUIRED,
    UNKNOWN_SENDER,
    FEE_TOO_LOW,
    INSUFFICIENT_BALANCE,
    BELOW_MIN_STAKE,
    UNKNOWN_VALIDATOR,
    VALIDATOR_CAP_REACHED,
    INSUFFICIENT_STAKE,
    UNKNOWN_SWAP_PAIR,
    DUPLICATE
}
