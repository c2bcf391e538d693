package io.vindex.ledger.consensus;

/**
 * A staking call the caller can correct: the message names the failed precondition and its limit.
 */
public class StakingException extends IllegalArgumentException {

    public enum Reason {
        INVALID_AMOUNT,
        BELOW_MINIMUM,
        ACCOUNT_NOT_FOUND,
        INSUFFICIENT_BALANCE,
        UNKNOWN_VALIDATOR,
        VALIDATOR_CAP_REACHED,
        NO_STAKING_RECORD,
        INSUFFICIENT_STAKE
    }

    private final Reason reason;

    public StakingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
