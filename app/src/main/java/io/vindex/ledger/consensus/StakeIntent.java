package io.vindex.ledger.consensus;

/** What a stake call means, decided once from the delegator and target addresses. */
public enum StakeIntent {
    /** Staking to one's own address: creates or tops up the caller's validator, including self-stake. */
    SELF_NOMINATION,
    /** Staking to another address: only allowed toward an existing validator; self-stake untouched. */
    DELEGATION;

    public static StakeIntent of(String delegator, String validatorAddress) {
        return delegator.equals(validatorAddress) ? SELF_NOMINATION : DELEGATION;
    }
}
