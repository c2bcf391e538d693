package io.vindex.ledger.consensus;

import java.time.Instant;
import java.util.Optional;

/**
 * One delegator's stake toward one validator.
 * An unstake moves value from {@code stakedAmount} into {@code pendingRelease} until {@code maturesAt}.
 */
public final class Delegation {
    private final String delegator;
    private final String validator;
    private long stakedAmount;
    private long rewards;
    private long pendingRelease;
    private Instant maturesAt;

    Delegation(String delegator, String validator) {
        this(delegator, validator, 0L, 0L, 0L, null);
    }

    private Delegation(String delegator, String validator, long stakedAmount, long rewards,
                       long pendingRelease, Instant maturesAt) {
        this.delegator = delegator;
        this.validator = validator;
        this.stakedAmount = stakedAmount;
        this.rewards = rewards;
        this.pendingRelease = pendingRelease;
        this.maturesAt = maturesAt;
    }

    public String delegator() { return delegator; }
    public String validator() { return validator; }
    public long stakedAmount() { return stakedAmount; }
    public long rewards() { return rewards; }
    public long pendingRelease() { return pendingRelease; }
    public Optional<Instant> maturesAt() { return Optional.ofNullable(maturesAt); }

    public boolean hasPendingRelease() {
        return maturesAt != null;
    }

    boolean isEmpty() {
        return stakedAmount == 0L && maturesAt == null;
    }

    void addStake(long delta) { this.stakedAmount = Math.addExact(stakedAmount, delta); }
    void addRewards(long amount) { this.rewards = Math.addExact(rewards, amount); }

    void beginRelease(long amount, Instant maturity) {
        this.stakedAmount = Math.subtractExact(stakedAmount, amount);
        this.pendingRelease = Math.addExact(pendingRelease, amount);
        this.maturesAt = maturity;
    }

    /** Clears the pending release and returns what it held. */
    long release() {
        long released = pendingRelease;
        this.pendingRelease = 0L;
        this.maturesAt = null;
        return released;
    }

    Delegation copy() {
        return new Delegation(delegator, validator, stakedAmount, rewards, pendingRelease, maturesAt);
    }

    @Override public String toString() {
        return "Delegation{" + delegator + "->" + validator + ", staked=" + stakedAmount
                + ", pending=" + pendingRelease + ", rewards=" + rewards + "}";
    }
}
