package io.vindex.ledger.state;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Account record owned by the {@link Ledger}. Callers only ever receive copies.
 */
public final class Account {
    private final String address;
    private long balance;
    private long nonce;
    private long staked;
    private long stakingRewards;
    private boolean validator;
    private final Map<String, Long> tokens;

    Account(String address, long balance) {
        this(address, balance, 0L, 0L, 0L, false, new TreeMap<>());
    }

    private Account(String address, long balance, long nonce, long staked, long stakingRewards,
                    boolean validator, Map<String, Long> tokens) {
        this.address = address;
        this.balance = balance;
        this.nonce = nonce;
        this.staked = staked;
        this.stakingRewards = stakingRewards;
        this.validator = validator;
        this.tokens = tokens;
    }

    public String address() { return address; }
    public long balance() { return balance; }
    public long nonce() { return nonce; }
    public long staked() { return staked; }
    public long stakingRewards() { return stakingRewards; }
    public boolean isValidator() { return validator; }

    /** Non-native token holdings acquired through swaps. */
    public Map<String, Long> tokens() { return Collections.unmodifiableMap(tokens); }

    public long tokenBalance(String symbol) { return tokens.getOrDefault(symbol, 0L); }

    void setBalance(long balance) { this.balance = balance; }
    void setStaked(long staked) { this.staked = staked; }
    void setStakingRewards(long stakingRewards) { this.stakingRewards = stakingRewards; }
    void incrementNonce() { this.nonce++; }
    void markValidator() { this.validator = true; }

    void setTokenBalance(String symbol, long amount) {
        if (amount == 0L) {
            tokens.remove(symbol);
        } else {
            tokens.put(symbol, amount);
        }
    }

    Account copy() {
        return new Account(address, balance, nonce, staked, stakingRewards, validator, new TreeMap<>(tokens));
    }

    @Override public String toString() {
        return "Account{" + address + ", balance=" + balance + ", staked=" + staked
                + ", rewards=" + stakingRewards + ", nonce=" + nonce + (validator ? ", validator" : "") + "}";
    }
}
