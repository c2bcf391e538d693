package io.vindex.ledger.protocol;

import java.util.Locale;

public enum TransactionType {
    TRANSFER("transfer"),
    STAKE("stake"),
    UNSTAKE("unstake"),
    SWAP("swap");

    private final String wireName;

    TransactionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /** Strict parse: exactly one of transfer, stake, unstake, swap. */
    public static TransactionType fromWireName(String name) {
        if (name != null) {
            for (TransactionType t : values()) {
                if (t.wireName.equals(name)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported transaction type: " + name
                + " (expected one of transfer, stake, unstake, swap)");
    }

    /** Stake and unstake may name the sender as recipient (self-nomination). */
    public boolean allowsSelfTarget() {
        return this == STAKE || this == UNSTAKE;
    }

    @Override
    public String toString() {
        return wireName.toUpperCase(Locale.ROOT);
    }
}
