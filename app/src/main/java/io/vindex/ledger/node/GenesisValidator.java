package io.vindex.ledger.node;

/** A validator present from block 0, with its self-stake and commission in basis points. */
public record GenesisValidator(String address, long selfStake, int commissionBps) {
    public GenesisValidator {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("Missing validator address");
        if (selfStake <= 0) throw new IllegalArgumentException("selfStake must be > 0");
        if (commissionBps < 0 || commissionBps >= 10_000) throw new IllegalArgumentException("commissionBps out of range");
    }
}
