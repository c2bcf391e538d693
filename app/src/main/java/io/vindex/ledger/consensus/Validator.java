package io.vindex.ledger.consensus;

import io.vindex.ledger.protocol.Amounts;

/**
 * Validator record owned by the {@link StakingRegistry}. Accessors hand out copies.
 */
public final class Validator {
    private final String address;
    private long selfStake;
    private long totalStake;
    private final int commissionBps;
    private boolean active;
    private long blocksProduced;
    private long lastActiveBlock;

    Validator(String address, int commissionBps) {
        this(address, 0L, 0L, commissionBps, false, 0L, 0L);
    }

    private Validator(String address, long selfStake, long totalStake, int commissionBps,
                      boolean active, long blocksProduced, long lastActiveBlock) {
        this.address = address;
        this.selfStake = selfStake;
        this.totalStake = totalStake;
        this.commissionBps = commissionBps;
        this.active = active;
        this.blocksProduced = blocksProduced;
        this.lastActiveBlock = lastActiveBlock;
    }

    public String address() { return address; }
    public long selfStake() { return selfStake; }
    public long totalStake() { return totalStake; }
    public int commissionBps() { return commissionBps; }
    public double commissionRate() { return commissionBps / (double) Amounts.BPS_DENOMINATOR; }
    public boolean isActive() { return active; }
    public long blocksProduced() { return blocksProduced; }
    public long lastActiveBlock() { return lastActiveBlock; }

    void addSelfStake(long delta) { this.selfStake = Math.addExact(selfStake, delta); }
    void addTotalStake(long delta) { this.totalStake = Math.addExact(totalStake, delta); }
    void setActive(boolean active) { this.active = active; }

    void recordBlock(long blockIndex) {
        this.blocksProduced++;
        this.lastActiveBlock = blockIndex;
    }

    Validator copy() {
        return new Validator(address, selfStake, totalStake, commissionBps, active, blocksProduced, lastActiveBlock);
    }

    @Override public String toString() {
        return "Validator{" + address + ", total=" + totalStake + ", self=" + selfStake
                + ", commissionBps=" + commissionBps + (active ? ", active" : ", inactive") + "}";
    }
}
