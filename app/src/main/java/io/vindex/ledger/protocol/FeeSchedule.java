package io.vindex.ledger.protocol;

/**
 * Minimum fee per transaction: a per-type base, 0.01% of the amount, and an extra
 * 0.05% on amounts above 1000 VDX. Never below the 0.001 VDX base fee.
 */
public final class FeeSchedule {
    private FeeSchedule(){}

    public static final long BASE_FEE = Amounts.COIN / 1_000;
    public static final long LARGE_AMOUNT_THRESHOLD = Amounts.coins(1_000);

    public static long feeFor(TransactionType type, long amountMinor) {
        long typeFee;
        switch (type) {
            case STAKE:
                typeFee = BASE_FEE * 2;
                break;
            case UNSTAKE:
                typeFee = BASE_FEE * 3;
                break;
            case SWAP:
                typeFee = BASE_FEE * 3 / 2;
                break;
            case TRANSFER:
            default:
                typeFee = BASE_FEE;
                break;
        }
        long amount = Math.max(0L, amountMinor);
        long percentageFee = amount / 10_000;
        long largeTxFee = amount > LARGE_AMOUNT_THRESHOLD ? amount / 10_000 * 5 : 0L;
        return Math.max(Math.addExact(Math.addExact(typeFee, percentageFee), largeTxFee), BASE_FEE);
    }
}
