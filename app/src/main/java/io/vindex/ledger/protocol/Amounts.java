package io.vindex.ledger.protocol;

/**
 * Amount helpers. Every balance, stake, fee and reward is a long in minor units.
 */
public final class Amounts {
    private Amounts(){}

    public static final String NATIVE_SYMBOL = "VDX";

    /** Minor units per VDX. */
    public static final long COIN = 100_000_000L;

    /** Denominator for rates expressed in basis points. */
    public static final int BPS_DENOMINATOR = 10_000;

    public static long coins(long whole) {
        return Math.multiplyExact(whole, COIN);
    }

    public static String format(long minor) {
        long whole = minor / COIN;
        long frac = Math.abs(minor % COIN);
        String sign = minor < 0 && whole == 0 ? "-" : "";
        return sign + whole + "." + String.format("%08d", frac) + " " + NATIVE_SYMBOL;
    }
}
