package io.vindex.ledger.node;

/**
 * Point-in-time network figures. Supply figures are in minor units; block time in milliseconds.
 */
public record NetworkStats(long totalSupply,
                           long circulatingSupply,
                           long burnedTokens,
                           long mintedTokens,
                           long totalStaked,
                           int totalValidators,
                           int activeValidators,
                           int totalAccounts,
                           int chainLength,
                           int pendingTransactions,
                           double averageBlockTimeMillis,
                           double tps) {
}
