package io.vindex.ledger.consensus;

/**
 * Maps a block index to a value in [0, 1) that drives stake-weighted selection.
 * Must depend on the index alone so any observer can reproduce the choice.
 */
@FunctionalInterface
public interface SeedFunction {

    double unitInterval(long blockIndex);
}
