package io.vindex.ledger.node;

import io.vindex.ledger.metrics.BlockMetrics;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Timer-driven mining on a single daemon thread. Each tick calls {@link Chain#mineIfDue()},
 * which holds the chain lock, so ticks never overlap with manual mining.
 */
public final class AutoMiner implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AutoMiner.class.getName());

    private final ScheduledExecutorService executor;

    private AutoMiner(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    public static AutoMiner start(Chain chain, long tickMillis) {
        if (tickMillis <= 0) {
            throw new IllegalArgumentException("tickMillis must be > 0");
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vindex-miner");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                BlockMetrics.recordMining(chain::mineIfDue);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background mining tick failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        LOG.info("Auto-miner started (tick " + tickMillis + " ms)");
        return new AutoMiner(executor);
    }

    public boolean isRunning() {
        return !executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
