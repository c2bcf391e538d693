package io.vindex.ledger.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vindex.ledger.protocol.RejectReason;

import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter txAdmitted = registry.counter("tx.admitted");
    private static final Counter txDropped = registry.counter("tx.dropped");
    private static final Timer miningTime = registry.timer("block.mining.time");
    private static final DistributionSummary blockReward = DistributionSummary.builder("block.reward")
            .baseUnit("minor")
            .register(registry);

    public static <T> T recordMining(Supplier<T> blockProductionLogic) {
        return miningTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void recordReward(long rewardMinor) {
        blockReward.record(rewardMinor);
    }

    public static void incrementAdmitted() {
        txAdmitted.increment();
    }

    public static void incrementRejected(RejectReason reason) {
        registry.counter("tx.rejected", "reason", reason.name().toLowerCase()).increment();
    }

    public static void incrementDropped(int count) {
        txDropped.increment(count);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
