package com.company.footprint.domain;

import lombok.Data;

/**
 * Cluster-wide histograms for one 15-minute interval, credited when jobs reach a terminal state.
 */
@Data
public class ClusterIntervalStats {

    public static final int PERCENT_BUCKETS = 100;

    private DoneStats done = new DoneStats();
    private FailedStats failed = new FailedStats();

    /**
     * Fine efficiency bucket: floor of the percentage, capped at 99.
     */
    public static int percentBucket(double efficiency) {
        return Math.max(0, Math.min((int) Math.floor(efficiency), PERCENT_BUCKETS - 1));
    }

    @Data
    public static class DoneStats {
        private long total;
        private double co2e;
        private long[] runtimes = new long[RuntimeLadder.size()];
        private long[] cpueff = new long[PERCENT_BUCKETS];
        private MemoryEfficiency memeff = new MemoryEfficiency();
    }

    @Data
    public static class MemoryEfficiency {
        private long[] dist = new long[PERCENT_BUCKETS];
        // Footprint that requesting peak + 10% would have saved
        private double co2e;
        private double cost;
    }

    @Data
    public static class FailedStats {
        private long total;
        private double co2e;
        private double cost;
        private long memlim;
        private LongRunningFailures more1h = new LongRunningFailures();
    }

    @Data
    public static class LongRunningFailures {
        private long total;
        private double co2e;
    }
}
