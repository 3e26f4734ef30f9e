package com.company.footprint.domain;

import lombok.Data;

/**
 * Per-user counters for one 15-minute interval, credited at submit and completion time.
 */
@Data
public class UserIntervalStats {

    public static final int EFFICIENCY_CLASSES = 5;

    private long submitted;
    private long done;
    private FailureCounts failed = new FailureCounts();
    private long[] memeff = new long[EFFICIENCY_CLASSES];
    private long[] cpueff = new long[EFFICIENCY_CLASSES];

    /**
     * Coarse efficiency class: &lt;20, &lt;40, &lt;60, &lt;80, &ge;80 percent.
     */
    public static int efficiencyClass(double efficiency) {
        if (efficiency < 20) return 0;
        if (efficiency < 40) return 1;
        if (efficiency < 60) return 2;
        if (efficiency < 80) return 3;
        return 4;
    }

    @Data
    public static class FailureCounts {
        private long total;
        private long memlim;  // peak memory above the requested limit
    }
}
