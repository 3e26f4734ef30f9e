package com.company.footprint.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One user's usage over a 15-minute interval, as persisted in a usage row.
 * Additive fields are sums over the interval's minutes; {@code cores} and {@code memory}
 * are the highest concurrent holding seen in any of those minutes.
 */
@Data
@NoArgsConstructor
public class UserUsage {

    private double jobs;
    private double cores;
    private double memory;
    private double co2e;
    private double cost;
    private double cputime;

    private long submitted;
    private long done;
    private UserIntervalStats.FailureCounts failed = new UserIntervalStats.FailureCounts();
    private long[] memeff = new long[UserIntervalStats.EFFICIENCY_CLASSES];
    private long[] cpueff = new long[UserIntervalStats.EFFICIENCY_CLASSES];

    public UserUsage(UserIntervalStats stats) {
        if (stats != null) {
            this.submitted = stats.getSubmitted();
            this.done = stats.getDone();
            this.failed.setTotal(stats.getFailed().getTotal());
            this.failed.setMemlim(stats.getFailed().getMemlim());
            this.memeff = stats.getMemeff().clone();
            this.cpueff = stats.getCpueff().clone();
        }
    }
}
