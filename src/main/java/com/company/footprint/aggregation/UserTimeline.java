package com.company.footprint.aggregation;

/**
 * One user's 1-minute buckets over a sub-window.
 * All series are additive; cores and memory are max-reduced when rolled up.
 */
class UserTimeline {

    final double[] jobs;
    final double[] cores;
    final double[] memory;
    final double[] co2e;
    final double[] cost;
    final double[] cputime;

    UserTimeline(int minutes) {
        this.jobs = new double[minutes];
        this.cores = new double[minutes];
        this.memory = new double[minutes];
        this.co2e = new double[minutes];
        this.cost = new double[minutes];
        this.cputime = new double[minutes];
    }
}
