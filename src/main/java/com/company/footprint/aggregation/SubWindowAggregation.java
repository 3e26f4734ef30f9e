package com.company.footprint.aggregation;

import com.company.footprint.config.FootprintProperties.AggregationConfig;
import com.company.footprint.config.FootprintProperties.FeatureConfig;
import com.company.footprint.domain.*;
import com.company.footprint.footprint.Footprint;
import com.company.footprint.footprint.FootprintCalculator;
import com.company.footprint.footprint.JobEnergyProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Accumulates the jobs of one sub-window {@code [from, to)} into minute buckets and interval counters.
 * Instances are confined to the thread that aggregates the sub-window.
 */
@Slf4j
public class SubWindowAggregation {

    private final LocalDateTime from;
    private final LocalDateTime to;
    private final LocalDateTime openJobFinish;
    private final UserIndex userIndex;
    private final FootprintCalculator calculator;
    private final AggregationConfig config;
    private final FeatureConfig features;

    private final MinuteUsageGrid grid;
    private final IntervalStats stats;

    private final Set<String> unknownUsers = new HashSet<>();
    private long accumulated;
    private long skipped;

    /**
     * @param lastJobsUpdate time of the last job poll; open jobs are assumed to run until then
     */
    public SubWindowAggregation(LocalDateTime from, LocalDateTime to, LocalDateTime lastJobsUpdate,
                                UserIndex userIndex, FootprintCalculator calculator,
                                AggregationConfig config, FeatureConfig features) {
        this.from = from;
        this.to = to;
        this.openJobFinish = lastJobsUpdate.isBefore(to) ? lastJobsUpdate : to;
        this.userIndex = userIndex;
        this.calculator = calculator;
        this.config = config;
        this.features = features;
        this.grid = new MinuteUsageGrid(from, to, userIndex.size());
        this.stats = new IntervalStats(from, to, userIndex.size());
    }

    public void accumulate(JobRecord job) {
        if (job.getStartTime() == null) {
            skipped++;
            return;
        }

        int user = userIndex.indexOf(job.getUser());
        if (user < 0) {
            if (unknownUsers.add(job.getUser())) {
                log.warn("Skipping jobs of unknown user {} in {} - {}", job.getUser(), from, to);
            }
            skipped++;
            return;
        }

        JobEnergyProfile profile = calculator.profile(job, openJobFinish);
        allocate(user, profile);
        creditSubmission(user, job);
        if (profile.isTerminal()) {
            creditOutcome(user, profile);
        }
        accumulated++;
    }

    private void allocate(int user, JobEnergyProfile profile) {
        JobRecord job = profile.getJob();
        double runtimeMinutes = profile.getRuntimeMinutes();
        Footprint footprint = profile.getFootprint();

        MinuteUsageGrid.MinuteShare share = new MinuteUsageGrid.MinuteShare(
                1 / runtimeMinutes,
                job.getSlots(),
                profile.getMemoryGb(),
                footprint.getCo2e() / runtimeMinutes,
                footprint.getCost() / runtimeMinutes,
                profile.getCpuTime() / runtimeMinutes
        );

        LocalDateTime allocationStart = job.getStartTime().isBefore(from) ? from : job.getStartTime();
        grid.credit(user, allocationStart, profile.getEffectiveFinish(), share);
    }

    private void creditSubmission(int user, JobRecord job) {
        int interval = stats.intervalOf(job.getSubmitTime());
        if (interval >= 0) {
            UserIntervalStats userStats = stats.user(interval, user);
            userStats.setSubmitted(userStats.getSubmitted() + 1);
        }
    }

    /**
     * Credit the job's outcome, with its whole-lifetime footprint, to the interval it finished in.
     */
    private void creditOutcome(int user, JobEnergyProfile profile) {
        int interval = stats.intervalOf(profile.getEffectiveFinish());
        if (interval < 0) {
            return;
        }

        UserIntervalStats userStats = stats.user(interval, user);
        ClusterIntervalStats cluster = stats.cluster(interval);

        if (profile.getJob().isOk()) {
            creditSuccess(profile, userStats, cluster.getDone());
        } else {
            creditFailure(profile, userStats, cluster.getFailed());
        }
    }

    private void creditSuccess(JobEnergyProfile profile, UserIntervalStats userStats,
                               ClusterIntervalStats.DoneStats done) {
        JobRecord job = profile.getJob();
        ReconciledMemory memory = profile.getMemory();
        Footprint footprint = profile.getFootprint();
        double runtimeSeconds = profile.getRuntimeSeconds();

        userStats.setDone(userStats.getDone() + 1);

        if (memory.isEfficiencyKnown() && memory.getLimitMb() >= config.getMinMemoryRequestMb()) {
            double efficiency = memory.getEfficiency();
            userStats.getMemeff()[UserIntervalStats.efficiencyClass(efficiency)]++;

            ClusterIntervalStats.MemoryEfficiency memeff = done.getMemeff();
            memeff.getDist()[ClusterIntervalStats.percentBucket(efficiency)]++;

            Footprint optimal = calculator.optimalMemoryFootprint(profile, runtimeSeconds / 3600);
            Footprint wasted = footprint.minus(optimal);
            memeff.setCo2e(memeff.getCo2e() + wasted.getCo2e());
            memeff.setCost(memeff.getCost() + wasted.getCost());
        }

        double cpuEfficiency = job.getClampedCpuEfficiency();
        userStats.getCpueff()[UserIntervalStats.efficiencyClass(cpuEfficiency)]++;
        done.getCpueff()[ClusterIntervalStats.percentBucket(cpuEfficiency)]++;

        done.setTotal(done.getTotal() + 1);
        done.setCo2e(done.getCo2e() + footprint.getCo2e());
        done.getRuntimes()[RuntimeLadder.indexOf(runtimeSeconds)]++;
    }

    private void creditFailure(JobEnergyProfile profile, UserIntervalStats userStats,
                               ClusterIntervalStats.FailedStats failed) {
        Footprint footprint = profile.getFootprint();

        userStats.getFailed().setTotal(userStats.getFailed().getTotal() + 1);
        failed.setTotal(failed.getTotal() + 1);
        failed.setCo2e(failed.getCo2e() + footprint.getCo2e());
        failed.setCost(failed.getCost() + footprint.getCost());

        if (!features.isTrackFailureReasons()) {
            return;
        }

        if (profile.getRuntimeSeconds() >= config.getLongFailureSeconds()) {
            ClusterIntervalStats.LongRunningFailures more1h = failed.getMore1h();
            more1h.setTotal(more1h.getTotal() + 1);
            more1h.setCo2e(more1h.getCo2e() + footprint.getCo2e());
        }

        if (profile.getMemory().exceededLimit()) {
            userStats.getFailed().setMemlim(userStats.getFailed().getMemlim() + 1);
            failed.setMemlim(failed.getMemlim() + 1);
        }
    }

    public MinuteUsageGrid getGrid() {
        return grid;
    }

    public IntervalStats getStats() {
        return stats;
    }

    public UserIndex getUserIndex() {
        return userIndex;
    }

    public long getAccumulated() {
        return accumulated;
    }

    public long getSkipped() {
        return skipped;
    }
}
