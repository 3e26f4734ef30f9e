package com.company.footprint.aggregation;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.*;
import com.company.footprint.footprint.FootprintCalculator;
import com.company.footprint.footprint.JobEnergyProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SubWindowAggregationTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2023, 6, 1, 0, 0);
    private static final LocalDateTime NEXT_DAY = DAY.plusDays(1);

    private FootprintProperties properties;
    private FootprintCalculator calculator;
    private UserIndex users;

    @BeforeEach
    void setUp() {
        properties = new FootprintProperties();
        calculator = new FootprintCalculator(properties);
        users = new UserIndex(List.of("alice", "bob"));
    }

    private SubWindowAggregation aggregation(LocalDateTime from, LocalDateTime to, LocalDateTime lastJobsUpdate) {
        return new SubWindowAggregation(from, to, lastJobsUpdate, users, calculator,
                properties.getAggregation(), properties.getFeatures());
    }

    private SubWindowAggregation day() {
        return aggregation(DAY, NEXT_DAY, NEXT_DAY.plusHours(6));
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    @Test
    void twoCoreJobIsSpreadOverThreeMinutes() {
        JobRecord job = TestJobs.job("alice", DAY, DAY.plusMinutes(3))
                .slots(2)
                .cpuEfficiency(50.0)
                .memLimit(8192L)
                .build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        UserTimeline timeline = aggregation.getGrid().existingTimeline(users.indexOf("alice"));
        assertThat(timeline.jobs[0]).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(timeline.jobs[1]).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(timeline.jobs[2]).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(timeline.jobs[3]).isZero();
        assertThat(timeline.cores[0]).isEqualTo(2);
        assertThat(timeline.memory[0]).isEqualTo(8);

        UsageReportRow row = RollupMerger.merge(aggregation.getGrid(), aggregation.getStats(), users).get(0);
        UserUsage alice = row.getUsers().get("alice");
        assertThat(alice.getJobs()).isCloseTo(1.0, within(1e-9));
        assertThat(alice.getCo2e()).isCloseTo(0.05 * 0.00928 * 1.2 * 231.12, within(1e-12));
        assertThat(alice.getDone()).isEqualTo(1);
        assertThat(alice.getCpueff()).containsExactly(0, 0, 1, 0, 0);
        assertThat(alice.getMemeff()).containsExactly(0, 0, 0, 0, 0);

        ClusterIntervalStats.DoneStats done = row.getJobs().getDone();
        assertThat(done.getTotal()).isEqualTo(1);
        assertThat(done.getCpueff()[50]).isEqualTo(1);
        assertThat(done.getRuntimes()[1]).isEqualTo(1);
    }

    @Test
    void jobInsideWindowIsFullyAllocated() {
        JobRecord job = TestJobs.job("alice", DAY.plusHours(10).plusSeconds(30), DAY.plusHours(12).plusMinutes(15).plusSeconds(30))
                .slots(8)
                .cpuEfficiency(75.0)
                .memLimit(16384L)
                .cpuTime(3600.0)
                .build();
        JobEnergyProfile profile = calculator.profile(job, null);

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        UserTimeline timeline = aggregation.getGrid().existingTimeline(users.indexOf("alice"));
        assertThat(sum(timeline.jobs)).isCloseTo(1.0, within(1e-9));
        assertThat(sum(timeline.co2e)).isCloseTo(profile.getFootprint().getCo2e(), within(1e-9));
        assertThat(sum(timeline.cost)).isCloseTo(profile.getFootprint().getCost(), within(1e-9));
        assertThat(sum(timeline.cputime)).isCloseTo(3600.0, within(1e-6));
        // First bucket at or after the start
        assertThat(timeline.jobs[600]).isZero();
        assertThat(timeline.jobs[601]).isPositive();
    }

    @Test
    void jobStartingBeforeWindowIsClamped() {
        JobRecord job = TestJobs.job("alice", DAY.minusHours(1), DAY.plusHours(1)).build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        UserTimeline timeline = aggregation.getGrid().existingTimeline(users.indexOf("alice"));
        assertThat(sum(timeline.jobs)).isCloseTo(0.5, within(1e-9));
        assertThat(timeline.jobs[59]).isPositive();
        assertThat(timeline.jobs[60]).isZero();

        // Completed at 01:00, in the fifth interval
        assertThat(aggregation.getStats().existingUser(4, users.indexOf("alice")).getDone()).isEqualTo(1);
        assertThat(aggregation.getStats().existingUser(0, users.indexOf("alice"))).isNull();
    }

    @Test
    void jobEndingAfterWindowIsCreditedWhereItFinishes() {
        JobRecord job = TestJobs.job("alice", NEXT_DAY.minusMinutes(30), NEXT_DAY.plusMinutes(30)).build();

        SubWindowAggregation first = day();
        first.accumulate(job);
        SubWindowAggregation second = aggregation(NEXT_DAY, NEXT_DAY.plusDays(1), NEXT_DAY.plusDays(2));
        second.accumulate(job);

        int alice = users.indexOf("alice");
        double firstShare = sum(first.getGrid().existingTimeline(alice).jobs);
        double secondShare = sum(second.getGrid().existingTimeline(alice).jobs);
        assertThat(firstShare).isCloseTo(0.5, within(1e-9));
        assertThat(firstShare + secondShare).isCloseTo(1.0, within(1e-9));

        long firstDone = 0;
        for (int i = 0; i < first.getStats().getIntervals(); i++) {
            firstDone += first.getStats().cluster(i).getDone().getTotal();
        }
        assertThat(firstDone).isZero();
        assertThat(second.getStats().cluster(2).getDone().getTotal()).isEqualTo(1);
    }

    @Test
    void zeroLengthJobGetsOneMinute() {
        LocalDateTime at = DAY.plusHours(5);
        JobRecord job = TestJobs.job("alice", at, at).build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        UserTimeline timeline = aggregation.getGrid().existingTimeline(users.indexOf("alice"));
        assertThat(timeline.jobs[300]).isEqualTo(1.0);
        assertThat(sum(timeline.jobs)).isEqualTo(1.0);
        assertThat(aggregation.getStats().cluster(20).getDone().getRuntimes()[0]).isEqualTo(1);
    }

    @Test
    void openJobRunsUntilLastPoll() {
        LocalDateTime lastPoll = DAY.plusHours(12);
        JobRecord job = TestJobs.job("bob", DAY.plusHours(11), null).build();

        SubWindowAggregation aggregation = aggregation(DAY, NEXT_DAY, lastPoll);
        aggregation.accumulate(job);

        UserTimeline timeline = aggregation.getGrid().existingTimeline(users.indexOf("bob"));
        assertThat(sum(timeline.jobs)).isCloseTo(1.0, within(1e-9));
        assertThat(timeline.jobs[719]).isPositive();
        assertThat(timeline.jobs[720]).isZero();
        assertThat(aggregation.getStats().existingUser(44, users.indexOf("bob")).getDone()).isZero();
    }

    @Test
    void submissionsAreCountedInTheirInterval() {
        JobRecord job = TestJobs.job("alice", DAY.plusMinutes(20), DAY.plusMinutes(25))
                .submitTime(DAY.plusMinutes(16))
                .build();
        JobRecord submittedYesterday = TestJobs.job("alice", DAY.plusMinutes(20), DAY.plusMinutes(25))
                .submitTime(DAY.minusMinutes(5))
                .build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);
        aggregation.accumulate(submittedYesterday);

        assertThat(aggregation.getStats().existingUser(1, users.indexOf("alice")).getSubmitted()).isEqualTo(1);
    }

    @Test
    void successfulJobWithKnownMemoryEfficiencyRecordsWaste() {
        JobRecord job = TestJobs.job("alice", DAY.plusHours(2), DAY.plusHours(3))
                .memMax(4096L)
                .memEfficiency(50.0)
                .build();
        JobEnergyProfile profile = calculator.profile(job, null);
        double expectedWaste = profile.getFootprint().getCo2e()
                - calculator.optimalMemoryFootprint(profile, 1.0).getCo2e();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        ClusterIntervalStats cluster = aggregation.getStats().cluster(12);
        assertThat(cluster.getDone().getMemeff().getDist()[50]).isEqualTo(1);
        assertThat(cluster.getDone().getMemeff().getCo2e()).isCloseTo(expectedWaste, within(1e-12));
        assertThat(aggregation.getStats().existingUser(12, users.indexOf("alice")).getMemeff())
                .containsExactly(0, 0, 1, 0, 0);
    }

    @Test
    void smallMemoryRequestsAreLeftOutOfMemoryEfficiency() {
        JobRecord job = TestJobs.job("alice", DAY.plusHours(2), DAY.plusHours(3))
                .memMax(256L)
                .memEfficiency(50.0)
                .build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        ClusterIntervalStats cluster = aggregation.getStats().cluster(12);
        assertThat(cluster.getDone().getTotal()).isEqualTo(1);
        assertThat(cluster.getDone().getMemeff().getDist()).containsOnly(0L);
        assertThat(cluster.getDone().getMemeff().getCo2e()).isZero();
    }

    @Test
    void longFailureOverMemoryLimitIsTallied() {
        JobRecord job = TestJobs.job("bob", DAY.plusHours(1), DAY.plusHours(3))
                .status("EXIT")
                .memLimit(8192L)
                .memMax(9000L)
                .build();
        JobEnergyProfile profile = calculator.profile(job, null);

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        ClusterIntervalStats.FailedStats failed = aggregation.getStats().cluster(12).getFailed();
        assertThat(failed.getTotal()).isEqualTo(1);
        assertThat(failed.getCo2e()).isCloseTo(profile.getFootprint().getCo2e(), within(1e-12));
        assertThat(failed.getCost()).isCloseTo(profile.getFootprint().getCost(), within(1e-12));
        assertThat(failed.getMore1h().getTotal()).isEqualTo(1);
        assertThat(failed.getMemlim()).isEqualTo(1);

        UserIntervalStats bob = aggregation.getStats().existingUser(12, users.indexOf("bob"));
        assertThat(bob.getFailed().getTotal()).isEqualTo(1);
        assertThat(bob.getFailed().getMemlim()).isEqualTo(1);
        assertThat(bob.getDone()).isZero();
    }

    @Test
    void failureReasonsCanBeSwitchedOff() {
        properties.getFeatures().setTrackFailureReasons(false);
        JobRecord job = TestJobs.job("bob", DAY.plusHours(1), DAY.plusHours(3))
                .status("EXIT")
                .memLimit(8192L)
                .memMax(9000L)
                .build();

        SubWindowAggregation aggregation = day();
        aggregation.accumulate(job);

        ClusterIntervalStats.FailedStats failed = aggregation.getStats().cluster(12).getFailed();
        assertThat(failed.getTotal()).isEqualTo(1);
        assertThat(failed.getMore1h().getTotal()).isZero();
        assertThat(failed.getMemlim()).isZero();
    }

    @Test
    void jobsOfUnknownUsersAreSkipped() {
        SubWindowAggregation aggregation = day();
        aggregation.accumulate(TestJobs.job("mallory", DAY, DAY.plusHours(1)).build());

        assertThat(aggregation.getSkipped()).isEqualTo(1);
        assertThat(aggregation.getAccumulated()).isZero();
        assertThat(RollupMerger.merge(aggregation.getGrid(), aggregation.getStats(), users))
                .allSatisfy(row -> assertThat(row.getUsers()).isEmpty());
    }
}
