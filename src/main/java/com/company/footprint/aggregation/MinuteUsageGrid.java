package com.company.footprint.aggregation;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 1-minute buckets covering {@code [from, to)}. A user's timeline is only allocated
 * once a job of theirs runs in the window.
 */
public class MinuteUsageGrid {

    static final int SECONDS_PER_MINUTE = 60;

    private final LocalDateTime from;
    private final int minutes;
    private final UserTimeline[] timelines;

    public MinuteUsageGrid(LocalDateTime from, LocalDateTime to, int users) {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Empty window: " + from + " - " + to);
        }
        this.from = from;
        this.minutes = (int) Math.ceil(Duration.between(from, to).getSeconds() / (double) SECONDS_PER_MINUTE);
        this.timelines = new UserTimeline[users];
    }

    public LocalDateTime getFrom() {
        return from;
    }

    public int getMinutes() {
        return minutes;
    }

    public LocalDateTime minuteStart(int minute) {
        return from.plusMinutes(minute);
    }

    /**
     * Index of the first bucket starting at or after {@code time}.
     */
    int firstMinuteAtOrAfter(LocalDateTime time) {
        long offset = Duration.between(from, time).getSeconds();
        if (offset <= 0) {
            return 0;
        }
        return (int) Math.min(minutes, (offset + SECONDS_PER_MINUTE - 1) / SECONDS_PER_MINUTE);
    }

    /**
     * Credit equal per-minute shares to every bucket starting in {@code [allocationStart, finish)}.
     *
     * @return number of buckets credited
     */
    int credit(int user, LocalDateTime allocationStart, LocalDateTime finish, MinuteShare share) {
        long finishOffset = Duration.between(from, finish).getSeconds();
        int first = firstMinuteAtOrAfter(allocationStart);

        int credited = 0;
        UserTimeline timeline = null;
        for (int m = first; m < minutes && (long) m * SECONDS_PER_MINUTE < finishOffset; m++) {
            if (timeline == null) {
                timeline = timeline(user);
            }
            timeline.jobs[m] += share.getJobs();
            timeline.cores[m] += share.getCores();
            timeline.memory[m] += share.getMemory();
            timeline.co2e[m] += share.getCo2e();
            timeline.cost[m] += share.getCost();
            timeline.cputime[m] += share.getCputime();
            credited++;
        }
        return credited;
    }

    UserTimeline timeline(int user) {
        if (timelines[user] == null) {
            timelines[user] = new UserTimeline(minutes);
        }
        return timelines[user];
    }

    /**
     * @return the user's buckets, or null if nothing ran for them
     */
    UserTimeline existingTimeline(int user) {
        return timelines[user];
    }

    int users() {
        return timelines.length;
    }

    /**
     * What one job adds to each minute it runs in.
     */
    @Value
    static class MinuteShare {
        double jobs;
        double cores;
        double memory;
        double co2e;
        double cost;
        double cputime;
    }
}
