package com.company.footprint.aggregation;

import com.company.footprint.domain.ClusterIntervalStats;
import com.company.footprint.domain.UserIntervalStats;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 15-minute counters over a sub-window: sparse per user, dense cluster-wide.
 */
public class IntervalStats {

    public static final int MINUTES_PER_INTERVAL = 15;

    private final LocalDateTime from;
    private final LocalDateTime to;
    private final int intervals;
    private final UserIntervalStats[][] users;
    private final ClusterIntervalStats[] cluster;

    public IntervalStats(LocalDateTime from, LocalDateTime to, int users) {
        this.from = from;
        this.to = to;
        long minutes = (long) Math.ceil(Duration.between(from, to).getSeconds() / 60.0);
        this.intervals = (int) ((minutes + MINUTES_PER_INTERVAL - 1) / MINUTES_PER_INTERVAL);
        this.users = new UserIntervalStats[intervals][users];
        this.cluster = new ClusterIntervalStats[intervals];
        for (int i = 0; i < intervals; i++) {
            cluster[i] = new ClusterIntervalStats();
        }
    }

    public int getIntervals() {
        return intervals;
    }

    public LocalDateTime intervalStart(int interval) {
        return from.plusMinutes((long) interval * MINUTES_PER_INTERVAL);
    }

    /**
     * Interval containing {@code time}, or -1 if it is outside {@code [from, to)}.
     */
    public int intervalOf(LocalDateTime time) {
        if (time.isBefore(from) || !time.isBefore(to)) {
            return -1;
        }
        long seconds = Duration.between(from, time).getSeconds();
        return (int) (seconds / (MINUTES_PER_INTERVAL * 60));
    }

    public UserIntervalStats user(int interval, int user) {
        if (users[interval][user] == null) {
            users[interval][user] = new UserIntervalStats();
        }
        return users[interval][user];
    }

    /**
     * @return the user's counters, or null if nothing was credited to them
     */
    public UserIntervalStats existingUser(int interval, int user) {
        return users[interval][user];
    }

    public ClusterIntervalStats cluster(int interval) {
        return cluster[interval];
    }
}
