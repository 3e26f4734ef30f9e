package com.company.footprint.aggregation;

import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.domain.UserUsage;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds minute buckets into 15-minute usage rows.
 */
public final class RollupMerger {

    private RollupMerger() {
    }

    /**
     * One row per interval of the sub-window, including intervals where nothing ran.
     * A user appears in a row only if some job of theirs ran during the interval.
     */
    public static List<UsageReportRow> merge(MinuteUsageGrid grid, IntervalStats stats, UserIndex userIndex) {
        List<UsageReportRow> rows = new ArrayList<>(stats.getIntervals());

        for (int interval = 0; interval < stats.getIntervals(); interval++) {
            UsageReportRow row = UsageReportRow.builder()
                    .intervalStart(stats.intervalStart(interval))
                    .jobs(stats.cluster(interval))
                    .build();

            int first = interval * IntervalStats.MINUTES_PER_INTERVAL;
            int last = Math.min(first + IntervalStats.MINUTES_PER_INTERVAL, grid.getMinutes());

            for (int user = 0; user < grid.users(); user++) {
                UserTimeline timeline = grid.existingTimeline(user);
                if (timeline == null) {
                    continue;
                }

                UserUsage usage = rollUp(timeline, first, last, new UserUsage(stats.existingUser(interval, user)));
                if (usage.getJobs() > 0) {
                    row.getUsers().put(userIndex.loginAt(user), usage);
                }
            }

            rows.add(row);
        }

        return rows;
    }

    private static UserUsage rollUp(UserTimeline timeline, int first, int last, UserUsage usage) {
        for (int m = first; m < last; m++) {
            usage.setJobs(usage.getJobs() + timeline.jobs[m]);
            usage.setCo2e(usage.getCo2e() + timeline.co2e[m]);
            usage.setCost(usage.getCost() + timeline.cost[m]);
            usage.setCputime(usage.getCputime() + timeline.cputime[m]);
            usage.setCores(Math.max(usage.getCores(), timeline.cores[m]));
            usage.setMemory(Math.max(usage.getMemory(), timeline.memory[m]));
        }
        return usage;
    }
}
