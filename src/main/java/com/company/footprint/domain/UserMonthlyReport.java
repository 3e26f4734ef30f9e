package com.company.footprint.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's totals for one calendar month, ranked against every other user of that month.
 */
@Data
@NoArgsConstructor
public class UserMonthlyReport {

    @JsonIgnore
    private String login;

    private JobCounts jobs = new JobCounts();
    private double co2e;
    private double cost;
    private long[] memory = new long[ClusterIntervalStats.PERCENT_BUCKETS];
    private double cputime;
    private Integer rank;
    private double totalCo2e;
    private double share;

    public UserMonthlyReport(String login) {
        this.login = login;
    }

    @Data
    public static class JobCounts {
        private long total;
        private long done;
        private long exit;
    }
}
