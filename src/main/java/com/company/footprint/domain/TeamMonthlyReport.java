package com.company.footprint.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Team totals for one month; each member's totals are split evenly across the member's teams.
 */
@Data
@NoArgsConstructor
public class TeamMonthlyReport {

    private String team;
    private double jobs;
    private double cputime;
    private double co2e;
    private double cost;

    public TeamMonthlyReport(String team) {
        this.team = team;
    }
}
