package com.company.footprint.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyReport {

    /** Login under which team rollups are stored. */
    public static final String TEAMS_LOGIN = "_";

    private YearMonth month;
    private long jobCount;
    @Builder.Default
    private Map<String, UserMonthlyReport> users = new LinkedHashMap<>();
    @Builder.Default
    private List<TeamMonthlyReport> teams = new ArrayList<>();
}
