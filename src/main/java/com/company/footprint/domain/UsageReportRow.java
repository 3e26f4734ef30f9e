package com.company.footprint.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage for one 15-minute interval: sparse per-user map plus cluster-wide histograms.
 * Persisted keyed by {@link #getTimeKey()}; writing the same interval again replaces it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageReportRow {

    public static final DateTimeFormatter TIME_KEY_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmm");

    private LocalDateTime intervalStart;
    @Builder.Default
    private Map<String, UserUsage> users = new LinkedHashMap<>();
    @Builder.Default
    private ClusterIntervalStats jobs = new ClusterIntervalStats();

    public String getTimeKey() {
        return intervalStart.format(TIME_KEY_FORMAT);
    }

    public static LocalDateTime parseTimeKey(String timeKey) {
        return LocalDateTime.parse(timeKey, TIME_KEY_FORMAT);
    }
}
