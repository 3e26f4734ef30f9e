package com.company.footprint.footprint;

import com.company.footprint.config.FootprintProperties.CarbonIntensityEntry;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Step function of grid carbon intensity over time.
 * A revision applies from its effective time inclusive; times before the first revision use it.
 */
public class CarbonIntensityTable {

    private final LocalDateTime[] effectiveFrom;
    private final double[] gramsPerKwh;

    public CarbonIntensityTable(List<CarbonIntensityEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("At least one carbon intensity entry is required");
        }

        CarbonIntensityEntry[] sorted = entries.stream()
                .sorted(Comparator.comparing(e -> LocalDateTime.parse(e.getEffectiveFrom())))
                .toArray(CarbonIntensityEntry[]::new);

        this.effectiveFrom = new LocalDateTime[sorted.length];
        this.gramsPerKwh = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            effectiveFrom[i] = LocalDateTime.parse(sorted[i].getEffectiveFrom());
            gramsPerKwh[i] = sorted[i].getGramsPerKwh();
        }
    }

    public double intensityAt(LocalDateTime at) {
        int i = Arrays.binarySearch(effectiveFrom, at);
        if (i < 0) {
            // insertion point - 1 is the last revision before `at`
            i = Math.max(0, -i - 2);
        }
        return gramsPerKwh[i];
    }

    public int size() {
        return effectiveFrom.length;
    }
}
