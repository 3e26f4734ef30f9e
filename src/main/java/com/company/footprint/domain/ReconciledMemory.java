package com.company.footprint.domain;

import lombok.Value;

/**
 * Best-estimate memory figures for a job, in MB.
 * Any field may be null when the scheduler did not report enough to derive it.
 */
@Value
public class ReconciledMemory {

    Double limitMb;
    Long maxMb;
    Double efficiency;

    /**
     * Memory basis for power draw: the limit if positive, else the peak if positive, else 0.
     */
    public double basisGb() {
        if (limitMb != null && limitMb > 0) {
            return limitMb / 1024;
        }
        if (maxMb != null && maxMb > 0) {
            return maxMb / 1024.0;
        }
        return 0;
    }

    public boolean isEfficiencyKnown() {
        return efficiency != null && limitMb != null;
    }

    public boolean exceededLimit() {
        return maxMb != null && limitMb != null && maxMb > limitMb;
    }
}
