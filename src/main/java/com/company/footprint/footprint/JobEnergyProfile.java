package com.company.footprint.footprint;

import com.company.footprint.domain.JobRecord;
import com.company.footprint.domain.ReconciledMemory;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Power draw and footprint of one job between its start and its effective finish.
 */
@Value
@Builder
public class JobEnergyProfile {

    JobRecord job;
    ReconciledMemory memory;
    double memoryGb;
    double coresPowerWatts;
    double memoryPowerWatts;

    /**
     * Real finish for terminal jobs, the caller's "now" for open ones; never before start + 1 minute.
     */
    LocalDateTime effectiveFinish;
    double runtimeMinutes;

    /**
     * Footprint over {@link #runtimeMinutes}.
     */
    Footprint footprint;

    public double getEnergyKw() {
        return (coresPowerWatts + memoryPowerWatts) / 1000;
    }

    public double getCpuTime() {
        return job.getCpuTime() != null ? job.getCpuTime() : 0;
    }

    public double getRuntimeSeconds() {
        return Duration.between(job.getStartTime(), effectiveFinish).getSeconds();
    }

    public boolean isTerminal() {
        return job.getFinishTime() != null;
    }
}
