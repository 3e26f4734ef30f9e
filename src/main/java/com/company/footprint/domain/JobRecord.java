package com.company.footprint.domain;

import com.company.footprint.domain.enums.LifecycleState;
import com.company.footprint.domain.enums.SchedulerType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * One occurrence of a cluster job as last reported by the scheduler poller.
 * Timestamps are cluster-local wall-clock times.
 */
@Value
@Builder(toBuilder = true)
public class JobRecord {

    // Identity
    String scheduler;
    long jobId;
    int jobIndex;
    String name;
    String status;
    String user;
    String queue;

    // Resource facts
    int slots;
    Double cpuEfficiency;   // %, may exceed 100
    Double cpuTime;         // seconds
    Long memLimit;          // MB
    Long memMax;            // MB
    Double memEfficiency;   // %
    String fromHost;
    String execHost;

    // Lifecycle
    LocalDateTime submitTime;
    LocalDateTime startTime;
    LocalDateTime finishTime;
    LocalDateTime updateTime;

    /**
     * Globally unique key: submit epoch seconds, scheduler, job id and array index.
     */
    public String getAccession() {
        long ts = submitTime.atZone(ZoneId.systemDefault()).toEpochSecond();
        return ts + "-" + scheduler + "-" + jobId + "-" + jobIndex;
    }

    public LifecycleState getLifecycleState() {
        if (finishTime != null) {
            return LifecycleState.TERMINAL;
        }
        return startTime != null ? LifecycleState.RUNNING : LifecycleState.PENDING;
    }

    /**
     * True only for a terminal job whose status is its scheduler's success code.
     */
    public boolean isOk() {
        if (finishTime == null) {
            return false;
        }
        return SchedulerType.fromTag(scheduler).isSuccessful(status);
    }

    /**
     * CPU efficiency clamped to [0, 100]; unknown counts as 0.
     */
    public double getClampedCpuEfficiency() {
        if (cpuEfficiency == null) {
            return 0;
        }
        return Math.max(0, Math.min(cpuEfficiency, 100));
    }

    /**
     * Reconcile limit, peak and reported efficiency, which the scheduler does not keep consistent.
     * When both peak and a non-zero efficiency are known the limit is derived from them.
     */
    public ReconciledMemory reconcileMemory() {
        if (memEfficiency != null && memMax != null && memEfficiency != 0) {
            double limit = memMax / (memEfficiency / 100);
            return new ReconciledMemory(limit, memMax, Math.min(memEfficiency, 100));
        }

        if (memLimit != null) {
            Double efficiency = memEfficiency != null ? Math.min(memEfficiency, 100) : null;
            return new ReconciledMemory(memLimit.doubleValue(), memMax, efficiency);
        }

        return new ReconciledMemory(null, memMax, null);
    }
}
