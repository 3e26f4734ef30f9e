package com.company.footprint.footprint;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.JobRecord;
import com.company.footprint.domain.ReconciledMemory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Estimates power draw, emissions and energy cost of cluster jobs.
 * These are estimates from reported efficiencies, not metered values: missing inputs contribute nothing.
 */
@Component
@Slf4j
public class FootprintCalculator {

    private final FootprintProperties.PowerConfig power;
    private final CarbonIntensityTable carbonIntensity;
    private final double optimalMemoryHeadroom;

    public FootprintCalculator(FootprintProperties properties) {
        this.power = properties.getPower();
        this.carbonIntensity = new CarbonIntensityTable(properties.getCarbonIntensity());
        this.optimalMemoryHeadroom = properties.getAggregation().getOptimalMemoryHeadroom();

        log.info("Footprint model: PUE {}, {} carbon intensity revision(s), {} per kWh",
                power.getPue(), carbonIntensity.size(), power.getEnergyCostPerKwh());
    }

    /**
     * Footprint of drawing {@code energyKw} for {@code runtimeHours}, using the grid intensity in force at {@code at}.
     */
    public Footprint footprint(double energyKw, double runtimeHours, LocalDateTime at) {
        double energyNeeded = runtimeHours * energyKw * power.getPue();
        return new Footprint(
                energyNeeded * carbonIntensity.intensityAt(at),
                energyNeeded * power.getEnergyCostPerKwh()
        );
    }

    public double coresPowerWatts(JobRecord job) {
        double watts = job.getSlots() * (job.getClampedCpuEfficiency() / 100) * power.getCpuWattsPerCore();
        if (isGpuQueue(job.getQueue())) {
            // GPU count and efficiency are not reported: assume one, fully used
            watts += power.getGpuWatts();
        }
        return watts;
    }

    public double memoryPowerWatts(double memoryGb) {
        return memoryGb * power.getMemoryWattsPerGb();
    }

    public boolean isGpuQueue(String queue) {
        return queue != null && queue.contains(power.getGpuQueueMarker());
    }

    /**
     * Build the energy profile of a job.
     *
     * @param job a job that has started
     * @param openJobFinish finish time to assume if the job has not terminated
     */
    public JobEnergyProfile profile(JobRecord job, LocalDateTime openJobFinish) {
        ReconciledMemory memory = job.reconcileMemory();
        double memoryGb = memory.basisGb();
        double coresWatts = coresPowerWatts(job);
        double memoryWatts = memoryPowerWatts(memoryGb);

        LocalDateTime start = job.getStartTime();
        LocalDateTime finish = job.getFinishTime() != null ? job.getFinishTime() : openJobFinish;
        if (!finish.isAfter(start)) {
            // One minute or less
            finish = start.plusMinutes(1);
        }

        double runtimeMinutes = Duration.between(start, finish).getSeconds() / 60.0;
        double energyKw = (coresWatts + memoryWatts) / 1000;

        return JobEnergyProfile.builder()
                .job(job)
                .memory(memory)
                .memoryGb(memoryGb)
                .coresPowerWatts(coresWatts)
                .memoryPowerWatts(memoryWatts)
                .effectiveFinish(finish)
                .runtimeMinutes(runtimeMinutes)
                .footprint(footprint(energyKw, runtimeMinutes / 60, start))
                .build();
    }

    /**
     * Footprint over the job's whole recorded lifetime had memory been requested at peak plus headroom.
     * Only meaningful when the reconciled memory efficiency is known.
     */
    public Footprint optimalMemoryFootprint(JobEnergyProfile profile, double runtimeHours) {
        double efficiency = profile.getMemory().getEfficiency();
        double optimalGb = (profile.getMemoryGb() * efficiency / 100) * optimalMemoryHeadroom;
        double energyKw = (profile.getCoresPowerWatts() + memoryPowerWatts(optimalGb)) / 1000;
        return footprint(energyKw, runtimeHours, profile.getJob().getStartTime());
    }
}
