package com.company.footprint.scheduled;

import com.company.footprint.service.UsageTrackingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "footprint.tracking.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class UsageTrackingJob {

    private final UsageTrackingService trackingService;

    /**
     * Recompute usage from the day before the last run up to tomorrow
     */
    @Scheduled(cron = "${footprint.tracking.cron:0 5 * * * *}")
    public void trackUsage() {
        log.info("Starting scheduled usage tracking");

        try {
            trackingService.track("auto", null);
        } catch (IllegalStateException e) {
            // First run must be started by hand with an explicit date
            log.warn("Usage tracking skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled usage tracking failed", e);
        }
    }
}
