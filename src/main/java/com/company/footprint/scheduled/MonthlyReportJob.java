package com.company.footprint.scheduled;

import com.company.footprint.service.MonthlyReportService;
import com.company.footprint.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "footprint.reports.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class MonthlyReportJob {

    private final MonthlyReportService reportService;

    /**
     * Report on the previous month, on the first of each month
     */
    @Scheduled(cron = "${footprint.reports.cron:0 30 3 1 * *}")
    public void createPreviousMonthReport() {
        log.info("Starting scheduled monthly report");

        try {
            reportService.createReport(TimeUtils.PREVIOUS);
        } catch (Exception e) {
            log.error("Scheduled monthly report failed", e);
        }
    }
}
