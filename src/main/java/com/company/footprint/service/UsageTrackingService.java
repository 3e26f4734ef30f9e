package com.company.footprint.service;

import com.company.footprint.aggregation.SubWindowResult;
import com.company.footprint.aggregation.UsageAggregationEngine;
import com.company.footprint.aggregation.UserIndex;
import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.UserProfile;
import com.company.footprint.dto.response.TrackingRunResponse;
import com.company.footprint.exception.UsageProcessingException;
import com.company.footprint.repository.JobRepository;
import com.company.footprint.repository.UsageRepository;
import com.company.footprint.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.*;

/**
 * Computes usage rows for a window, one day at a time, and records the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsageTrackingService {

    private final JobRepository jobRepository;
    private final UsageRepository usageRepository;
    private final UsageAggregationEngine engine;
    private final UserDirectoryService userDirectory;
    private final FootprintProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * @param from {@code auto}, {@code today}, {@code yesterday} or {@code YYYY-MM-DD}
     * @param to exclusive end day {@code YYYY-MM-DD}, or null for tomorrow
     */
    public TrackingRunResponse track(String from, String to) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime fromTime = TimeUtils.resolveWindowStart(from, now,
                usageRepository.findMetadataTime(UsageRepository.META_USAGE_RUN));
        LocalDateTime toTime = TimeUtils.resolveWindowEnd(to, now);

        return track(fromTime, toTime);
    }

    public TrackingRunResponse track(LocalDateTime from, LocalDateTime to) {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Empty window: " + from + " - " + to);
        }

        Optional<LocalDateTime> latestUpdate = jobRepository.findLatestUpdateTime();
        if (latestUpdate.isEmpty()) {
            log.warn("No jobs stored yet, nothing to track");
            return TrackingRunResponse.builder().from(from).to(to).build();
        }
        LocalDateTime lastJobsUpdate = latestUpdate.get();

        log.info("Loading users");
        Map<String, UserProfile> users = userDirectory.loadUsers();
        UserIndex userIndex = new UserIndex(users.keySet());

        log.info("Processing jobs from {} to {} (last job update: {})", from, to, lastJobsUpdate);
        RunTotals totals = processDays(from, to, lastJobsUpdate, userIndex);

        usageRepository.bumpMetadata(lastJobsUpdate, LocalDateTime.now());
        userDirectory.saveUsers(users.values());

        log.info("Done: {} days, {} jobs, {} rows", totals.days, totals.jobsProcessed, totals.rowsWritten);

        return TrackingRunResponse.builder()
                .from(from)
                .to(to)
                .jobsUpdateTime(lastJobsUpdate)
                .days(totals.days)
                .jobsProcessed(totals.jobsProcessed)
                .jobsSkipped(totals.jobsSkipped)
                .rowsWritten(totals.rowsWritten)
                .users(users.size())
                .build();
    }

    /**
     * Aggregate each day on the worker pool and write the results as they complete.
     * The first failure cancels the days still pending and aborts the run.
     */
    private RunTotals processDays(LocalDateTime from, LocalDateTime to, LocalDateTime lastJobsUpdate,
                                  UserIndex userIndex) {
        List<LocalDate> days = TimeUtils.daysBetween(from, to);
        int workers = Math.max(1, properties.getAggregation().getWorkers());

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CompletionService<SubWindowResult> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<SubWindowResult>, LocalDate> pending = new HashMap<>();

        try {
            for (LocalDate day : days) {
                LocalDateTime dayStart = day.atStartOfDay().isBefore(from) ? from : day.atStartOfDay();
                LocalDateTime dayEnd = day.plusDays(1).atStartOfDay().isAfter(to) ? to : day.plusDays(1).atStartOfDay();

                Future<SubWindowResult> future = completionService.submit(() ->
                        engine.aggregate(day, dayStart, dayEnd, lastJobsUpdate, userIndex));
                pending.put(future, day);
            }

            RunTotals totals = new RunTotals();
            for (int i = 0; i < days.size(); i++) {
                Future<SubWindowResult> future = completionService.take();
                LocalDate day = pending.remove(future);

                SubWindowResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    throw fail(day, e.getCause(), pending);
                }

                try {
                    usageRepository.upsertIntervalRows(result.getRows());
                } catch (RuntimeException e) {
                    throw fail(day, e, pending);
                }

                meterRegistry.counter("usage.subwindows.completed").increment();
                log.info("{}: {} jobs, {} rows", day, result.getJobsProcessed(), result.getRows().size());

                totals.days++;
                totals.jobsProcessed += result.getJobsProcessed();
                totals.jobsSkipped += result.getJobsSkipped();
                totals.rowsWritten += result.getRows().size();
            }
            return totals;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.keySet().forEach(f -> f.cancel(true));
            throw new UsageProcessingException("Interrupted while processing usage from " + from + " to " + to);
        } finally {
            executor.shutdownNow();
        }
    }

    private UsageProcessingException fail(LocalDate day, Throwable cause,
                                          Map<Future<SubWindowResult>, LocalDate> pending) {
        pending.keySet().forEach(f -> f.cancel(true));
        meterRegistry.counter("usage.subwindows.failed").increment();
        log.error("Usage processing failed for {}", day, cause);
        return new UsageProcessingException(day, cause);
    }

    private static class RunTotals {
        int days;
        long jobsProcessed;
        long jobsSkipped;
        long rowsWritten;
    }
}
