package com.company.footprint.aggregation;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.JobRecord;
import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.footprint.FootprintCalculator;
import com.company.footprint.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Turns the jobs overlapping one sub-window into its 15-minute usage rows.
 * Safe to call from several threads at once; each call owns its buckets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsageAggregationEngine {

    static final long PROGRESS_EVERY = 100_000;

    private final JobRepository jobRepository;
    private final FootprintCalculator calculator;
    private final FootprintProperties properties;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    /**
     * Aggregate {@code [from, to)}, a part of {@code day}.
     */
    @Transactional(readOnly = true)
    public SubWindowResult aggregate(LocalDate day, LocalDateTime from, LocalDateTime to,
                                     LocalDateTime lastJobsUpdate, UserIndex userIndex) {
        Span span = tracer.spanBuilder("usage.subwindow.aggregate")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("window.from", from.toString());
            span.setAttribute("window.to", to.toString());
            span.setAttribute("users", userIndex.size());

            SubWindowAggregation aggregation = new SubWindowAggregation(
                    from, to, lastJobsUpdate, userIndex, calculator,
                    properties.getAggregation(), properties.getFeatures());

            long read = 0;
            try (Stream<JobRecord> jobs = jobRepository.findJobs(from, to, null)) {
                Iterator<JobRecord> it = jobs.iterator();
                while (it.hasNext()) {
                    aggregation.accumulate(it.next());
                    read++;

                    if (read % PROGRESS_EVERY == 0) {
                        log.debug("{}: {} jobs processed", day, read);
                    }
                }
            }

            List<UsageReportRow> rows = RollupMerger.merge(aggregation.getGrid(), aggregation.getStats(), userIndex);

            meterRegistry.counter("usage.jobs.processed").increment(aggregation.getAccumulated());
            span.setAttribute("jobs.processed", aggregation.getAccumulated());
            span.setAttribute("jobs.skipped", aggregation.getSkipped());
            span.setAttribute("rows", rows.size());

            return new SubWindowResult(day, rows, aggregation.getAccumulated(), aggregation.getSkipped());

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to aggregate " + day);
            throw e;
        } finally {
            span.end();
        }
    }
}
