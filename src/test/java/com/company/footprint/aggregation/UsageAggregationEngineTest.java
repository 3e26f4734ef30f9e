package com.company.footprint.aggregation;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.TestJobs;
import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.domain.UserUsage;
import com.company.footprint.footprint.FootprintCalculator;
import com.company.footprint.repository.JobRepository;
import com.company.footprint.repository.UsageRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@JdbcTest
@Import({JobRepository.class, UsageRepository.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class UsageAggregationEngineTest {

    private static final LocalDate DAY = LocalDate.of(2023, 6, 1);
    private static final LocalDateTime FROM = DAY.atStartOfDay();
    private static final LocalDateTime TO = FROM.plusDays(1);
    private static final LocalDateTime LAST_POLL = FROM.plusHours(12);

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private UsageRepository usageRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final FootprintProperties properties = new FootprintProperties();
    private final UserIndex userIndex = new UserIndex(List.of("alice", "bob"));

    private InMemorySpanExporter spans;
    private SdkTracerProvider tracerProvider;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        spans = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spans))
                .build();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    private UsageAggregationEngine engine(JobRepository repository) {
        return new UsageAggregationEngine(repository, new FootprintCalculator(properties), properties,
                meterRegistry, tracerProvider.get("test"));
    }

    private void storeJobs() {
        jobRepository.upsertClosedJobs(List.of(
                TestJobs.job("alice", FROM, FROM.plusMinutes(3))
                        .slots(2)
                        .cpuEfficiency(50.0)
                        .memLimit(8192L)
                        .build(),
                TestJobs.job("mallory", FROM.plusHours(1), FROM.plusHours(2)).build()));
        jobRepository.replaceOpenJobs(List.of(
                TestJobs.job("bob", FROM.plusHours(11), null).build()));
    }

    @Test
    void storedJobsBecomeIntervalRows() {
        storeJobs();

        SubWindowResult result = engine(jobRepository).aggregate(DAY, FROM, TO, LAST_POLL, userIndex);

        List<UsageReportRow> rows = result.getRows();
        assertThat(rows).hasSize(96);
        assertThat(result.getJobsProcessed()).isEqualTo(2);
        assertThat(result.getJobsSkipped()).isEqualTo(1);

        UserUsage alice = rows.get(0).getUsers().get("alice");
        assertThat(alice.getJobs()).isCloseTo(1.0, within(1e-9));
        assertThat(alice.getCores()).isEqualTo(2);
        assertThat(alice.getMemory()).isEqualTo(8);
        assertThat(alice.getDone()).isEqualTo(1);
        assertThat(rows.get(0).getJobs().getDone().getTotal()).isEqualTo(1);

        // Open job runs until the last poll
        for (int i = 44; i < 48; i++) {
            assertThat(rows.get(i).getUsers().get("bob").getJobs()).isCloseTo(0.25, within(1e-9));
        }
        assertThat(rows.get(48).getUsers()).doesNotContainKey("bob");
        assertThat(rows.get(44).getUsers().get("bob").getSubmitted()).isEqualTo(1);

        assertThat(meterRegistry.counter("usage.jobs.processed").count()).isEqualTo(2);

        List<SpanData> finished = spans.getFinishedSpanItems();
        assertThat(finished).hasSize(1);
        assertThat(finished.get(0).getName()).isEqualTo("usage.subwindow.aggregate");
        assertThat(finished.get(0).getAttributes().get(AttributeKey.longKey("jobs.processed"))).isEqualTo(2L);
        assertThat(finished.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.UNSET);
    }

    @Test
    void rerunningTheWindowRewritesIdenticalRows() {
        storeJobs();
        UsageAggregationEngine engine = engine(jobRepository);

        SubWindowResult first = engine.aggregate(DAY, FROM, TO, LAST_POLL, userIndex);
        usageRepository.upsertIntervalRows(first.getRows());
        SubWindowResult second = engine.aggregate(DAY, FROM, TO, LAST_POLL, userIndex);
        usageRepository.upsertIntervalRows(second.getRows());

        assertThat(second.getRows()).isEqualTo(first.getRows());
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM usage_intervals", Integer.class))
                .isEqualTo(96);
        assertThat(usageRepository.findIntervalRows(FROM, TO)).isEqualTo(second.getRows());
    }

    @Test
    void failedQueryIsRecordedOnTheSpan() {
        JobRepository failing = mock(JobRepository.class);
        when(failing.findJobs(FROM, TO, null)).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> engine(failing).aggregate(DAY, FROM, TO, LAST_POLL, userIndex))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection reset");

        SpanData span = spans.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).extracting(e -> e.getName()).contains("exception");
        assertThat(meterRegistry.find("usage.jobs.processed").counter()).isNull();
    }
}
