package com.company.footprint.config;

import com.company.footprint.repository.UsageRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final UsageRepository usageRepository;

    @Bean
    public MeterBinder usageMetrics(MeterRegistry registry) {
        return (reg) -> {
            // Staleness of the usage store
            Gauge.builder("usage.last.run.age.seconds", usageRepository, repo -> {
                        try {
                            return repo.findMetadataTime(UsageRepository.META_USAGE_RUN)
                                    .map(t -> (double) Duration.between(t, LocalDateTime.now()).getSeconds())
                                    .orElse(Double.NaN);
                        } catch (Exception e) {
                            log.warn("Failed to read last usage run time", e);
                            return Double.NaN;
                        }
                    })
                    .description("Seconds since usage was last computed")
                    .register(reg);

            log.info("Usage metrics registered");
        };
    }
}
