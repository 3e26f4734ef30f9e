package com.company.footprint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the footprint service.
 */
@Configuration
@ConfigurationProperties(prefix = "footprint")
@Data
public class FootprintProperties {

    private PowerConfig power = new PowerConfig();

    /**
     * Grid carbon intensity revisions, any order. Each entry applies from its
     * effective time (inclusive) until the next one.
     */
    private List<CarbonIntensityEntry> carbonIntensity = new ArrayList<>(List.of(
            new CarbonIntensityEntry("1970-01-01T00:00:00", 231.12),
            new CarbonIntensityEntry("2024-01-01T00:00:00", 207.05)
    ));

    private AggregationConfig aggregation = new AggregationConfig();

    private FeatureConfig features = new FeatureConfig();

    private UsersConfig users = new UsersConfig();

    private IdentityConfig identity = new IdentityConfig();

    @Data
    public static class PowerConfig {
        /**
         * Data-centre power usage effectiveness.
         */
        private double pue = 1.2;

        /**
         * Watts drawn per fully used core.
         */
        private double cpuWattsPerCore = 6.3;

        /**
         * Watts added for a job on a GPU queue (one GPU at full use assumed).
         */
        private double gpuWatts = 300;

        /**
         * Watts per GB of memory held.
         */
        private double memoryWattsPerGb = 0.3725;

        /**
         * Energy price per kWh.
         */
        private double energyCostPerKwh = 0.34;

        /**
         * Queue-name substring marking GPU queues.
         */
        private String gpuQueueMarker = "gpu";
    }

    @Data
    public static class CarbonIntensityEntry {
        /**
         * ISO local date-time from which the value applies.
         */
        private String effectiveFrom;

        /**
         * Grams CO2e per kWh.
         */
        private double gramsPerKwh;

        public CarbonIntensityEntry() {
        }

        public CarbonIntensityEntry(String effectiveFrom, double gramsPerKwh) {
            this.effectiveFrom = effectiveFrom;
            this.gramsPerKwh = gramsPerKwh;
        }
    }

    @Data
    public static class AggregationConfig {
        /**
         * Sub-windows (days) processed in parallel.
         */
        private int workers = 1;

        /**
         * Requests below this size (MB) are left out of memory-efficiency histograms.
         */
        private long minMemoryRequestMb = 1024;

        /**
         * Failed jobs running at least this long are tallied separately.
         */
        private long longFailureSeconds = 3600;

        /**
         * Headroom over the observed peak assumed for an optimal memory request.
         */
        private double optimalMemoryHeadroom = 1.1;
    }

    @Data
    public static class FeatureConfig {
        /**
         * Track long-running and out-of-memory failure reasons.
         */
        private boolean trackFailureReasons = true;

        /**
         * Store team rollups alongside monthly user reports.
         */
        private boolean teamReports = true;
    }

    @Data
    public static class UsersConfig {
        /**
         * Refresh stored users from the identity directory on each tracking run.
         */
        private boolean updateMetadata = true;

        /**
         * Optional JSON file of per-login metadata overriding the directory.
         */
        private String customFile;

        /**
         * Series label used when usage is not broken down by team.
         */
        private String organisationLabel = "EMBL-EBI";
    }

    @Data
    public static class IdentityConfig {
        private boolean enabled = false;
        private String baseUrl = "https://www.ebi.ac.uk/ebisearch/ws/rest/ebiweb_people/";
        private String emailDomain = "ebi.ac.uk";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
    }
}
