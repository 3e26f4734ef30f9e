package com.company.footprint.service;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.domain.UserProfile;
import com.company.footprint.domain.UserUsage;
import com.company.footprint.dto.response.Co2eSeriesResponse;
import com.company.footprint.repository.UsageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

/**
 * Read side of the usage store: stored rows and CO2e time series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsageViewService {

    private final UsageRepository usageRepository;
    private final FootprintProperties properties;

    public enum Period {
        DAY, WEEK, MONTH;

        /**
         * First day of the period containing {@code date}; weeks start on Monday.
         */
        public LocalDate startOf(LocalDate date) {
            if (this == WEEK) {
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            }
            if (this == MONTH) {
                return date.withDayOfMonth(1);
            }
            return date;
        }

        public static Period fromString(String value) {
            if (value == null || value.isBlank()) {
                return DAY;
            }
            try {
                return valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid interval: " + value + " (expected day, week or month)");
            }
        }
    }

    public enum Co2eUnit {
        G(1, 0), KG(1e-3, 0), T(1e-6, 3);

        private final double factor;
        private final int digits;

        Co2eUnit(double factor, int digits) {
            this.factor = factor;
            this.digits = digits;
        }

        public double convert(double grams) {
            return BigDecimal.valueOf(grams * factor).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
        }

        public static Co2eUnit fromString(String value) {
            if (value == null || value.isBlank()) {
                return KG;
            }
            try {
                return valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid unit: " + value + " (expected g, kg or t)");
            }
        }
    }

    public List<UsageReportRow> getIntervalRows(LocalDateTime from, LocalDateTime to) {
        return usageRepository.findIntervalRows(from, to);
    }

    /**
     * CO2e per period, either for the whole organisation or split by team.
     *
     * @param from first day, or null for the earliest stored interval
     * @param to exclusive end day, or null for the latest stored interval
     * @param users logins to include, or null/empty for everyone
     * @param numSeries maximum number of columns including "Others", or 0 for all
     */
    public Co2eSeriesResponse getCo2eSeries(LocalDate from, LocalDate to, Period period, boolean byTeam,
                                            Collection<String> users, int numSeries, Co2eUnit unit) {
        Optional<LocalDateTime> start = from != null
                ? Optional.of(from.atStartOfDay()) : usageRepository.findEarliestIntervalStart();
        Optional<LocalDateTime> stop = to != null
                ? Optional.of(to.atStartOfDay()) : usageRepository.findLatestIntervalStart();

        Co2eSeriesResponse response = Co2eSeriesResponse.builder()
                .groupBy(byTeam ? "team" : "organisation")
                .unit(unit.name().toLowerCase(Locale.ROOT))
                .build();

        if (start.isEmpty() || stop.isEmpty()) {
            return response;
        }

        Map<String, List<String>> seriesOf = seriesByUser(byTeam, users);

        // Every period of the range appears, even when nothing ran
        Map<LocalDate, Map<String, Double>> usage = new TreeMap<>();
        for (LocalDateTime day = start.get(); day.isBefore(stop.get()); day = day.plusDays(1)) {
            usage.computeIfAbsent(period.startOf(day.toLocalDate()), k -> new HashMap<>());
        }

        Map<String, Double> totals = new HashMap<>();
        for (UsageReportRow row : usageRepository.findIntervalRows(start.get(), stop.get())) {
            Map<String, Double> periodUsage = usage.computeIfAbsent(
                    period.startOf(row.getIntervalStart().toLocalDate()), k -> new HashMap<>());

            for (Map.Entry<String, UserUsage> entry : row.getUsers().entrySet()) {
                List<String> series = seriesOf.get(entry.getKey());
                if (series == null) {
                    continue;
                }
                for (String name : series) {
                    periodUsage.merge(name, entry.getValue().getCo2e(), Double::sum);
                    totals.merge(name, entry.getValue().getCo2e(), Double::sum);
                }
            }
        }

        List<String> series = new ArrayList<>(totals.keySet());
        series.sort(Comparator.comparing((String s) -> -totals.get(s)).thenComparing(Comparator.naturalOrder()));

        boolean hasOthers = numSeries > 0 && series.size() > numSeries;
        if (hasOthers) {
            series = new ArrayList<>(series.subList(0, Math.max(1, numSeries - 1)));
        }

        response.getSeries().addAll(series);
        if (hasOthers) {
            response.getSeries().add(Co2eSeriesResponse.OTHERS);
        }

        for (Map.Entry<LocalDate, Map<String, Double>> entry : usage.entrySet()) {
            Map<String, Double> remaining = new HashMap<>(entry.getValue());
            Co2eSeriesResponse.Point point = new Co2eSeriesResponse.Point();
            point.setPeriod(entry.getKey());

            for (String name : series) {
                Double co2e = remaining.remove(name);
                point.getValues().put(name, unit.convert(co2e != null ? co2e : 0));
            }
            if (hasOthers) {
                double others = remaining.values().stream().mapToDouble(Double::doubleValue).sum();
                point.getValues().put(Co2eSeriesResponse.OTHERS, unit.convert(others));
            }

            response.getPoints().add(point);
        }

        return response;
    }

    private Map<String, List<String>> seriesByUser(boolean byTeam, Collection<String> users) {
        String organisation = properties.getUsers().getOrganisationLabel();

        Map<String, List<String>> seriesOf = new HashMap<>();
        for (UserProfile user : usageRepository.findUsers().values()) {
            if (users != null && !users.isEmpty() && !users.contains(user.getLogin())) {
                continue;
            }
            seriesOf.put(user.getLogin(), byTeam ? user.getTeams() : List.of(organisation));
        }
        return seriesOf;
    }
}
