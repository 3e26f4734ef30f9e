package com.company.footprint.util;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TimeUtils {

    public static final String AUTO = "auto";
    public static final String TODAY = "today";
    public static final String YESTERDAY = "yesterday";
    public static final String CURRENT = "current";
    public static final String PREVIOUS = "previous";

    /**
     * Resolve the start of a tracking run.
     *
     * @param from {@code auto}, {@code today}, {@code yesterday} or {@code YYYY-MM-DD}
     * @param now current local time
     * @param lastUsageRun when usage was last computed, needed for {@code auto}
     * @return midnight of the resolved day
     */
    public static LocalDateTime resolveWindowStart(String from, LocalDateTime now, Optional<LocalDateTime> lastUsageRun) {
        if (from == null || from.isBlank() || AUTO.equalsIgnoreCase(from)) {
            LocalDateTime last = lastUsageRun.orElseThrow(() ->
                    new IllegalStateException("Usage has never been computed: give an explicit start date"));
            // Re-process the day before the last run, which may have been incomplete
            return last.minusDays(1).toLocalDate().atStartOfDay();
        }
        if (TODAY.equalsIgnoreCase(from)) {
            return now.toLocalDate().atStartOfDay();
        }
        if (YESTERDAY.equalsIgnoreCase(from)) {
            return now.toLocalDate().minusDays(1).atStartOfDay();
        }
        return parseDate(from).atStartOfDay();
    }

    /**
     * Resolve the exclusive end of a tracking run: the given day, or tomorrow midnight.
     */
    public static LocalDateTime resolveWindowEnd(String to, LocalDateTime now) {
        if (to == null || to.isBlank()) {
            return now.toLocalDate().plusDays(1).atStartOfDay();
        }
        return parseDate(to).atStartOfDay();
    }

    /**
     * @param month {@code current}, {@code previous} or {@code YYYY-MM}
     */
    public static YearMonth resolveMonth(String month, LocalDate today) {
        if (month == null || month.isBlank() || CURRENT.equalsIgnoreCase(month)) {
            return YearMonth.from(today);
        }
        if (PREVIOUS.equalsIgnoreCase(month)) {
            return YearMonth.from(today).minusMonths(1);
        }
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid month: " + month + " (expected YYYY-MM)", e);
        }
    }

    /**
     * Calendar days touched by {@code [from, to)}.
     */
    public static List<LocalDate> daysBetween(LocalDateTime from, LocalDateTime to) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = from.toLocalDate(); day.atStartOfDay().isBefore(to); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }

    /**
     * Number of minute marks {@code start, start + 1 min, ...} before {@code finish}
     * that fall inside {@code [from, to)}.
     */
    public static long minuteMarksWithin(LocalDateTime start, LocalDateTime finish,
                                         LocalDateTime from, LocalDateTime to) {
        long marks = ceilMinutes(Duration.between(start, finish).getSeconds());
        long first = ceilMinutes(Duration.between(start, from).getSeconds());
        long last = Math.min(marks, ceilMinutes(Duration.between(start, to).getSeconds()));
        return Math.max(0, last - Math.max(0, first));
    }

    private static long ceilMinutes(long seconds) {
        return Math.floorDiv(seconds + 59, 60);
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: " + value + " (expected YYYY-MM-DD)", e);
        }
    }
}
