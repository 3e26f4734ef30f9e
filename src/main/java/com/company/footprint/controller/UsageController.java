package com.company.footprint.controller;

import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.dto.response.Co2eSeriesResponse;
import com.company.footprint.dto.response.TrackingRunResponse;
import com.company.footprint.service.UsageTrackingService;
import com.company.footprint.service.UsageViewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/usage")
@Tag(name = "Usage", description = "Usage tracking runs and usage queries")
@RequiredArgsConstructor
@Slf4j
public class UsageController {

    private final UsageTrackingService trackingService;
    private final UsageViewService viewService;

    @PostMapping("/track")
    @Operation(summary = "Compute usage for a window",
            description = "Rows of every 15-minute interval in the window are recomputed and replaced")
    public ResponseEntity<TrackingRunResponse> track(
            @Parameter(description = "auto, today, yesterday or YYYY-MM-DD")
            @RequestParam(defaultValue = "auto") String from,
            @Parameter(description = "Exclusive end day YYYY-MM-DD (default: tomorrow)")
            @RequestParam(required = false) String to) {

        log.info("Tracking request from {} to {}", from, to);
        return ResponseEntity.ok(trackingService.track(from, to));
    }

    @GetMapping("/intervals")
    @Operation(summary = "Stored 15-minute usage rows")
    public ResponseEntity<List<UsageReportRow>> getIntervals(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("'to' must be after 'from'");
        }
        return ResponseEntity.ok(viewService.getIntervalRows(from, to));
    }

    @GetMapping("/co2e")
    @Operation(summary = "CO2e time series", description = "Grouped by day, week or month; optionally split by team")
    public ResponseEntity<Co2eSeriesResponse> getCo2e(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "day") String interval,
            @RequestParam(defaultValue = "false") boolean byTeam,
            @RequestParam(required = false) List<String> users,
            @RequestParam(defaultValue = "0") int numSeries,
            @RequestParam(defaultValue = "kg") String unit) {

        return ResponseEntity.ok(viewService.getCo2eSeries(from, to,
                UsageViewService.Period.fromString(interval), byTeam, users, numSeries,
                UsageViewService.Co2eUnit.fromString(unit)));
    }
}
