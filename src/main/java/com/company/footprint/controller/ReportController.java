package com.company.footprint.controller;

import com.company.footprint.domain.MonthlyReport;
import com.company.footprint.service.MonthlyReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Monthly per-user and per-team footprint reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final MonthlyReportService reportService;

    @PostMapping("/{month}")
    @Operation(summary = "Create the report of a month", description = "Replaces any stored report of that month")
    public ResponseEntity<MonthlyReport> createReport(
            @Parameter(description = "current, previous or YYYY-MM") @PathVariable String month) {

        log.info("Report request for {}", month);
        return ResponseEntity.ok(reportService.createReport(month));
    }

    @GetMapping("/{month}")
    @Operation(summary = "Get the stored report of a month")
    public ResponseEntity<MonthlyReport> getReport(
            @Parameter(description = "current, previous or YYYY-MM") @PathVariable String month) {

        return ResponseEntity.ok(reportService.getReport(month));
    }
}
