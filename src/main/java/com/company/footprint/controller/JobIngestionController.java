package com.company.footprint.controller;

import com.company.footprint.dto.request.JobSnapshotRequest;
import com.company.footprint.dto.response.IngestionResponse;
import com.company.footprint.service.JobIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Ingestion", description = "APIs for the scheduler poller to store job snapshots")
@RequiredArgsConstructor
@Slf4j
public class JobIngestionController {

    private final JobIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/snapshot")
    @Operation(summary = "Store a poll snapshot",
            description = "Terminal jobs are upserted, the open job set is replaced")
    public ResponseEntity<IngestionResponse> ingestSnapshot(@Valid @RequestBody JobSnapshotRequest request) {
        log.info("Snapshot request with {} jobs and {} users",
                request.getJobs().size(), request.getUsers().size());

        meterRegistry.counter("api.jobs.snapshot.requests").increment();

        return ResponseEntity.ok(ingestionService.ingest(request));
    }
}
