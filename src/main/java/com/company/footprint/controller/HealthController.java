package com.company.footprint.controller;

import com.company.footprint.repository.JobRepository;
import com.company.footprint.repository.UsageRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final JobRepository jobRepository;
    private final UsageRepository usageRepository;

    @GetMapping
    @Operation(summary = "Health check with store freshness")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "footprint-service");
        response.put("lastJobUpdate", jobRepository.findLatestUpdateTime().orElse(null));
        response.put("lastUsageRun", usageRepository.findMetadataTime(UsageRepository.META_USAGE_RUN).orElse(null));

        return ResponseEntity.ok(response);
    }
}
