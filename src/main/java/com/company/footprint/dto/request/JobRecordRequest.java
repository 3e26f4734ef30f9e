package com.company.footprint.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecordRequest {
    @NotBlank(message = "Scheduler is required (e.g. lsf)")
    private String scheduler;

    @NotNull(message = "Job ID is required")
    private Long jobId;

    @Builder.Default
    private int jobIndex = 0;

    @NotBlank(message = "Job name is required")
    private String name;

    @NotBlank(message = "Status is required")
    private String status;

    @NotBlank(message = "User is required")
    private String user;

    @NotBlank(message = "Queue is required")
    private String queue;

    @Min(value = 1, message = "Slots must be at least 1")
    private int slots;

    @NotBlank(message = "Submission host is required")
    private String fromHost;

    // Missing submit times are rejected per record at ingestion
    private LocalDateTime submitTime;

    // Optional fields
    private Double cpuEfficiency;
    private Double cpuTime;
    private Long memLimit;
    private Long memMax;
    private Double memEfficiency;
    private String execHost;
    private LocalDateTime startTime;
    private LocalDateTime finishTime;
    private LocalDateTime updateTime;
}
