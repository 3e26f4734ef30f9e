package com.company.footprint.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One poll of the scheduler: every job it reported, plus the accounts seen.
 * Jobs with a finish time replace their stored copy; the others replace the whole open set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSnapshotRequest {

    // Defaults to the time the snapshot is received
    private LocalDateTime polledAt;

    @NotNull(message = "Jobs are required")
    @Valid
    @Builder.Default
    private List<JobRecordRequest> jobs = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<UnixUserRequest> users = new ArrayList<>();
}
