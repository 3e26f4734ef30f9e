package com.company.footprint.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingRunResponse {
    private LocalDateTime from;
    private LocalDateTime to;
    private LocalDateTime jobsUpdateTime;
    private int days;
    private long jobsProcessed;
    private long jobsSkipped;
    private long rowsWritten;
    private int users;
}
