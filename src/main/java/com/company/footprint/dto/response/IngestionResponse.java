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
public class IngestionResponse {
    private LocalDateTime polledAt;
    private int closedJobs;
    private int openJobs;
    private int rejectedJobs;
    private int users;
}
