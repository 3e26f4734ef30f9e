package com.company.footprint.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster account seen by the poller, with its primary and supplementary Unix groups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnixUser {
    private String login;
    private String group;
    private String groups;  // comma-separated, sorted
}
