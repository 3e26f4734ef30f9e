package com.company.footprint.identity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Display metadata for a login, as found in the staff directory.
 */
@Value
@Builder
public class IdentityRecord {
    String name;
    String position;
    @Builder.Default
    List<String> teams = List.of();
    String photoUrl;
}
