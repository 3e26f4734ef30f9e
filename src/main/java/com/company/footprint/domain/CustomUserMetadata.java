package com.company.footprint.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-maintained metadata for one login, read from the custom users file.
 * Non-empty values override the directory.
 */
@Data
@NoArgsConstructor
public class CustomUserMetadata {
    private String name;
    private String position;
    private List<String> teams = new ArrayList<>();
    private String sponsor;
    @JsonProperty("photo_url")
    private String photoUrl;
}
