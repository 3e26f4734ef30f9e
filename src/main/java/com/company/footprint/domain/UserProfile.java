package com.company.footprint.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * User as stored in the usage database, enriched with directory metadata when available.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    private String login;
    private String group;
    private String groups;
    private String name;
    private String position;
    @Builder.Default
    private List<String> teams = new ArrayList<>();
    private String photoUrl;
    private String uuid;
    private String sponsor;

    public static UserProfile of(String login) {
        return UserProfile.builder()
                .login(login)
                .uuid(newUuid())
                .build();
    }

    public static String newUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public boolean hasTeams() {
        return teams != null && !teams.isEmpty();
    }
}
