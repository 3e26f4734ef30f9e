package com.company.footprint.service;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.CustomUserMetadata;
import com.company.footprint.domain.UnixUser;
import com.company.footprint.domain.UserProfile;
import com.company.footprint.identity.IdentityDirectory;
import com.company.footprint.identity.IdentityRecord;
import com.company.footprint.repository.JobRepository;
import com.company.footprint.repository.UsageRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds the user list of a tracking run: stored users, every account seen by the poller,
 * directory metadata and hand-maintained overrides.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserDirectoryService {

    private static final TypeReference<LinkedHashMap<String, CustomUserMetadata>> CUSTOM_USERS_TYPE =
            new TypeReference<>() {};

    private final JobRepository jobRepository;
    private final UsageRepository usageRepository;
    private final ObjectProvider<IdentityDirectory> identityDirectory;
    private final ObjectMapper objectMapper;
    private final FootprintProperties properties;

    public Map<String, UserProfile> loadUsers() {
        Map<String, UnixUser> unixUsers = jobRepository.findUsers();
        Map<String, UserProfile> users = usageRepository.findUsers();
        IdentityDirectory directory = identityDirectory.getIfAvailable();

        for (UserProfile user : users.values()) {
            UnixUser unixUser = unixUsers.get(user.getLogin());
            if (unixUser != null) {
                user.setGroup(unixUser.getGroup());
                user.setGroups(unixUser.getGroups());
            }

            if (properties.getUsers().isUpdateMetadata()) {
                refresh(user, directory);
            }
        }

        for (UnixUser unixUser : unixUsers.values()) {
            if (!users.containsKey(unixUser.getLogin())) {
                UserProfile user = UserProfile.of(unixUser.getLogin());
                user.setGroup(unixUser.getGroup());
                user.setGroups(unixUser.getGroups());
                refresh(user, directory);
                users.put(user.getLogin(), user);
                log.info("New user {}", user.getLogin());
            }
        }

        Map<String, CustomUserMetadata> customUsers = loadCustomUsers();
        customUsers.forEach((login, metadata) -> {
            UserProfile user = users.get(login);
            if (user == null) {
                user = UserProfile.of(login);
                refresh(user, directory);
                users.put(login, user);
            }
            applyOverrides(user, metadata);
        });

        for (UserProfile user : users.values()) {
            if (!user.hasTeams()) {
                log.warn("{}{}is not in any team (groups: {})", user.getLogin(),
                        customUsers.containsKey(user.getLogin()) ? " (custom) " : " ",
                        user.getGroups() != null ? user.getGroups() : "N/A");
            }
        }

        log.info("Loaded {} users ({} Unix accounts, {} custom)", users.size(), unixUsers.size(), customUsers.size());
        return users;
    }

    public void saveUsers(Collection<UserProfile> users) {
        usageRepository.upsertUsers(users);
    }

    /**
     * Update a user from the directory. Only an exact match with a name changes anything,
     * and empty directory values never erase stored ones.
     */
    void refresh(UserProfile user, IdentityDirectory directory) {
        if (directory == null) {
            return;
        }

        Optional<IdentityRecord> found = directory.lookup(user.getLogin());
        if (found.isEmpty() || found.get().getName() == null) {
            return;
        }

        IdentityRecord identity = found.get();
        user.setName(identity.getName());
        if (identity.getPosition() != null) {
            user.setPosition(identity.getPosition());
        }
        if (!identity.getTeams().isEmpty()) {
            user.setTeams(new ArrayList<>(identity.getTeams()));
        }
        if (identity.getPhotoUrl() != null) {
            user.setPhotoUrl(identity.getPhotoUrl());
        }
    }

    void applyOverrides(UserProfile user, CustomUserMetadata metadata) {
        String login = user.getLogin();

        if (hasText(metadata.getName())) {
            warnIfDifferent(login, "name", user.getName(), metadata.getName());
            user.setName(metadata.getName());
        }

        if (hasText(metadata.getPosition())) {
            warnIfDifferent(login, "position", user.getPosition(), metadata.getPosition());
            user.setPosition(metadata.getPosition());
        }

        if (metadata.getTeams() != null && !metadata.getTeams().isEmpty()) {
            if (user.hasTeams() && !user.getTeams().equals(metadata.getTeams())) {
                log.warn("{}: {} differs from {} (teams)", login,
                        String.join(", ", metadata.getTeams()), String.join(", ", user.getTeams()));
            }
            user.setTeams(new ArrayList<>(metadata.getTeams()));
        }

        if (hasText(metadata.getSponsor())) {
            warnIfDifferent(login, "sponsor", user.getSponsor(), metadata.getSponsor());
            user.setSponsor(metadata.getSponsor());
        }

        if (hasText(metadata.getPhotoUrl())) {
            user.setPhotoUrl(metadata.getPhotoUrl());
        }
    }

    private Map<String, CustomUserMetadata> loadCustomUsers() {
        String file = properties.getUsers().getCustomFile();
        if (!hasText(file)) {
            return Collections.emptyMap();
        }

        try {
            return objectMapper.readValue(Files.readString(Path.of(file)), CUSTOM_USERS_TYPE);
        } catch (IOException e) {
            log.error("Failed to read custom users from {}", file, e);
            throw new IllegalStateException("Failed to read custom users file " + file, e);
        }
    }

    private static void warnIfDifferent(String login, String field, String current, String override) {
        if (current != null && !current.equals(override)) {
            log.warn("{}: {} differs from {} ({})", login, override, current, field);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
