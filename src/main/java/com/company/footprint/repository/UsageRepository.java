package com.company.footprint.repository;

import com.company.footprint.domain.*;
import com.company.footprint.exception.UsageStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.*;

/**
 * Usage store: 15-minute usage rows, run metadata, users and monthly reports.
 * Usage and report payloads are stored as JSON documents.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class UsageRepository {

    public static final String META_JOBS_UPDATE = "jobs";
    public static final String META_USAGE_RUN = "usage";

    private static final TypeReference<LinkedHashMap<String, UserUsage>> USERS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> TEAMS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<TeamMonthlyReport>> TEAM_REPORTS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Write usage rows, replacing any row stored under the same interval key.
     * All rows are written in one transaction.
     */
    @Transactional
    public void upsertIntervalRows(List<UsageReportRow> rows) {
        String updateSql = "UPDATE usage_intervals SET users_data = ?, jobs_data = ? WHERE time_key = ?";
        String insertSql = "INSERT INTO usage_intervals (time_key, users_data, jobs_data) VALUES (?, ?, ?)";

        try {
            for (UsageReportRow row : rows) {
                String users = toJson(row.getUsers());
                String jobs = toJson(row.getJobs());

                int updated = jdbcTemplate.update(updateSql, users, jobs, row.getTimeKey());
                if (updated == 0) {
                    jdbcTemplate.update(insertSql, row.getTimeKey(), users, jobs);
                }
            }
        } catch (UsageStoreException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to write {} usage rows", rows.size(), e);
            throw new UsageStoreException("Failed to write usage rows", e);
        }
    }

    /**
     * Stored rows with interval start in {@code [from, to)}, oldest first.
     */
    public List<UsageReportRow> findIntervalRows(LocalDateTime from, LocalDateTime to) {
        String sql = """
            SELECT time_key, users_data, jobs_data
            FROM usage_intervals
            WHERE time_key >= ? AND time_key < ?
            ORDER BY time_key
            """;

        try {
            return jdbcTemplate.query(sql, new UsageReportRowMapper(),
                    from.format(UsageReportRow.TIME_KEY_FORMAT),
                    to.format(UsageReportRow.TIME_KEY_FORMAT));
        } catch (Exception e) {
            log.error("Failed to fetch usage rows between {} and {}", from, to, e);
            throw new UsageStoreException("Failed to fetch usage rows", e);
        }
    }

    public Optional<LocalDateTime> findEarliestIntervalStart() {
        return findIntervalBound("SELECT MIN(time_key) FROM usage_intervals");
    }

    public Optional<LocalDateTime> findLatestIntervalStart() {
        return findIntervalBound("SELECT MAX(time_key) FROM usage_intervals");
    }

    private Optional<LocalDateTime> findIntervalBound(String sql) {
        String timeKey = jdbcTemplate.queryForObject(sql, String.class);
        return Optional.ofNullable(timeKey).map(UsageReportRow::parseTimeKey);
    }

    /**
     * Record the job update time the run was computed against, and when the run happened.
     */
    @Transactional
    public void bumpMetadata(LocalDateTime jobsUpdateTime, LocalDateTime usageRunTime) {
        putMetadata(META_JOBS_UPDATE, jobsUpdateTime);
        putMetadata(META_USAGE_RUN, usageRunTime);
    }

    public Optional<LocalDateTime> findMetadataTime(String key) {
        List<String> values = jdbcTemplate.queryForList(
                "SELECT meta_value FROM usage_metadata WHERE meta_key = ?", String.class, key);

        return values.isEmpty() ? Optional.empty() : Optional.of(LocalDateTime.parse(values.get(0)));
    }

    private void putMetadata(String key, LocalDateTime value) {
        int updated = jdbcTemplate.update(
                "UPDATE usage_metadata SET meta_value = ? WHERE meta_key = ?", value.toString(), key);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO usage_metadata (meta_key, meta_value) VALUES (?, ?)", key, value.toString());
        }
    }

    public Map<String, UserProfile> findUsers() {
        String sql = """
            SELECT login, full_name, uuid, teams, position, photo_url, sponsor
            FROM usage_users
            ORDER BY login
            """;

        Map<String, UserProfile> users = new LinkedHashMap<>();
        for (UserProfile user : jdbcTemplate.query(sql, new UserProfileRowMapper())) {
            users.put(user.getLogin(), user);
        }
        return users;
    }

    @Transactional
    public void upsertUsers(Collection<UserProfile> users) {
        String updateSql = """
            UPDATE usage_users
            SET full_name = ?, uuid = ?, teams = ?, position = ?, photo_url = ?, sponsor = ?
            WHERE login = ?
            """;
        String insertSql = """
            INSERT INTO usage_users (full_name, uuid, teams, position, photo_url, sponsor, login)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            for (UserProfile user : users) {
                Object[] params = {
                        user.getName(),
                        user.getUuid(),
                        toJson(user.getTeams() != null ? user.getTeams() : List.of()),
                        user.getPosition(),
                        user.getPhotoUrl(),
                        user.getSponsor(),
                        user.getLogin()
                };

                if (jdbcTemplate.update(updateSql, params) == 0) {
                    jdbcTemplate.update(insertSql, params);
                }
            }

            log.debug("Upserted {} users", users.size());
        } catch (Exception e) {
            log.error("Failed to upsert {} users", users.size(), e);
            throw new UsageStoreException("Failed to save users", e);
        }
    }

    /**
     * Replace the stored report of a month. Team rows, if any, are stored under {@link MonthlyReport#TEAMS_LOGIN}.
     */
    @Transactional
    public void saveReport(MonthlyReport report) {
        String month = report.getMonth().toString();
        String insertSql = "INSERT INTO monthly_reports (login, report_month, data) VALUES (?, ?, ?)";

        try {
            jdbcTemplate.update("DELETE FROM monthly_reports WHERE report_month = ?", month);

            List<Object[]> batch = new ArrayList<>();
            for (UserMonthlyReport user : report.getUsers().values()) {
                batch.add(new Object[]{user.getLogin(), month, toJson(user)});
            }
            if (!report.getTeams().isEmpty()) {
                batch.add(new Object[]{MonthlyReport.TEAMS_LOGIN, month, toJson(report.getTeams())});
            }

            if (!batch.isEmpty()) {
                jdbcTemplate.batchUpdate(insertSql, batch);
            }

            log.debug("Stored report for {}: {} users, {} teams",
                    month, report.getUsers().size(), report.getTeams().size());
        } catch (Exception e) {
            log.error("Failed to store report for {}", month, e);
            throw new UsageStoreException("Failed to store monthly report", e);
        }
    }

    public Optional<MonthlyReport> findReport(YearMonth month) {
        String sql = "SELECT login, data FROM monthly_reports WHERE report_month = ?";

        List<UserMonthlyReport> users = new ArrayList<>();
        List<TeamMonthlyReport> teams = new ArrayList<>();

        jdbcTemplate.query(sql, rs -> {
            String login = rs.getString("login");
            String data = rs.getString("data");

            if (MonthlyReport.TEAMS_LOGIN.equals(login)) {
                teams.addAll(fromJson(data, TEAM_REPORTS_TYPE));
            } else {
                UserMonthlyReport user = fromJson(data, UserMonthlyReport.class);
                user.setLogin(login);
                users.add(user);
            }
        }, month.toString());

        if (users.isEmpty() && teams.isEmpty()) {
            return Optional.empty();
        }

        users.sort(Comparator.comparing(UserMonthlyReport::getRank, Comparator.nullsLast(Comparator.naturalOrder())));

        Map<String, UserMonthlyReport> byLogin = new LinkedHashMap<>();
        long jobCount = 0;
        for (UserMonthlyReport user : users) {
            byLogin.put(user.getLogin(), user);
            jobCount += user.getJobs().getTotal();
        }

        return Optional.of(MonthlyReport.builder()
                .month(month)
                .jobCount(jobCount)
                .users(byLogin)
                .teams(teams)
                .build());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UsageStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UsageStoreException("Failed to read stored " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UsageStoreException("Failed to read stored " + type.getType().getTypeName(), e);
        }
    }

    private class UsageReportRowMapper implements RowMapper<UsageReportRow> {
        @Override
        public UsageReportRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return UsageReportRow.builder()
                    .intervalStart(UsageReportRow.parseTimeKey(rs.getString("time_key")))
                    .users(fromJson(rs.getString("users_data"), USERS_TYPE))
                    .jobs(fromJson(rs.getString("jobs_data"), ClusterIntervalStats.class))
                    .build();
        }
    }

    private class UserProfileRowMapper implements RowMapper<UserProfile> {
        @Override
        public UserProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
            return UserProfile.builder()
                    .login(rs.getString("login"))
                    .name(rs.getString("full_name"))
                    .uuid(rs.getString("uuid"))
                    .teams(new ArrayList<>(fromJson(rs.getString("teams"), TEAMS_TYPE)))
                    .position(rs.getString("position"))
                    .photoUrl(rs.getString("photo_url"))
                    .sponsor(rs.getString("sponsor"))
                    .build();
        }
    }
}
