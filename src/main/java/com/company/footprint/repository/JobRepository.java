package com.company.footprint.repository;

import com.company.footprint.domain.JobRecord;
import com.company.footprint.domain.UnixUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Stream;

/**
 * Job store: terminal jobs in {@code jobs}, pending and running jobs in {@code open_jobs}.
 * A job is in exactly one of the two tables.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JobRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String COLUMNS = """
        accession, scheduler, job_id, job_index, job_name, status, user_login, queue,
        slots, cpu_efficiency, cpu_time, mem_limit, mem_max, mem_efficiency,
        from_host, exec_host, submit_time, start_time, finish_time, update_time
        """;

    private static final String INSERT_VALUES = "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final RowMapper<JobRecord> ROW_MAPPER = new JobRecordRowMapper();

    /**
     * Every job whose run overlaps {@code [from, to)}, streamed lazily: closed jobs that start inside,
     * finish inside or span the window, then open jobs that started before its end.
     * Jobs that never started are left out. The caller must close the stream.
     */
    public Stream<JobRecord> findJobs(LocalDateTime from, LocalDateTime to, String user) {
        List<Object> closedParams = new ArrayList<>(List.of(from, to, from, to, from, to));
        List<Object> openParams = new ArrayList<>(List.of(to));

        String userFilter = "";
        if (user != null) {
            userFilter = "AND user_login = ?";
            closedParams.add(user);
            openParams.add(user);
        }

        String closedSql = "SELECT " + COLUMNS + """
            FROM jobs
            WHERE start_time IS NOT NULL
              AND (
                (start_time >= ? AND start_time < ?)
                OR
                (finish_time >= ? AND finish_time < ?)
                OR
                (start_time < ? AND finish_time >= ?)
              )
            """ + userFilter;

        String openSql = "SELECT " + COLUMNS + """
            FROM open_jobs
            WHERE start_time IS NOT NULL
              AND start_time < ?
            """ + userFilter;

        Stream<JobRecord> closed = jdbcTemplate.queryForStream(closedSql, ROW_MAPPER, closedParams.toArray());
        Stream<JobRecord> open;
        try {
            open = jdbcTemplate.queryForStream(openSql, ROW_MAPPER, openParams.toArray());
        } catch (RuntimeException e) {
            closed.close();
            throw e;
        }

        // Pulls one row at a time from each cursor; closing the result closes both
        return Stream.concat(closed, open);
    }

    /**
     * Time of the last successful poll, taken from the most recently refreshed job.
     */
    public Optional<LocalDateTime> findLatestUpdateTime() {
        LocalDateTime latest = jdbcTemplate.queryForObject(
                "SELECT MAX(update_time) FROM jobs", LocalDateTime.class);

        if (latest == null) {
            latest = jdbcTemplate.queryForObject(
                    "SELECT MAX(update_time) FROM open_jobs", LocalDateTime.class);
        }

        return Optional.ofNullable(latest);
    }

    /**
     * Insert or replace terminal jobs by accession.
     */
    public void upsertClosedJobs(List<JobRecord> jobs) {
        if (jobs.isEmpty()) {
            return;
        }

        try {
            jdbcTemplate.batchUpdate("DELETE FROM jobs WHERE accession = ?",
                    jobs.stream().map(j -> new Object[]{j.getAccession()}).toList());
            jdbcTemplate.batchUpdate("INSERT INTO jobs (" + COLUMNS + ") " + INSERT_VALUES,
                    jobs.stream().map(JobRepository::toParams).toList());

            log.debug("Upserted {} closed jobs", jobs.size());
        } catch (Exception e) {
            log.error("Failed to upsert {} closed jobs", jobs.size(), e);
            throw new RuntimeException("Failed to save closed jobs", e);
        }
    }

    /**
     * Replace the whole open set with the latest snapshot.
     */
    public void replaceOpenJobs(List<JobRecord> jobs) {
        try {
            int removed = jdbcTemplate.update("DELETE FROM open_jobs");
            if (!jobs.isEmpty()) {
                jdbcTemplate.batchUpdate("INSERT INTO open_jobs (" + COLUMNS + ") " + INSERT_VALUES,
                        jobs.stream().map(JobRepository::toParams).toList());
            }

            log.debug("Replaced {} open jobs with {}", removed, jobs.size());
        } catch (Exception e) {
            log.error("Failed to replace open jobs", e);
            throw new RuntimeException("Failed to save open jobs", e);
        }
    }

    public Map<String, UnixUser> findUsers() {
        Map<String, UnixUser> users = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT login, unix_group, unix_groups FROM job_users ORDER BY login", rs -> {
            UnixUser user = UnixUser.builder()
                    .login(rs.getString("login"))
                    .group(rs.getString("unix_group"))
                    .groups(rs.getString("unix_groups"))
                    .build();
            users.put(user.getLogin(), user);
        });
        return users;
    }

    public void upsertUsers(Collection<UnixUser> users) {
        if (users.isEmpty()) {
            return;
        }

        jdbcTemplate.batchUpdate("DELETE FROM job_users WHERE login = ?",
                users.stream().map(u -> new Object[]{u.getLogin()}).toList());
        jdbcTemplate.batchUpdate("INSERT INTO job_users (login, unix_group, unix_groups) VALUES (?, ?, ?)",
                users.stream().map(u -> new Object[]{u.getLogin(), u.getGroup(), u.getGroups()}).toList());
    }

    private static Object[] toParams(JobRecord job) {
        return new Object[]{
                job.getAccession(),
                job.getScheduler(),
                job.getJobId(),
                job.getJobIndex(),
                job.getName(),
                job.getStatus(),
                job.getUser(),
                job.getQueue(),
                job.getSlots(),
                job.getCpuEfficiency(),
                job.getCpuTime(),
                job.getMemLimit(),
                job.getMemMax(),
                job.getMemEfficiency(),
                job.getFromHost(),
                job.getExecHost(),
                job.getSubmitTime(),
                job.getStartTime(),
                job.getFinishTime(),
                job.getUpdateTime()
        };
    }

    private static class JobRecordRowMapper implements RowMapper<JobRecord> {
        @Override
        public JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return JobRecord.builder()
                    .scheduler(rs.getString("scheduler"))
                    .jobId(rs.getLong("job_id"))
                    .jobIndex(rs.getInt("job_index"))
                    .name(rs.getString("job_name"))
                    .status(rs.getString("status"))
                    .user(rs.getString("user_login"))
                    .queue(rs.getString("queue"))
                    .slots(rs.getInt("slots"))
                    .cpuEfficiency(rs.getObject("cpu_efficiency", Double.class))
                    .cpuTime(rs.getObject("cpu_time", Double.class))
                    .memLimit(rs.getObject("mem_limit", Long.class))
                    .memMax(rs.getObject("mem_max", Long.class))
                    .memEfficiency(rs.getObject("mem_efficiency", Double.class))
                    .fromHost(rs.getString("from_host"))
                    .execHost(rs.getString("exec_host"))
                    .submitTime(rs.getObject("submit_time", LocalDateTime.class))
                    .startTime(rs.getObject("start_time", LocalDateTime.class))
                    .finishTime(rs.getObject("finish_time", LocalDateTime.class))
                    .updateTime(rs.getObject("update_time", LocalDateTime.class))
                    .build();
        }
    }
}
