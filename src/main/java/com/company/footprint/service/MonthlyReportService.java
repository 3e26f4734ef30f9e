package com.company.footprint.service;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.*;
import com.company.footprint.exception.ReportNotFoundException;
import com.company.footprint.footprint.FootprintCalculator;
import com.company.footprint.footprint.JobEnergyProfile;
import com.company.footprint.repository.JobRepository;
import com.company.footprint.repository.UsageRepository;
import com.company.footprint.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.*;
import java.util.stream.Stream;

/**
 * Per-user and per-team totals for a calendar month, ranked by emissions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonthlyReportService {

    static final long PROGRESS_EVERY = 1_000_000;

    private final JobRepository jobRepository;
    private final UsageRepository usageRepository;
    private final FootprintCalculator calculator;
    private final FootprintProperties properties;

    /**
     * Compute and store the report of {@code month}, replacing any previous one.
     *
     * @param month {@code current}, {@code previous} or {@code YYYY-MM}
     */
    @Transactional
    public MonthlyReport createReport(String month) {
        return createReport(TimeUtils.resolveMonth(month, LocalDate.now()));
    }

    @Transactional
    public MonthlyReport createReport(YearMonth month) {
        log.info("Creating report for {}", month);

        LocalDateTime from = month.atDay(1).atStartOfDay();
        LocalDateTime to = month.plusMonths(1).atDay(1).atStartOfDay();
        LocalDateTime lastJobsUpdate = jobRepository.findLatestUpdateTime().orElse(to);
        LocalDateTime openJobFinish = lastJobsUpdate.isBefore(to) ? lastJobsUpdate : to;

        Map<String, UserMonthlyReport> users = new LinkedHashMap<>();
        long jobCount = 0;

        try (Stream<JobRecord> jobs = jobRepository.findJobs(from, to, null)) {
            Iterator<JobRecord> it = jobs.iterator();
            while (it.hasNext()) {
                JobRecord job = it.next();
                accumulate(users.computeIfAbsent(job.getUser(), UserMonthlyReport::new),
                        calculator.profile(job, openJobFinish), from, to);

                if (++jobCount % PROGRESS_EVERY == 0) {
                    log.debug("{}: {} jobs processed", month, jobCount);
                }
            }
        }

        rank(users.values());

        List<TeamMonthlyReport> teams = properties.getFeatures().isTeamReports()
                ? rollUpTeams(users.values(), usageRepository.findUsers())
                : new ArrayList<>();

        MonthlyReport report = MonthlyReport.builder()
                .month(month)
                .jobCount(jobCount)
                .users(users)
                .teams(teams)
                .build();

        usageRepository.saveReport(report);
        log.info("Done: {} jobs, {} users, {} teams", jobCount, users.size(), teams.size());

        return report;
    }

    public MonthlyReport getReport(String month) {
        YearMonth resolved = TimeUtils.resolveMonth(month, LocalDate.now());
        return usageRepository.findReport(resolved)
                .orElseThrow(() -> new ReportNotFoundException(resolved));
    }

    /**
     * Add one job: counts and cpu time in full, footprint only for the minutes spent in the month.
     */
    void accumulate(UserMonthlyReport user, JobEnergyProfile profile, LocalDateTime from, LocalDateTime to) {
        JobRecord job = profile.getJob();
        UserMonthlyReport.JobCounts counts = user.getJobs();
        counts.setTotal(counts.getTotal() + 1);

        if (profile.isTerminal()) {
            if (job.isOk()) {
                counts.setDone(counts.getDone() + 1);

                ReconciledMemory memory = profile.getMemory();
                if (memory.isEfficiencyKnown()
                        && memory.getLimitMb() >= properties.getAggregation().getMinMemoryRequestMb()) {
                    user.getMemory()[ClusterIntervalStats.percentBucket(memory.getEfficiency())]++;
                }
            } else {
                counts.setExit(counts.getExit() + 1);
            }
        }

        long minutes = TimeUtils.minuteMarksWithin(job.getStartTime(), profile.getEffectiveFinish(), from, to);
        double runtimeMinutes = profile.getRuntimeMinutes();

        user.setCo2e(user.getCo2e() + profile.getFootprint().getCo2e() / runtimeMinutes * minutes);
        user.setCost(user.getCost() + profile.getFootprint().getCost() / runtimeMinutes * minutes);
        user.setCputime(user.getCputime() + profile.getCpuTime());
    }

    /**
     * Rank by emissions, largest first. Ties keep the order in which users were first seen.
     */
    static void rank(Collection<UserMonthlyReport> users) {
        double total = users.stream().mapToDouble(UserMonthlyReport::getCo2e).sum();

        List<UserMonthlyReport> sorted = new ArrayList<>(users);
        sorted.sort(Comparator.comparingDouble(UserMonthlyReport::getCo2e).reversed());

        for (int i = 0; i < sorted.size(); i++) {
            UserMonthlyReport user = sorted.get(i);
            user.setRank(i + 1);
            user.setTotalCo2e(total);
            user.setShare(total > 0 ? user.getCo2e() / total : 0);
        }
    }

    /**
     * Split each user's totals evenly across their teams. Users without a team are left out.
     */
    static List<TeamMonthlyReport> rollUpTeams(Collection<UserMonthlyReport> users, Map<String, UserProfile> profiles) {
        Map<String, TeamMonthlyReport> teams = new TreeMap<>();

        for (UserMonthlyReport user : users) {
            UserProfile profile = profiles.get(user.getLogin());
            if (profile == null || !profile.hasTeams()) {
                continue;
            }

            int n = profile.getTeams().size();
            for (String name : profile.getTeams()) {
                TeamMonthlyReport team = teams.computeIfAbsent(name, TeamMonthlyReport::new);
                team.setJobs(team.getJobs() + (double) user.getJobs().getTotal() / n);
                team.setCputime(team.getCputime() + user.getCputime() / n);
                team.setCo2e(team.getCo2e() + user.getCo2e() / n);
                team.setCost(team.getCost() + user.getCost() / n);
            }
        }

        return new ArrayList<>(teams.values());
    }
}
