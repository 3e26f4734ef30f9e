package com.company.footprint.service;

import com.company.footprint.domain.JobRecord;
import com.company.footprint.domain.UnixUser;
import com.company.footprint.domain.enums.SchedulerType;
import com.company.footprint.dto.request.JobRecordRequest;
import com.company.footprint.dto.request.JobSnapshotRequest;
import com.company.footprint.dto.request.UnixUserRequest;
import com.company.footprint.dto.response.IngestionResponse;
import com.company.footprint.exception.JobRecordRejectedException;
import com.company.footprint.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Stores the scheduler poller's snapshots in the job store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobIngestionService {

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Upsert the snapshot's terminal jobs by accession and replace the open set with its other jobs.
     * Records without a submit time are rejected individually; an unknown scheduler or terminal
     * status rejects the whole snapshot.
     */
    @Transactional
    public IngestionResponse ingest(JobSnapshotRequest snapshot) {
        LocalDateTime polledAt = snapshot.getPolledAt() != null ? snapshot.getPolledAt() : LocalDateTime.now();

        List<JobRecord> closed = new ArrayList<>();
        List<JobRecord> open = new ArrayList<>();
        int rejected = 0;

        for (JobRecordRequest request : snapshot.getJobs()) {
            JobRecord job;
            try {
                job = toJobRecord(request, polledAt);
            } catch (JobRecordRejectedException e) {
                log.warn(e.getMessage());
                meterRegistry.counter("jobs.ingested.rejected").increment();
                rejected++;
                continue;
            }

            if (job.getLifecycleState().isOpen()) {
                open.add(job);
            } else {
                closed.add(job);
            }
        }

        Map<String, UnixUser> users = collectUsers(snapshot, closed, open);

        jobRepository.upsertClosedJobs(closed);
        jobRepository.replaceOpenJobs(open);
        jobRepository.upsertUsers(users.values());

        meterRegistry.counter("jobs.ingested.closed").increment(closed.size());
        meterRegistry.counter("jobs.ingested.open").increment(open.size());

        log.info("Snapshot of {}: {} closed, {} open, {} rejected jobs; {} users",
                polledAt, closed.size(), open.size(), rejected, users.size());

        return IngestionResponse.builder()
                .polledAt(polledAt)
                .closedJobs(closed.size())
                .openJobs(open.size())
                .rejectedJobs(rejected)
                .users(users.size())
                .build();
    }

    JobRecord toJobRecord(JobRecordRequest request, LocalDateTime polledAt) {
        SchedulerType scheduler = SchedulerType.fromTag(request.getScheduler());

        if (request.getSubmitTime() == null) {
            throw new JobRecordRejectedException(request.getScheduler(), request.getJobId(),
                    request.getJobIndex(), "no submit time");
        }

        if (request.getFinishTime() != null) {
            // Fails loudly on a terminal status the scheduler table does not know
            scheduler.isSuccessful(request.getStatus());
        }

        return JobRecord.builder()
                .scheduler(scheduler.getTag())
                .jobId(request.getJobId())
                .jobIndex(request.getJobIndex())
                .name(request.getName())
                .status(request.getStatus())
                .user(request.getUser())
                .queue(request.getQueue())
                .slots(request.getSlots())
                .cpuEfficiency(request.getCpuEfficiency())
                .cpuTime(request.getCpuTime())
                .memLimit(request.getMemLimit())
                .memMax(request.getMemMax())
                .memEfficiency(request.getMemEfficiency())
                .fromHost(request.getFromHost())
                .execHost(request.getExecHost())
                .submitTime(request.getSubmitTime())
                .startTime(request.getStartTime())
                .finishTime(request.getFinishTime())
                .updateTime(request.getUpdateTime() != null ? request.getUpdateTime() : polledAt)
                .build();
    }

    /**
     * Accounts listed in the snapshot, plus any job owner it did not list.
     */
    private Map<String, UnixUser> collectUsers(JobSnapshotRequest snapshot, List<JobRecord> closed, List<JobRecord> open) {
        Map<String, UnixUser> users = new TreeMap<>();

        for (UnixUserRequest request : snapshot.getUsers()) {
            String groups = request.getGroups() == null ? null : request.getGroups().stream()
                    .sorted()
                    .distinct()
                    .collect(Collectors.joining(","));

            users.put(request.getLogin(), UnixUser.builder()
                    .login(request.getLogin())
                    .group(request.getGroup())
                    .groups(groups)
                    .build());
        }

        Set<String> known = jobRepository.findUsers().keySet();
        for (List<JobRecord> jobs : List.of(closed, open)) {
            for (JobRecord job : jobs) {
                if (!users.containsKey(job.getUser()) && !known.contains(job.getUser())) {
                    users.put(job.getUser(), UnixUser.builder().login(job.getUser()).build());
                }
            }
        }

        return users;
    }
}
