package com.example.residency_scheduler.service;

import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.enums.JobState;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs resolves in the background. Callers get a ticket back and poll it; cancelling stops the
 * search and the job finishes with whatever was found, which is never committed.
 * <p>
 * Finished jobs are kept for the retention period and at most the configured number of them;
 * both limits are applied on each submit. Running jobs are never evicted.
 */
@Slf4j
@Service
public class ResolveJobService {
    private final ProgramScheduleService programScheduleService;
    private final Executor scheduleExecutor;
    private final Clock clock;
    private final Duration retention;
    private final int finishedJobLimit;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong submissions = new AtomicLong();

    public ResolveJobService(ProgramScheduleService programScheduleService,
                             @Qualifier("scheduleExecutor") Executor scheduleExecutor, Clock clock,
                             SolverSettings settings) {
        this.programScheduleService = programScheduleService;
        this.scheduleExecutor = scheduleExecutor;
        this.clock = clock;
        this.retention = settings.getJobRetention();
        this.finishedJobLimit = settings.getFinishedJobLimit();
    }

    public String submit(ResolveRequest request) {
        evictFinished();
        String ticket = UUID.randomUUID().toString();
        Job job = new Job(ticket, request.getProgramId(), clock.instant(), submissions.incrementAndGet());
        jobs.put(ticket, job);
        log.info("Queued resolve {} for {}", ticket, request.getProgramId());
        scheduleExecutor.execute(() -> run(job, request));
        return ticket;
    }

    public Optional<ResolveJobStatus> status(String ticket) {
        Job job = jobs.get(ticket);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.of(new ResolveJobStatus(job.ticket, job.programId, job.state, job.submittedAt,
            job.finishedAt, job.result, job.failure));
    }

    /** @return false when the ticket is unknown or the job already finished */
    public boolean cancel(String ticket) {
        Job job = jobs.get(ticket);
        if (job == null || job.state != JobState.RUNNING) {
            return false;
        }
        log.info("Cancelling resolve {} for {}", ticket, job.programId);
        job.handle.cancel();
        return true;
    }

    int trackedJobs() {
        return jobs.size();
    }

    private synchronized void evictFinished() {
        Instant cutoff = clock.instant().minus(retention);
        List<Job> finished = new ArrayList<>();
        for (Job job : jobs.values()) {
            // finishedAt is written before the state leaves RUNNING
            if (job.state == JobState.RUNNING) {
                continue;
            }
            if (job.finishedAt.isBefore(cutoff)) {
                jobs.remove(job.ticket);
            } else {
                finished.add(job);
            }
        }
        finished.sort(Comparator.comparing((Job job) -> job.finishedAt).thenComparingLong(job -> job.sequence));
        for (int i = 0; i < finished.size() - finishedJobLimit; i++) {
            jobs.remove(finished.get(i).ticket);
        }
    }

    private void run(Job job, ResolveRequest request) {
        try {
            ResolveResult result = programScheduleService.resolve(request, job.handle);
            job.result = result;
            job.finishedAt = clock.instant();
            job.state = job.handle.isCancelled() ? JobState.CANCELLED : JobState.DONE;
        } catch (RuntimeException e) {
            log.error("Resolve {} for {} failed", job.ticket, job.programId, e);
            job.failure = e.getMessage();
            job.finishedAt = clock.instant();
            job.state = JobState.FAILED;
        }
    }

    private static final class Job {
        private final String ticket;
        private final String programId;
        private final Instant submittedAt;
        private final long sequence;
        private final SolveHandle handle = new SolveHandle();
        private volatile JobState state = JobState.RUNNING;
        private volatile ResolveResult result;
        private volatile String failure;
        private volatile Instant finishedAt;

        private Job(String ticket, String programId, Instant submittedAt, long sequence) {
            this.ticket = ticket;
            this.programId = programId;
            this.submittedAt = submittedAt;
            this.sequence = sequence;
        }
    }
}
