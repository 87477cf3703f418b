package com.example.residency_scheduler.service;

import com.example.residency_scheduler.enums.JobState;
import com.example.residency_scheduler.solver.ResolveResult;

import lombok.Value;

import java.time.Instant;

/** Polled view of a background resolve. {@code result} is set once the job is DONE or CANCELLED. */
@Value
public class ResolveJobStatus {
    String ticket;
    String programId;
    JobState state;
    Instant submittedAt;
    Instant finishedAt;
    ResolveResult result;
    String failure;
}
