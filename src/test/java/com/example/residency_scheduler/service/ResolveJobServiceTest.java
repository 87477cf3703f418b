package com.example.residency_scheduler.service;

import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.enums.JobState;
import com.example.residency_scheduler.enums.ResolveStatus;
import com.example.residency_scheduler.exception.ResolveInProgressException;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResolveJobServiceTest {
    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    private final Deque<Runnable> queued = new ArrayDeque<>();
    private final MovableClock clock = new MovableClock();
    private ProgramScheduleService programScheduleService;
    private ResolveJobService jobs;

    @BeforeEach
    void setUp() {
        programScheduleService = mock(ProgramScheduleService.class);
        SolverSettings settings = SolverSettings.defaults().toBuilder()
            .jobRetention(Duration.ofHours(1))
            .finishedJobLimit(2)
            .build();
        jobs = new ResolveJobService(programScheduleService, queued::add, clock, settings);
    }

    @Test
    void jobRunsOnTheExecutorAndReportsItsResult() {
        ResolveRequest request = request();
        ResolveResult result = ResolveResult.builder().status(ResolveStatus.VALID).complete(true).warnings(List.of()).build();
        when(programScheduleService.resolve(eq(request), any(SolveHandle.class))).thenReturn(result);

        String ticket = jobs.submit(request);

        assertThat(jobs.status(ticket)).get().satisfies(status -> {
            assertThat(status.getState()).isEqualTo(JobState.RUNNING);
            assertThat(status.getProgramId()).isEqualTo("p-1");
            assertThat(status.getSubmittedAt()).isEqualTo(NOW);
            assertThat(status.getResult()).isNull();
        });

        queued.poll().run();

        assertThat(jobs.status(ticket)).get().satisfies(status -> {
            assertThat(status.getState()).isEqualTo(JobState.DONE);
            assertThat(status.getResult()).isSameAs(result);
            assertThat(status.getFinishedAt()).isEqualTo(NOW);
        });
        assertThat(jobs.cancel(ticket)).isFalse();
    }

    @Test
    void cancelledJobEndsCancelled() {
        when(programScheduleService.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenAnswer(invocation -> {
            SolveHandle handle = invocation.getArgument(1);
            assertThat(handle.isCancelled()).isTrue();
            return ResolveResult.builder().status(ResolveStatus.TIMEOUT).complete(false).warnings(List.of()).build();
        });

        String ticket = jobs.submit(request());
        assertThat(jobs.cancel(ticket)).isTrue();
        queued.poll().run();

        assertThat(jobs.status(ticket)).get()
            .extracting(ResolveJobStatus::getState)
            .isEqualTo(JobState.CANCELLED);
    }

    @Test
    void failureIsKeptOnTheTicket() {
        when(programScheduleService.resolve(any(ResolveRequest.class), any(SolveHandle.class)))
            .thenThrow(new ResolveInProgressException("p-1"));

        String ticket = jobs.submit(request());
        queued.poll().run();

        assertThat(jobs.status(ticket)).get().satisfies(status -> {
            assertThat(status.getState()).isEqualTo(JobState.FAILED);
            assertThat(status.getFailure()).contains("p-1");
            assertThat(status.getResult()).isNull();
        });
    }

    @Test
    void finishedJobsAreDroppedAfterTheRetentionPeriod() {
        when(programScheduleService.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(done());
        String finished = jobs.submit(request());
        queued.poll().run();
        String running = jobs.submit(request());

        clock.advance(Duration.ofHours(2));
        String latest = jobs.submit(request());

        assertThat(jobs.status(finished)).isEmpty();
        assertThat(jobs.status(running)).get().extracting(ResolveJobStatus::getState).isEqualTo(JobState.RUNNING);
        assertThat(jobs.status(latest)).isPresent();
    }

    @Test
    void onlyTheNewestFinishedJobsAreKept() {
        when(programScheduleService.resolve(any(ResolveRequest.class), any(SolveHandle.class))).thenReturn(done());
        List<String> tickets = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            tickets.add(jobs.submit(request()));
            queued.poll().run();
        }

        jobs.submit(request());

        assertThat(jobs.status(tickets.get(0))).isEmpty();
        assertThat(jobs.status(tickets.get(1))).isPresent();
        assertThat(jobs.status(tickets.get(2))).isPresent();
        assertThat(jobs.trackedJobs()).isEqualTo(3);
    }

    @Test
    void unknownTicket() {
        assertThat(jobs.status("nope")).isEmpty();
        assertThat(jobs.cancel("nope")).isFalse();
    }

    private static ResolveResult done() {
        return ResolveResult.builder().status(ResolveStatus.VALID).complete(true).warnings(List.of()).build();
    }

    private static ResolveRequest request() {
        return ResolveRequest.builder()
            .programId("p-1")
            .currentMonth(YearMonth.of(2024, 2))
            .build();
    }

    private static final class MovableClock extends Clock {
        private Instant now = NOW;

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
