package com.example.residency_scheduler;

import com.example.residency_scheduler.entities.Trainee;
import com.example.residency_scheduler.repositories.TraineeRepository;
import com.example.residency_scheduler.schedule.StationMonthLoad;
import com.example.residency_scheduler.service.ProgramScheduleService;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.List;

/**
 * Resolves the stored active roster once at startup and logs the outcome. Enabled by setting
 * {@code residency.scheduler.startup.program-id}; the current month must be given alongside.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "residency.scheduler.startup", name = "program-id")
public class RosterResolveRunner implements CommandLineRunner {
    private final TraineeRepository traineeRepository;
    private final ProgramScheduleService programScheduleService;
    private final String programId;
    private final String currentMonth;

    public RosterResolveRunner(TraineeRepository traineeRepository, ProgramScheduleService programScheduleService,
                               @Value("${residency.scheduler.startup.program-id}") String programId,
                               @Value("${residency.scheduler.startup.current-month:}") String currentMonth) {
        this.traineeRepository = traineeRepository;
        this.programScheduleService = programScheduleService;
        this.programId = programId;
        this.currentMonth = currentMonth;
    }

    @Override
    public void run(String... args) {
        if (currentMonth.isBlank()) {
            throw new IllegalArgumentException("residency.scheduler.startup.current-month is required, e.g. 2025-09");
        }
        List<Trainee> roster = traineeRepository.findActive();
        if (roster.isEmpty()) {
            log.info("No active trainees stored, nothing to resolve for {}", programId);
            return;
        }
        ResolveResult result = programScheduleService.resolve(ResolveRequest.builder()
            .programId(programId)
            .roster(roster)
            .currentMonth(YearMonth.parse(currentMonth))
            .build());

        log.info("Startup resolve of {}: {} in phase {} ({} trainees)", programId, result.getStatus(),
            result.getPhase(), roster.size());
        if (result.getConflictReport() != null) {
            log.warn("Conflicts: {}", result.getConflictReport().getSummary());
        }
        if (result.getCapacitySummary() != null) {
            for (StationMonthLoad load : result.getCapacitySummary().outOfBounds()) {
                log.warn("Out of bounds: {}", load);
            }
        }
        result.getWarnings().forEach(warning -> log.info("Warning: {}", warning));
    }
}
