package com.example.residency_scheduler.config;

import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.solver.ResidencyScheduleSolver;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public SolverSettings solverSettings(
            @Value("${residency.scheduler.time-budget:PT10S}") Duration timeBudget,
            @Value("${residency.scheduler.diagnosis-budget:PT2S}") Duration diagnosisBudget,
            @Value("${residency.scheduler.search-workers:4}") int searchWorkers,
            @Value("${residency.scheduler.random-seed:42}") int randomSeed,
            @Value("${residency.scheduler.log-search-progress:false}") boolean logSearchProgress,
            @Value("${residency.scheduler.lock-wait:PT30S}") Duration lockWait,
            @Value("${residency.scheduler.coverage-lookahead-months:12}") int coverageLookaheadMonths,
            @Value("${residency.scheduler.job-retention:PT1H}") Duration jobRetention,
            @Value("${residency.scheduler.finished-job-limit:100}") int finishedJobLimit,
            @Value("${residency.scheduler.staffing-floors:false}") boolean staffingFloors) {
        if (searchWorkers < 1) {
            throw new IllegalArgumentException("residency.scheduler.search-workers must be at least 1");
        }
        if (finishedJobLimit < 0) {
            throw new IllegalArgumentException("residency.scheduler.finished-job-limit must not be negative");
        }
        if (staffingFloors) {
            log.info("Default syllabus published with ward staffing minimums");
        }
        return SolverSettings.builder()
            .timeBudget(timeBudget)
            .diagnosisBudget(diagnosisBudget)
            .searchWorkers(searchWorkers)
            .randomSeed(randomSeed)
            .logSearchProgress(logSearchProgress)
            .lockWait(lockWait)
            .coverageLookaheadMonths(coverageLookaheadMonths)
            .jobRetention(jobRetention)
            .finishedJobLimit(finishedJobLimit)
            .staffingFloors(staffingFloors)
            .build();
    }

    /** Background resolves. One at a time per program is enforced by the service, not the pool. */
    @Bean(name = "scheduleExecutor")
    public Executor scheduleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("Resolve-");
        executor.initialize();
        return executor;
    }

    @Bean
    public RuleCatalog ruleCatalog(SolverSettings solverSettings) {
        return RuleCatalog.withDefaultSyllabus(solverSettings.isStaffingFloors());
    }

    // audit timestamps only
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResidencyScheduleSolver residencyScheduleSolver(RuleCatalog ruleCatalog, SolverSettings solverSettings) {
        return new ResidencyScheduleSolver(ruleCatalog, solverSettings);
    }
}
