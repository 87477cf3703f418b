package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.config.SolverSettings;
import com.google.ortools.sat.CpSolver;

/**
 * CP-SAT solvers limited by deterministic time, so a rerun on the same input stops at the same
 * point. The wall clock only backs the limit up on a host far slower than usual.
 */
public final class CpSolverFactory {
    static final double WALL_CLOCK_FACTOR = 3.0;
    static final double WALL_CLOCK_SLACK_SECONDS = 2.0;

    private CpSolverFactory() {
    }

    public static CpSolver create(SolverSettings settings, double deterministicLimit, int workers) {
        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxDeterministicTime(deterministicLimit);
        solver.getParameters().setMaxTimeInSeconds(deterministicLimit * WALL_CLOCK_FACTOR + WALL_CLOCK_SLACK_SECONDS);
        solver.getParameters().setNumSearchWorkers(workers);
        if (workers > 1) {
            // batches of workers synchronised on deterministic time
            solver.getParameters().setInterleaveSearch(true);
        }
        solver.getParameters().setRandomSeed(settings.getRandomSeed());
        solver.getParameters().setLogSearchProgress(settings.isLogSearchProgress());
        return solver;
    }
}
