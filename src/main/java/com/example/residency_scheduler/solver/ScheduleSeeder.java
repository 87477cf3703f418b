package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Builds a starting schedule one trainee at a time, in roster order. Each trainee gets a small
 * model with every station in one block, solved against the capacity earlier trainees already hold.
 * A trainee with no such schedule is left with its fixed cells only and the next one is tried.
 */
@Slf4j
class ScheduleSeeder {
    private final SolverSettings settings;

    ScheduleSeeder(SolverSettings settings) {
        this.settings = settings;
    }

    Seed seed(ProblemInstance instance, SearchAllowance allowance, SolveHandle handle) {
        ScheduleState working = instance.getState().copy();
        int seeded = 0;
        for (int t = 0; t < instance.traineeCount(); t++) {
            double share = allowance.remaining() / (instance.traineeCount() - t);
            if (share <= 0 || handle.isCancelled()) {
                break;
            }
            ScheduleModelBuilder builder = ScheduleModelBuilder.forSeed(instance, t, working).build();
            CpSolver solver = CpSolverFactory.create(settings, share, 1);
            if (!handle.attach(solver)) {
                break;
            }
            CpSolverStatus status;
            try {
                status = solver.solve(builder.getModel());
            } finally {
                handle.detach();
            }
            allowance.charge(solver);
            if (status == CpSolverStatus.OPTIMAL || status == CpSolverStatus.FEASIBLE) {
                builder.writeSolution(solver, working);
                seeded++;
            } else {
                log.debug("No single-block seed for {} ({})", instance.trainee(t).getId(), status);
            }
        }
        log.info("Seeded {}/{} trainees of {} in {} deterministic s", seeded, instance.traineeCount(),
            instance.getProgramId(), String.format("%.3f", allowance.getSpent()));
        return new Seed(working, seeded == instance.traineeCount() && working.isComplete(),
            blockStarts(instance, working) == blockStartFloor(instance));
    }

    /** Every required station needs at least one block, so this many starts is the least possible. */
    static int blockStartFloor(ProblemInstance instance) {
        int floor = 0;
        for (int t = 0; t < instance.traineeCount(); t++) {
            for (StationCode station : instance.candidates(t)) {
                if (instance.target(t).required(station) > 0) {
                    floor++;
                }
            }
        }
        return floor;
    }

    static int blockStarts(ProblemInstance instance, ScheduleState state) {
        int starts = 0;
        for (int t = 0; t < instance.traineeCount(); t++) {
            List<StationCode> candidates = instance.candidates(t);
            int[] row = state.row(t);
            for (int m = 0; m < row.length; m++) {
                StationCode station = StationCode.fromId(row[m]);
                if (station != null && candidates.contains(station) && (m == 0 || row[m - 1] != row[m])) {
                    starts++;
                }
            }
        }
        return starts;
    }

    @Value
    static class Seed {
        ScheduleState state;
        boolean complete;
        // no station split anywhere, the least continuity cost any schedule can have
        boolean singleBlocks;
    }
}
