package com.example.residency_scheduler.solver;

import com.google.ortools.sat.CpSolverSolutionCallback;

import lombok.extern.slf4j.Slf4j;

@Slf4j
class ImprovementCallback extends CpSolverSolutionCallback {
    private final String programId;
    private final int phase;
    private final SolveHandle handle;
    private int solutionCount;

    ImprovementCallback(String programId, int phase, SolveHandle handle) {
        this.programId = programId;
        this.phase = phase;
        this.handle = handle;
    }

    @Override
    public void onSolutionCallback() {
        solutionCount++;
        log.debug("{} phase {} solution #{}: {} block starts after {}s",
            programId, phase, solutionCount, (long) objectiveValue(), String.format("%.2f", wallTime()));
        if (handle.isCancelled()) {
            stopSearch();
        }
    }

    int getSolutionCount() {
        return solutionCount;
    }
}
