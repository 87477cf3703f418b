package com.example.residency_scheduler.solver;

import com.google.ortools.sat.CpSolver;

/**
 * Cancellation channel for one running resolve. Cancelling stops the active CP-SAT search; the
 * resolve then returns whatever it has found so far.
 */
public class SolveHandle {
    private volatile boolean cancelled;
    private volatile CpSolver activeSolver;

    public void cancel() {
        cancelled = true;
        CpSolver solver = activeSolver;
        if (solver != null) {
            solver.stopSearch();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers the solver about to run. Returns false, and registers nothing, when the resolve
     * was cancelled first; a stop sent before the search starts would be lost.
     */
    boolean attach(CpSolver solver) {
        activeSolver = solver;
        if (cancelled) {
            activeSolver = null;
            return false;
        }
        return true;
    }

    void detach() {
        activeSolver = null;
    }
}
