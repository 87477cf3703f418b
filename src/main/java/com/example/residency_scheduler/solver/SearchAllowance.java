package com.example.residency_scheduler.solver;

import com.google.ortools.sat.CpSolver;

import java.time.Duration;

/** A budget of CP-SAT deterministic time, drawn down by each solve charged to it. */
public class SearchAllowance {
    private final double total;
    private double spent;

    public SearchAllowance(Duration budget) {
        this(budget.toMillis() / 1000.0);
    }

    public SearchAllowance(double total) {
        this.total = Math.max(0, total);
    }

    public double remaining() {
        return Math.max(0, total - spent);
    }

    public boolean isExhausted() {
        return remaining() <= 0;
    }

    public void charge(CpSolver solver) {
        spent += solver.response().getDeterministicTime();
    }

    public double getSpent() {
        return spent;
    }
}
