package com.example.residency_scheduler.solver;

import com.example.residency_scheduler.catalog.StationRule;
import com.example.residency_scheduler.enums.RuleKind;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;

import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the CP-SAT model for one problem instance. One boolean per (trainee, month, station in the
 * cell's domain); fixed cells get a single variable pinned to 1.
 * <p>
 * A station kept in one block is encoded by its block start: one boolean per first month at which
 * the whole block fits, exactly one of them true, and each cell equal to the starts that cover it.
 * In diagnosis mode every rule family is guarded by assumption literals, calendar windows are
 * encoded as guarded constraints instead of domain filtering, and continuity is left out.
 * <p>
 * A seed model covers a single trainee against a fixed background of everyone else's cells; it
 * keeps their share of each capacity cap and drops capacity minimums.
 */
@Slf4j
public class ScheduleModelBuilder {
    /** How block structure enters the model. */
    public enum Continuity {
        /** Non-splittable stations as single blocks, fewest block starts for the rest. */
        STRICT,
        /** Fewest block starts, no station forced into one block. */
        RELAXED,
        /** Every station as a single block, no objective. */
        SINGLE_BLOCKS,
        NONE
    }

    private final ProblemInstance instance;
    private final Continuity continuity;
    private final boolean diagnosis;
    private final boolean[] inScope;
    private final ScheduleState background;
    private final CpModel model;
    private final Map<String, Runnable> constraintMethods;

    // [trainee][month][station id], null where the station is outside the cell's domain
    private final BoolVar[][][] cellVars;
    // [trainee][month][station id], present for stations counted by their block starts
    private final BoolVar[][][] startVars;
    // [trainee][station id][first month], present where a whole block fits
    private final BoolVar[][][] blockVars;
    // [trainee][station id], first month of a single-block station
    private final LinearExpr[][] blockStarts;
    private final Map<Integer, ConstraintGroup> groupsByLiteral = new LinkedHashMap<>();
    private final List<BoolVar> assumptionLiterals = new ArrayList<>();
    private final Map<String, Integer> constraintCounts = new LinkedHashMap<>();

    private ScheduleModelBuilder(ProblemInstance instance, Continuity continuity, boolean diagnosis,
                                 boolean[] inScope, ScheduleState background) {
        this.instance = instance;
        this.continuity = continuity;
        this.diagnosis = diagnosis;
        this.inScope = inScope;
        this.background = background;
        this.model = new CpModel();
        int trainees = instance.traineeCount();
        this.cellVars = new BoolVar[trainees][][];
        this.startVars = new BoolVar[trainees][][];
        this.blockVars = new BoolVar[trainees][][];
        this.blockStarts = new LinearExpr[trainees][];
        this.constraintMethods = initializeConstraintMethods();
    }

    /** The whole roster; strict continuity keeps every non-splittable station in one block. */
    public static ScheduleModelBuilder forSearch(ProblemInstance instance, boolean strictContinuity) {
        return new ScheduleModelBuilder(instance, strictContinuity ? Continuity.STRICT : Continuity.RELAXED, false,
            wholeRoster(instance), null);
    }

    public static ScheduleModelBuilder forDiagnosis(ProblemInstance instance) {
        return new ScheduleModelBuilder(instance, Continuity.NONE, true, wholeRoster(instance), null);
    }

    /** One trainee, every station in one block, around the cells already in the background. */
    public static ScheduleModelBuilder forSeed(ProblemInstance instance, int ordinal, ScheduleState background) {
        boolean[] scope = new boolean[instance.traineeCount()];
        scope[ordinal] = true;
        return new ScheduleModelBuilder(instance, Continuity.SINGLE_BLOCKS, false, scope, background);
    }

    private static boolean[] wholeRoster(ProblemInstance instance) {
        boolean[] scope = new boolean[instance.traineeCount()];
        Arrays.fill(scope, true);
        return scope;
    }

    private Map<String, Runnable> initializeConstraintMethods() {
        Map<String, Runnable> methods = new LinkedHashMap<>();
        methods.put("one_station_per_month", this::createCellVariables);
        methods.put("single_block", this::encodeSingleBlocks);
        methods.put("duration", this::enforceDurations);
        methods.put("capacity", this::enforceCapacityBounds);
        methods.put("sequence", this::enforceSequences);
        methods.put("calendar_window", this::enforceCalendarWindows);
        methods.put("continuity", this::applyContinuity);
        return methods;
    }

    public ScheduleModelBuilder build() {
        for (Runnable method : constraintMethods.values()) {
            method.run();
        }
        log.debug("Model for {} ({}{}): {}", instance.getProgramId(), continuity,
            diagnosis ? ", diagnosis" : "", constraintCounts);
        return this;
    }

    public CpModel getModel() {
        return model;
    }

    public List<BoolVar> getAssumptionLiterals() {
        return assumptionLiterals;
    }

    public ConstraintGroup groupOf(int literalIndex) {
        return groupsByLiteral.get(literalIndex);
    }

    public ConstraintGroup groupOf(BoolVar literal) {
        return groupsByLiteral.get(literal.getIndex());
    }

    public int variableCount() {
        return model.model().getVariablesCount();
    }

    public int constraintCount() {
        return model.model().getConstraintsCount();
    }

    private void count(String family) {
        constraintCounts.merge(family, 1, Integer::sum);
    }

    private Constraint guard(Constraint constraint, BoolVar literal) {
        if (literal != null) {
            constraint.onlyEnforceIf(literal);
        }
        return constraint;
    }

    private BoolVar assumption(ConstraintGroup group) {
        if (!diagnosis) {
            return null;
        }
        BoolVar literal = model.newBoolVar(group.literalName());
        model.addAssumption(literal);
        groupsByLiteral.put(literal.getIndex(), group);
        assumptionLiterals.add(literal);
        return literal;
    }

    private void createCellVariables() {
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            int length = instance.length(t);
            cellVars[t] = new BoolVar[length][StationCode.count()];
            for (int m = 0; m < length; m++) {
                List<StationCode> domain = instance.domain(t, m, !diagnosis);
                List<BoolVar> options = new ArrayList<>();
                for (StationCode station : domain) {
                    BoolVar var = model.newBoolVar(String.format("x_%d_%d_%s", t, m, station.name()));
                    cellVars[t][m][station.id()] = var;
                    options.add(var);
                }
                model.addExactlyOne(options.toArray(new Literal[0]));
                count("one_station_per_month");
                if (instance.isFixed(t, m)) {
                    model.addEquality(options.get(0), 1);
                    count("fixed_cell");
                }
            }
        }
    }

    private boolean keptInOneBlock(StationCode station) {
        return continuity == Continuity.SINGLE_BLOCKS
            || (continuity == Continuity.STRICT && !instance.getRuleSet().isSplittable(station));
    }

    private boolean blockFits(int ordinal, StationCode station, int first, int months) {
        for (int m = first; m < first + months; m++) {
            if (cellVars[ordinal][m][station.id()] == null) {
                return false;
            }
        }
        return true;
    }

    /** x[m] = sum of block[k] for k in (m - d, m]; exactly one block[k]. */
    private void encodeSingleBlocks() {
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            int length = instance.length(t);
            blockVars[t] = new BoolVar[StationCode.count()][];
            blockStarts[t] = new LinearExpr[StationCode.count()];
            for (StationCode station : instance.candidates(t)) {
                int required = instance.target(t).required(station);
                if (required == 0 || !keptInOneBlock(station)) {
                    continue;
                }
                BoolVar[] starts = new BoolVar[length];
                List<BoolVar> options = new ArrayList<>();
                LinearExprBuilder firstMonth = LinearExpr.newBuilder();
                for (int k = 0; k + required <= length; k++) {
                    if (blockFits(t, station, k, required)) {
                        starts[k] = model.newBoolVar(String.format("block_%d_%d_%s", t, k, station.name()));
                        options.add(starts[k]);
                        firstMonth.addTerm(starts[k], k);
                    }
                }
                if (options.isEmpty()) {
                    model.addBoolOr(new Literal[0]);
                    count("single_block");
                    continue;
                }
                model.addExactlyOne(options.toArray(new Literal[0]));
                for (int m = 0; m < length; m++) {
                    BoolVar cell = cellVars[t][m][station.id()];
                    if (cell == null) {
                        continue;
                    }
                    List<BoolVar> covering = new ArrayList<>();
                    for (int k = Math.max(0, m - required + 1); k <= m; k++) {
                        if (starts[k] != null) {
                            covering.add(starts[k]);
                        }
                    }
                    model.addEquality(cell, LinearExpr.sum(covering.toArray(new BoolVar[0])));
                }
                blockVars[t][station.id()] = starts;
                blockStarts[t][station.id()] = firstMonth.build();
                count("single_block");
            }
        }
    }

    private List<BoolVar> varsOf(int ordinal, StationCode station) {
        List<BoolVar> vars = new ArrayList<>();
        for (int m = 0; m < instance.length(ordinal); m++) {
            BoolVar var = cellVars[ordinal][m][station.id()];
            if (var != null) {
                vars.add(var);
            }
        }
        return vars;
    }

    private void enforceDurations() {
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            for (StationCode station : instance.candidates(t)) {
                int required = instance.target(t).required(station);
                StationRule rule = instance.getRuleSet().durationFor(station).orElse(null);
                BoolVar literal = assumption(ConstraintGroup.forTrainee(RuleKind.DURATION, rule, t, station));
                List<BoolVar> vars = varsOf(t, station);
                guard(model.addEquality(LinearExpr.sum(vars.toArray(new BoolVar[0])), required), literal);
                count("duration");
            }
        }
    }

    private void enforceCapacityBounds() {
        for (StationRule rule : instance.getRuleSet().getCapacityRules()) {
            for (YearMonth month : instance.boundedMonths(rule)) {
                List<BoolVar> terms = new ArrayList<>();
                int occupiedElsewhere = 0;
                for (int t = 0; t < instance.traineeCount(); t++) {
                    int m = instance.trainee(t).monthIndexOf(month);
                    if (m < 0 || m >= instance.length(t)) {
                        continue;
                    }
                    if (!inScope[t]) {
                        if (rule.poolContains(background.station(t, m))) {
                            occupiedElsewhere++;
                        }
                        continue;
                    }
                    for (StationCode station : rule.getPool()) {
                        BoolVar var = cellVars[t][m][station.id()];
                        if (var != null) {
                            terms.add(var);
                        }
                    }
                }
                long maximum = (long) rule.getMaxOccupancy() - occupiedElsewhere;
                long minimum = background == null ? instance.minimumFor(rule, month) : 0;
                if ((minimum == 0 && terms.size() <= maximum) || (background != null && terms.isEmpty())) {
                    continue;
                }
                if (maximum < 0) {
                    minimum = maximum;
                }
                BoolVar literal = assumption(ConstraintGroup.forMonth(rule, month));
                guard(model.addLinearConstraint(LinearExpr.sum(terms.toArray(new BoolVar[0])), minimum, maximum),
                    literal);
                count("capacity");
            }
        }
    }

    /**
     * last(predecessor) is the max of m * x[m]; first(dependent) is the min of L - (L - m) * x[m],
     * which is m where the station sits and L elsewhere.
     */
    private void enforceSequences() {
        for (StationRule rule : instance.getRuleSet().getSequenceRules()) {
            for (int t = 0; t < instance.traineeCount(); t++) {
                if (!inScope[t] || instance.target(t).required(rule.getPredecessor()) == 0
                        || instance.target(t).required(rule.getStation()) == 0) {
                    continue;
                }
                LinearExpr predecessorStart = blockStarts[t][rule.getPredecessor().id()];
                LinearExpr dependentStart = blockStarts[t][rule.getStation().id()];
                if (predecessorStart != null && dependentStart != null) {
                    LinearExpr predecessorEnd = LinearExpr.newBuilder().add(predecessorStart)
                        .add(instance.target(t).required(rule.getPredecessor())).build();
                    BoolVar literal = assumption(ConstraintGroup.forTrainee(RuleKind.SEQUENCE, rule, t, rule.getStation()));
                    if (rule.isImmediate()) {
                        guard(model.addEquality(predecessorEnd, dependentStart), literal);
                    } else {
                        guard(model.addLessOrEqual(predecessorEnd, dependentStart), literal);
                    }
                    count("sequence");
                    continue;
                }
                int length = instance.length(t);
                List<LinearArgument> predecessorTerms = new ArrayList<>();
                List<LinearArgument> dependentTerms = new ArrayList<>();
                for (int m = 0; m < length; m++) {
                    BoolVar predecessor = cellVars[t][m][rule.getPredecessor().id()];
                    if (predecessor != null) {
                        predecessorTerms.add(LinearExpr.term(predecessor, m));
                    }
                    BoolVar dependent = cellVars[t][m][rule.getStation().id()];
                    if (dependent != null) {
                        dependentTerms.add(LinearExpr.affine(dependent, -(length - m), length));
                    }
                }
                if (predecessorTerms.isEmpty() || dependentTerms.isEmpty()) {
                    continue;
                }
                IntVar lastPredecessor = model.newIntVar(0, length - 1,
                    String.format("last_%d_%s", t, rule.getPredecessor().name()));
                IntVar firstDependent = model.newIntVar(0, length,
                    String.format("first_%d_%s", t, rule.getStation().name()));
                model.addMaxEquality(lastPredecessor, predecessorTerms.toArray(new LinearArgument[0]));
                model.addMinEquality(firstDependent, dependentTerms.toArray(new LinearArgument[0]));

                BoolVar literal = assumption(ConstraintGroup.forTrainee(RuleKind.SEQUENCE, rule, t, rule.getStation()));
                LinearExpr afterPredecessor = LinearExpr.affine(lastPredecessor, 1, 1);
                if (rule.isImmediate()) {
                    guard(model.addEquality(afterPredecessor, firstDependent), literal);
                } else {
                    guard(model.addLessOrEqual(afterPredecessor, firstDependent), literal);
                }
                count("sequence");
            }
        }
    }

    /** Search models already dropped disallowed cells from the domains. */
    private void enforceCalendarWindows() {
        if (!diagnosis) {
            return;
        }
        for (StationRule rule : instance.getRuleSet().rulesOf(RuleKind.CALENDAR_WINDOW)) {
            for (int t = 0; t < instance.traineeCount(); t++) {
                if (!inScope[t]) {
                    continue;
                }
                List<BoolVar> excluded = new ArrayList<>();
                for (int m = 0; m < instance.length(t); m++) {
                    BoolVar var = cellVars[t][m][rule.getStation().id()];
                    if (var != null && !instance.windowAllows(t, m, rule.getStation())) {
                        excluded.add(var);
                    }
                }
                if (excluded.isEmpty()) {
                    continue;
                }
                BoolVar literal = assumption(ConstraintGroup.forTrainee(RuleKind.CALENDAR_WINDOW, rule, t, rule.getStation()));
                for (BoolVar var : excluded) {
                    guard(model.addEquality(var, 0), literal);
                }
                count("calendar_window");
            }
        }
    }

    /**
     * start[m] >= x[m] - x[m-1] marks the first month of each block. Fewer starts means longer
     * consecutive runs; a single-block station always counts one start.
     */
    private void applyContinuity() {
        if (continuity != Continuity.STRICT && continuity != Continuity.RELAXED) {
            return;
        }
        LinearExprBuilder totalStarts = LinearExpr.newBuilder();
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            startVars[t] = new BoolVar[instance.length(t)][StationCode.count()];
            for (StationCode station : instance.candidates(t)) {
                if (blockStarts[t][station.id()] != null) {
                    totalStarts.add(1);
                    continue;
                }
                List<BoolVar> starts = new ArrayList<>();
                for (int m = 0; m < instance.length(t); m++) {
                    BoolVar current = cellVars[t][m][station.id()];
                    if (current == null) {
                        continue;
                    }
                    BoolVar previous = m > 0 ? cellVars[t][m - 1][station.id()] : null;
                    BoolVar start = model.newBoolVar(String.format("start_%d_%d_%s", t, m, station.name()));
                    if (previous == null) {
                        model.addEquality(start, current);
                    } else {
                        model.addGreaterOrEqual(LinearExpr.newBuilder().add(start).addTerm(current, -1).add(previous).build(), 0);
                    }
                    startVars[t][m][station.id()] = start;
                    starts.add(start);
                }
                if (starts.isEmpty()) {
                    continue;
                }
                model.addGreaterOrEqual(LinearExpr.sum(starts.toArray(new BoolVar[0])), 1);
                for (BoolVar start : starts) {
                    totalStarts.add(start);
                }
                count("continuity");
            }
        }
        model.minimize(totalStarts.build());
    }

    /**
     * Suggests a schedule as the search's starting point. Cells left unassigned in the suggestion
     * are not hinted, nor are the block variables of a row it leaves incomplete.
     */
    public void hint(ScheduleState suggested) {
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            int[] row = suggested.row(t);
            boolean rowComplete = true;
            for (int m = 0; m < row.length; m++) {
                if (row[m] == StationCode.UNASSIGNED) {
                    rowComplete = false;
                    continue;
                }
                if (instance.isFixed(t, m)) {
                    continue;
                }
                BoolVar[] options = cellVars[t][m];
                for (int s = 0; s < options.length; s++) {
                    if (options[s] != null) {
                        model.addHint(options[s], s == row[m] ? 1 : 0);
                    }
                }
            }
            if (!rowComplete) {
                continue;
            }
            if (startVars[t] != null) {
                for (int m = 0; m < row.length; m++) {
                    BoolVar[] starts = startVars[t][m];
                    for (int s = 0; s < starts.length; s++) {
                        if (starts[s] != null) {
                            boolean opens = row[m] == s && (m == 0 || row[m - 1] != s);
                            model.addHint(starts[s], opens ? 1 : 0);
                        }
                    }
                }
            }
            for (int s = 0; s < blockVars[t].length; s++) {
                BoolVar[] starts = blockVars[t][s];
                if (starts == null) {
                    continue;
                }
                int first = firstMonthOf(row, s);
                for (int k = 0; k < starts.length; k++) {
                    if (starts[k] != null) {
                        model.addHint(starts[k], k == first ? 1 : 0);
                    }
                }
            }
        }
    }

    private static int firstMonthOf(int[] row, int stationId) {
        for (int m = 0; m < row.length; m++) {
            if (row[m] == stationId) {
                return m;
            }
        }
        return -1;
    }

    /** Reads the solver's current solution into a copy of the instance state. */
    public ScheduleState extract(CpSolver solver) {
        ScheduleState solved = instance.getState().copy();
        writeSolution(solver, solved);
        return solved;
    }

    /** Writes the modelled trainees' free cells from the solver's current solution into the target. */
    public void writeSolution(CpSolver solver, ScheduleState target) {
        for (int t = 0; t < instance.traineeCount(); t++) {
            if (!inScope[t]) {
                continue;
            }
            for (int m = 0; m < instance.length(t); m++) {
                if (instance.isFixed(t, m)) {
                    continue;
                }
                BoolVar[] options = cellVars[t][m];
                for (int s = 0; s < options.length; s++) {
                    if (options[s] != null && solver.booleanValue(options[s])) {
                        target.assign(t, m, StationCode.fromId(s));
                        break;
                    }
                }
            }
        }
    }
}
