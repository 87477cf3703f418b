package com.example.residency_scheduler.service;

import com.example.residency_scheduler.audit.Actor;
import com.example.residency_scheduler.audit.AuditLog;
import com.example.residency_scheduler.audit.AuditRecord;
import com.example.residency_scheduler.catalog.RuleCatalog;
import com.example.residency_scheduler.config.SolverSettings;
import com.example.residency_scheduler.conflict.ConflictReport;
import com.example.residency_scheduler.enums.AuditEntryType;
import com.example.residency_scheduler.enums.StationCode;
import com.example.residency_scheduler.exception.ResolveInProgressException;
import com.example.residency_scheduler.leave.LeaveEvent;
import com.example.residency_scheduler.schedule.Assignment;
import com.example.residency_scheduler.schedule.BottleneckAnalyzer;
import com.example.residency_scheduler.schedule.BottleneckReport;
import com.example.residency_scheduler.schedule.ScheduleState;
import com.example.residency_scheduler.solver.CapacityOverride;
import com.example.residency_scheduler.solver.ResolveRequest;
import com.example.residency_scheduler.solver.ResolveResult;
import com.example.residency_scheduler.solver.SolveHandle;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the committed schedule of each program.
 * <ul>
 *   <li>Full resolves of one program are serialised by a per-program lock.</li>
 *   <li>A result replaces the committed state in one reference swap, or not at all.</li>
 *   <li>Move checks read the last committed snapshot and never wait for the lock.</li>
 * </ul>
 */
@Slf4j
@Service
public class ProgramScheduleService {
    private final ScheduleEngine engine;
    private final RuleCatalog catalog;
    private final AuditLog auditLog;
    private final SolverSettings settings;
    private final Map<String, ProgramSlot> programs = new ConcurrentHashMap<>();

    public ProgramScheduleService(ScheduleEngine engine, RuleCatalog catalog, AuditLog auditLog, SolverSettings settings) {
        this.engine = engine;
        this.catalog = catalog;
        this.auditLog = auditLog;
        this.settings = settings;
    }

    public ResolveResult resolve(ResolveRequest request) {
        return resolve(request, new SolveHandle());
    }

    /**
     * Resolves against the program's committed state, which replaces whatever the request carries.
     * A complete hard-feasible result is committed unless the handle was cancelled.
     */
    public ResolveResult resolve(ResolveRequest request, SolveHandle handle) {
        if (request.getProgramId() == null) {
            throw new IllegalArgumentException("A resolve needs a program id");
        }
        if (request.getRequestedBy() == null && !request.getAnchors().isEmpty()) {
            throw new IllegalArgumentException("Anchored resolves must name the requesting actor");
        }
        ProgramSlot slot = slot(request.getProgramId());
        acquire(slot, request.getProgramId());
        try {
            ScheduleState committed = slot.committed.get();
            ResolveResult result = engine.resolve(request.toBuilder().currentState(committed).build(), handle);

            if (!result.isCommittable()) {
                log.info("Resolve of {} ended {}, committed state unchanged", request.getProgramId(), result.getStatus());
                return result;
            }
            if (handle.isCancelled()) {
                log.info("Resolve of {} was cancelled, committed state unchanged", request.getProgramId());
                return result;
            }
            slot.committed.set(result.getState().copy());
            log.info("Committed {} for {} (phase {}, {}s)", result.getStatus(), request.getProgramId(),
                result.getPhase(), String.format("%.2f", result.getWallTimeSeconds()));
            recordChanges(request, committed, result.getState(), slot);
            return result;
        } finally {
            slot.lock.unlock();
        }
    }

    public Optional<ConflictReport> validateMove(String programId, Assignment move, YearMonth currentMonth) {
        ScheduleState snapshot = requireCommitted(programId);
        return engine.validateMove(snapshot, move, currentMonth);
    }

    /** A copy of the committed state; changes to it are not seen by the service. */
    public Optional<ScheduleState> committedState(String programId) {
        ProgramSlot slot = programs.get(programId);
        if (slot == null || slot.committed.get() == null) {
            return Optional.empty();
        }
        return Optional.of(slot.committed.get().copy());
    }

    /** Restores a state persisted by a collaborator, e.g. after a restart. */
    public void importCommitted(String programId, ScheduleState state, List<LeaveEvent> recordedLeave) {
        if (!programId.equals(state.getProgramId())) {
            throw new IllegalArgumentException("State belongs to program " + state.getProgramId() + ", not " + programId);
        }
        catalog.byVersion(state.getRuleSetVersion());
        ProgramSlot slot = slot(programId);
        acquire(slot, programId);
        try {
            slot.committed.set(state.copy());
            slot.recordedLeave.clear();
            slot.recordedLeave.addAll(recordedLeave);
            log.info("Imported committed state for {}: {} trainees, rules {}", programId, state.traineeCount(),
                state.getRuleSetVersion());
        } finally {
            slot.lock.unlock();
        }
    }

    public BottleneckReport forecastBottlenecks(String programId, YearMonth currentMonth) {
        ScheduleState snapshot = requireCommitted(programId);
        BottleneckAnalyzer analyzer = new BottleneckAnalyzer(settings.getCoverageLookaheadMonths());
        return analyzer.forecast(snapshot, catalog.byVersion(snapshot.getRuleSetVersion()), currentMonth);
    }

    private void recordChanges(ResolveRequest request, ScheduleState previous, ScheduleState resolved, ProgramSlot slot) {
        for (Assignment anchor : request.getAnchors()) {
            StationCode prior = previous != null && previous.hasTrainee(anchor.getTraineeId())
                    && anchor.getMonthIndex() < previous.length(previous.ordinalOf(anchor.getTraineeId()))
                ? previous.station(anchor.getTraineeId(), anchor.getMonthIndex())
                : null;
            if (prior == anchor.getStation()) {
                continue;
            }
            Actor actor = request.getRequestedBy();
            auditLog.append(AuditRecord.builder()
                .programId(request.getProgramId())
                .type(AuditEntryType.MANUAL_ASSIGNMENT)
                .actor(actor)
                .traineeId(anchor.getTraineeId())
                .monthIndex(anchor.getMonthIndex())
                .calendarMonth(resolved.calendarMonth(resolved.ordinalOf(anchor.getTraineeId()), anchor.getMonthIndex()))
                .priorStation(prior)
                .newStation(anchor.getStation())
                .build());
        }
        for (CapacityOverride override : request.getOverrides()) {
            auditLog.append(AuditRecord.builder()
                .programId(request.getProgramId())
                .type(AuditEntryType.CAPACITY_OVERRIDE)
                .actor(override.getActor())
                .calendarMonth(override.getMonth())
                .newStation(override.getStation())
                .justification(override.getJustification())
                .detail("minimum relaxed to " + override.getRelaxedMinimum())
                .build());
        }
        for (LeaveEvent event : request.getLeaveEvents()) {
            if (!slot.recordedLeave.add(event)) {
                continue;
            }
            auditLog.append(AuditRecord.builder()
                .programId(request.getProgramId())
                .type(AuditEntryType.LEAVE_REPORTED)
                .actor(event.getReportedBy())
                .traineeId(event.getTraineeId())
                .calendarMonth(event.getStart())
                .newStation(event.getType().getStation())
                .detail(String.format("%d months, %s", event.getDurationMonths(), event.getClassification()))
                .build());
        }
    }

    private ScheduleState requireCommitted(String programId) {
        ProgramSlot slot = programs.get(programId);
        ScheduleState snapshot = slot == null ? null : slot.committed.get();
        if (snapshot == null) {
            throw new IllegalArgumentException("No committed schedule for program " + programId);
        }
        return snapshot;
    }

    private ProgramSlot slot(String programId) {
        return programs.computeIfAbsent(programId, id -> new ProgramSlot());
    }

    private void acquire(ProgramSlot slot, String programId) {
        try {
            if (!slot.lock.tryLock(settings.getLockWait().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ResolveInProgressException(programId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolveInProgressException(programId, e);
        }
    }

    private static final class ProgramSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicReference<ScheduleState> committed = new AtomicReference<>();
        // guarded by lock
        private final Set<LeaveEvent> recordedLeave = new HashSet<>();
    }
}
