package com.example.residency_scheduler.audit;

import com.example.residency_scheduler.entities.AuditEntry;
import com.example.residency_scheduler.enums.AuditEntryType;
import com.example.residency_scheduler.repositories.AuditEntryRepository;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Slf4j
@Component
public class JpaAuditLog implements AuditLog {
    private final AuditEntryRepository repository;
    private final Clock clock;

    public JpaAuditLog(AuditEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public AuditEntry append(AuditRecord record) {
        if (record.getProgramId() == null || record.getType() == null || record.getActor() == null) {
            throw new IllegalArgumentException("Audit record needs a program, a type and an actor: " + record);
        }
        if (record.getType() == AuditEntryType.CAPACITY_OVERRIDE
                && (record.getJustification() == null || record.getJustification().isBlank())) {
            throw new IllegalArgumentException("A capacity override cannot be recorded without a justification");
        }
        AuditEntry entry = new AuditEntry();
        entry.setProgramId(record.getProgramId());
        entry.setEntryType(record.getType());
        entry.setActorId(record.getActor().getId());
        entry.setActorRole(record.getActor().getRole());
        entry.setRecordedAt(clock.instant());
        entry.setTraineeId(record.getTraineeId());
        entry.setMonthIndex(record.getMonthIndex());
        entry.setCalendarMonth(record.getCalendarMonth() == null ? null : record.getCalendarMonth().atDay(1));
        entry.setPriorStation(record.getPriorStation());
        entry.setNewStation(record.getNewStation());
        entry.setJustification(record.getJustification());
        entry.setDetail(record.getDetail());

        AuditEntry saved = repository.append(entry);
        log.info("Audit {} #{}: {} by {} ({})", record.getProgramId(), saved.getId(), record.getType(),
            record.getActor().getId(), record.getActor().getRole());
        return saved;
    }

    @Override
    public List<AuditEntry> entries(String programId) {
        return repository.findByProgram(programId);
    }
}
