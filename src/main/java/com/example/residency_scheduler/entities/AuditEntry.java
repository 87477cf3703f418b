package com.example.residency_scheduler.entities;

import com.example.residency_scheduler.enums.ActorRole;
import com.example.residency_scheduler.enums.AuditEntryType;
import com.example.residency_scheduler.enums.StationCode;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One append-only audit record. Rows are inserted, never updated or deleted.
 */
@Getter
@Setter
@Entity
@Table(name = "audit_entry")
public class AuditEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "program_id", nullable = false, updatable = false)
    private String programId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false)
    private AuditEntryType entryType;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", nullable = false, updatable = false)
    private ActorRole actorRole;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "trainee_id", updatable = false)
    private String traineeId;

    @Column(name = "month_index", updatable = false)
    private Integer monthIndex;

    // first day of the affected calendar month
    @Column(name = "calendar_month", updatable = false)
    private LocalDate calendarMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "prior_station", updatable = false)
    private StationCode priorStation;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_station", updatable = false)
    private StationCode newStation;

    @Column(name = "justification", length = 2000, updatable = false)
    private String justification;

    @Column(name = "detail", length = 500, updatable = false)
    private String detail;
}
