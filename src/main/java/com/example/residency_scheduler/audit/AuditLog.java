package com.example.residency_scheduler.audit;

import com.example.residency_scheduler.entities.AuditEntry;

import java.util.List;

/**
 * Append-only trail of manual assignments, capacity overrides and reported leave.
 * The solver never reads it.
 */
public interface AuditLog {

    AuditEntry append(AuditRecord record);

    List<AuditEntry> entries(String programId);
}
