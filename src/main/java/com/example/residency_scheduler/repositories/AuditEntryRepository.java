package com.example.residency_scheduler.repositories;

import com.example.residency_scheduler.entities.AuditEntry;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class AuditEntryRepository {
    private final EntityManager entityManager;

    public AuditEntryRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Transactional
    public AuditEntry append(AuditEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Audit entries are append-only; got an existing entry " + entry.getId());
        }
        entityManager.persist(entry);
        return entry;
    }

    public List<AuditEntry> findByProgram(String programId) {
        return entityManager.createQuery(
                "SELECT a FROM AuditEntry a WHERE a.programId = :programId ORDER BY a.id", AuditEntry.class)
            .setParameter("programId", programId)
            .getResultList();
    }
}
