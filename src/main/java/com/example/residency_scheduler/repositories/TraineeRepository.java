package com.example.residency_scheduler.repositories;

import com.example.residency_scheduler.entities.Trainee;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public class TraineeRepository {
    private final EntityManager entityManager;

    public TraineeRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public Optional<Trainee> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityManager.find(Trainee.class, id));
    }

    public List<Trainee> findActive() {
        return entityManager.createQuery(
                "SELECT t FROM Trainee t WHERE t.active = true ORDER BY t.id", Trainee.class)
            .getResultList();
    }

    @Transactional
    public Trainee intake(Trainee trainee) {
        if (trainee.getId() == null || trainee.getId().isBlank()) {
            throw new IllegalArgumentException("Trainee id cannot be blank");
        }
        if (entityManager.find(Trainee.class, trainee.getId()) != null) {
            throw new IllegalArgumentException("Trainee already on roster: " + trainee.getId());
        }
        trainee.setActive(true);
        entityManager.persist(trainee);
        return trainee;
    }

    /** Graduation. Trainees are never removed from the roster. */
    @Transactional
    public Trainee deactivate(String id) {
        Trainee trainee = findById(id)
            .orElseThrow(() -> new IllegalArgumentException("Trainee not found with ID: " + id));
        trainee.setActive(false);
        return trainee;
    }
}
