package com.example.residency_scheduler.schedule;

import com.example.residency_scheduler.catalog.RuleViolation;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class ValidationResult {
    private final List<String> errors = new ArrayList<>();
    private final List<RuleViolation> violations = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void addError(String message) {
        errors.add(message);
    }

    void addViolation(RuleViolation violation) {
        violations.add(violation);
    }

    void addWarning(String message) {
        warnings.add(message);
    }

    public boolean isValid() {
        return errors.isEmpty() && violations.isEmpty();
    }

    public String summary() {
        StringBuilder text = new StringBuilder(isValid() ? "Validation passed" : "Validation failed");
        if (!errors.isEmpty() || !violations.isEmpty()) {
            text.append(String.format("%nErrors (%d):", errors.size() + violations.size()));
            errors.forEach(error -> text.append(String.format("%n  - %s", error)));
            violations.forEach(violation -> text.append(String.format("%n  - %s", violation)));
        }
        if (!warnings.isEmpty()) {
            text.append(String.format("%nWarnings (%d):", warnings.size()));
            warnings.forEach(warning -> text.append(String.format("%n  - %s", warning)));
        }
        return text.toString();
    }
}
