package com.example.residency_scheduler.exception;

import java.time.LocalDate;

public class NoRuleSetForDateException extends ScheduleEngineException {

    public NoRuleSetForDateException(LocalDate date) {
        super("NO_RULE_SET_FOR_DATE", "No syllabus rule set covers " + date, date);
    }

    public NoRuleSetForDateException(String version) {
        super("NO_RULE_SET_FOR_DATE", "Unknown syllabus rule set version " + version, version);
    }
}
