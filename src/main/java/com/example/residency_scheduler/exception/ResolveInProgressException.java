package com.example.residency_scheduler.exception;

public class ResolveInProgressException extends ScheduleEngineException {

    public ResolveInProgressException(String programId) {
        super("RESOLVE_IN_PROGRESS", "A resolve is already running for program " + programId, programId);
    }

    public ResolveInProgressException(String programId, Throwable cause) {
        super("RESOLVE_IN_PROGRESS", "Interrupted while waiting to resolve program " + programId, cause, programId);
    }
}
