package com.example.residency_scheduler.exception;

import com.example.residency_scheduler.enums.ActorRole;

public class UnauthorizedActionException extends ScheduleEngineException {

    public UnauthorizedActionException(String actorId, ActorRole role, String action) {
        super("UNAUTHORIZED", String.format("%s (%s) may not %s", actorId, role, action), actorId, role, action);
    }
}
