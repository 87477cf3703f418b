package com.example.residency_scheduler.audit;

import com.example.residency_scheduler.enums.ActorRole;

import lombok.Value;

/** Who asked for a change. Supplied by the caller; the engine does no authentication. */
@Value
public class Actor {
    String id;
    ActorRole role;
}
