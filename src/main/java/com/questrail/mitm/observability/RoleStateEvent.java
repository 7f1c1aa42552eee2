package com.questrail.mitm.observability;

import com.questrail.mitm.status.Role;
import com.questrail.mitm.status.RoleState;

import java.time.Instant;
import java.util.Objects;

/**
 * A role changed lifecycle state, or updated its free-text status.
 */
public record RoleStateEvent(
    Instant timestamp,
    Role role,
    RoleState state,
    String status
) {
    public RoleStateEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(status, "status");
    }
}
