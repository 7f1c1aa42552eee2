package com.questrail.mitm.observability;

import com.questrail.mitm.status.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of textual output produced by a role.
 */
public record RoleOutputEvent(
    Instant timestamp,
    Role role,
    Severity severity,
    String line
) {
    public enum Severity { DEBUG, INFO, WARN, ERROR }

    public RoleOutputEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(line, "line");
    }
}
