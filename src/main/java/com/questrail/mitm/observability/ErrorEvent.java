package com.questrail.mitm.observability;

import com.questrail.mitm.status.Role;

import java.time.Instant;

/**
 * Record representing an error or anomaly inside a role.
 * {@code cause} may be {@code null}.
 */
public record ErrorEvent(
    Instant timestamp,
    Role role,
    String message,
    Throwable cause
) {
}
