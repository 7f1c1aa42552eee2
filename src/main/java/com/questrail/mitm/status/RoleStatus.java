package com.questrail.mitm.status;

import java.util.Objects;

/**
 * Externally visible state of one role.
 *
 * @param role   the role
 * @param state  lifecycle state
 * @param status free-text status
 */
public record RoleStatus(Role role, RoleState state, String status) {
    public RoleStatus {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(status, "status");
    }

    public String name() {
        return role.wireName();
    }
}
