package com.questrail.mitm.status;

import java.util.List;

/**
 * Answer to a status query: whether the simulation runs, plus one entry per
 * role in {@link Role} order.
 */
public record SimulationStatus(boolean running, List<RoleStatus> roles, int alertCount) {
    public SimulationStatus {
        roles = List.copyOf(roles);
    }

    public RoleStatus role(Role role) {
        for (RoleStatus r : roles) {
            if (r.role() == role) {
                return r;
            }
        }
        throw new IllegalArgumentException("No status for role " + role);
    }
}
