package com.questrail.mitm.observability;

import com.questrail.mitm.model.Alert;

/**
 * Receives everything the roles report about themselves.
 * Implementations can provide logging, status tracking or test recording.
 *
 * <p>Callbacks may arrive concurrently from different roles and from timer
 * threads; implementations must be thread-safe.</p>
 */
public interface ObservabilitySink {
    /**
     * Called when a role changes lifecycle state or status text.
     */
    void onRoleState(RoleStateEvent event);

    /**
     * Called for each line of textual output a role produces.
     */
    void onRoleOutput(RoleOutputEvent event);

    /**
     * Called when the detection engine emits an alert.
     */
    void onAlert(Alert alert);

    /**
     * Called when an error occurs inside a role.
     */
    void onError(ErrorEvent event);
}
