package com.questrail.mitm.observability;

import com.questrail.mitm.internal.time.WallClock;
import com.questrail.mitm.status.Role;
import com.questrail.mitm.status.RoleState;

import java.util.Objects;

/**
 * Binds an {@link ObservabilitySink} to one role and a wall clock, so role code
 * reports with a single call instead of building events by hand.
 */
public final class RoleReporter {
    private final Role role;
    private final ObservabilitySink sink;
    private final WallClock wallClock;

    public RoleReporter(Role role, ObservabilitySink sink, WallClock wallClock) {
        this.role = Objects.requireNonNull(role, "role");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public Role role() {
        return role;
    }

    public ObservabilitySink sink() {
        return sink;
    }

    public void state(RoleState state, String status) {
        sink.onRoleState(new RoleStateEvent(wallClock.now(), role, state, status));
    }

    public void debug(String line) {
        output(RoleOutputEvent.Severity.DEBUG, line);
    }

    public void info(String line) {
        output(RoleOutputEvent.Severity.INFO, line);
    }

    public void warn(String line) {
        output(RoleOutputEvent.Severity.WARN, line);
    }

    public void error(String message, Throwable cause) {
        sink.onError(new ErrorEvent(wallClock.now(), role, message, cause));
    }

    private void output(RoleOutputEvent.Severity severity, String line) {
        sink.onRoleOutput(new RoleOutputEvent(wallClock.now(), role, severity, line));
    }
}
