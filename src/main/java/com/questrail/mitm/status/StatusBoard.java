package com.questrail.mitm.status;

import com.questrail.mitm.model.Alert;
import com.questrail.mitm.observability.ErrorEvent;
import com.questrail.mitm.observability.ObservabilitySink;
import com.questrail.mitm.observability.RoleOutputEvent;
import com.questrail.mitm.observability.RoleStateEvent;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * StatusBoard
 * =============================================================================
 * Read-only status and log surface, fed as an {@link ObservabilitySink}.
 *
 * <p>Keeps the latest {@link RoleStatus} per role and a bounded {@link RoleLog}
 * per role. It has no reference to any engine; the only way in is the sink
 * callbacks, the only way out is {@link #status()} and {@link #logTail}.</p>
 *
 * <p>Debug output is not kept in the tails.</p>
 */
public final class StatusBoard implements ObservabilitySink
{
    private final Map<Role, RoleStatus> statuses = new EnumMap<>(Role.class);
    private final Map<Role, RoleLog> logs = new EnumMap<>(Role.class);
    private final AtomicInteger alertCount = new AtomicInteger();

    private volatile boolean running;

    public StatusBoard(int logCapacity)
    {
        for (Role role : Role.values()) {
            statuses.put(role, new RoleStatus(role, RoleState.STOPPED, "not started"));
            logs.put(role, new RoleLog(logCapacity));
        }
    }

    /**
     * Set by the runtime around start and stop.
     */
    public void setRunning(boolean value)
    {
        this.running = value;
    }

    public SimulationStatus status()
    {
        List<RoleStatus> roles = new ArrayList<>(statuses.size());
        synchronized (statuses) {
            for (Role role : Role.values()) {
                roles.add(statuses.get(role));
            }
        }
        return new SimulationStatus(running, roles, alertCount.get());
    }

    public List<String> logTail(Role role, int count)
    {
        return logs.get(role).tail(count);
    }

    @Override
    public void onRoleState(RoleStateEvent event)
    {
        synchronized (statuses) {
            statuses.put(event.role(), new RoleStatus(event.role(), event.state(), event.status()));
        }
    }

    @Override
    public void onRoleOutput(RoleOutputEvent event)
    {
        switch (event.severity()) {
            case DEBUG -> { }
            case INFO -> logs.get(event.role()).append(event.line());
            case WARN, ERROR -> logs.get(event.role()).append("[" + event.severity() + "] " + event.line());
        }
    }

    @Override
    public void onAlert(Alert alert)
    {
        alertCount.incrementAndGet();
        logs.get(Role.DESTINATION).append("[ALERT] " + alert.summary());
    }

    @Override
    public void onError(ErrorEvent event)
    {
        String cause = event.cause() == null ? "" : ": " + event.cause();
        logs.get(event.role()).append("[ERROR] " + event.message() + cause);
    }
}
