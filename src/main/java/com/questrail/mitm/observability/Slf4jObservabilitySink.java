package com.questrail.mitm.observability;

import com.questrail.mitm.model.Alert;
import com.questrail.mitm.status.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Production implementation of ObservabilitySink that emits logs via SLF4J.
 *
 * <p>Each role logs under its own logger ({@code mitm.source},
 * {@code mitm.relay}, {@code mitm.destination}) so output can be routed or
 * filtered per role.</p>
 */
public final class Slf4jObservabilitySink implements ObservabilitySink {
    private final Map<Role, Logger> loggers = new EnumMap<>(Role.class);

    public Slf4jObservabilitySink() {
        for (Role role : Role.values()) {
            loggers.put(role, LoggerFactory.getLogger("mitm." + role.wireName()));
        }
    }

    @Override
    public void onRoleState(RoleStateEvent event) {
        loggers.get(event.role()).info("State {}: {}", event.state().wireName(), event.status());
    }

    @Override
    public void onRoleOutput(RoleOutputEvent event) {
        Logger log = loggers.get(event.role());
        switch (event.severity()) {
            case DEBUG -> log.debug("{}", event.line());
            case INFO -> log.info("{}", event.line());
            case WARN -> log.warn("{}", event.line());
            case ERROR -> log.error("{}", event.line());
        }
    }

    @Override
    public void onAlert(Alert alert) {
        loggers.get(Role.DESTINATION).warn("[ALERT] {}", alert.summary());
    }

    @Override
    public void onError(ErrorEvent event) {
        loggers.get(event.role()).error("{}", event.message(), event.cause());
    }
}
