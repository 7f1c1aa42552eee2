package com.questrail.mitm.observability;

import com.questrail.mitm.model.Alert;

import java.util.List;
import java.util.Objects;

/**
 * Fans every callback out to a fixed list of sinks, in list order.
 */
public final class CompositeObservabilitySink implements ObservabilitySink {
    private final List<ObservabilitySink> sinks;

    public CompositeObservabilitySink(List<ObservabilitySink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    public static ObservabilitySink of(ObservabilitySink... sinks) {
        return new CompositeObservabilitySink(List.of(sinks));
    }

    @Override
    public void onRoleState(RoleStateEvent event) {
        for (ObservabilitySink sink : sinks) {
            sink.onRoleState(event);
        }
    }

    @Override
    public void onRoleOutput(RoleOutputEvent event) {
        for (ObservabilitySink sink : sinks) {
            sink.onRoleOutput(event);
        }
    }

    @Override
    public void onAlert(Alert alert) {
        for (ObservabilitySink sink : sinks) {
            sink.onAlert(alert);
        }
    }

    @Override
    public void onError(ErrorEvent event) {
        for (ObservabilitySink sink : sinks) {
            sink.onError(event);
        }
    }
}
