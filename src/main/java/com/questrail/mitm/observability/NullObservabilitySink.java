package com.questrail.mitm.observability;

import com.questrail.mitm.model.Alert;

/**
 * No-op implementation of ObservabilitySink.
 */
public final class NullObservabilitySink implements ObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRoleState(RoleStateEvent event) {}

    @Override
    public void onRoleOutput(RoleOutputEvent event) {}

    @Override
    public void onAlert(Alert alert) {}

    @Override
    public void onError(ErrorEvent event) {}
}
