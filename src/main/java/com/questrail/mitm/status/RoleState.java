package com.questrail.mitm.status;

/**
 * Coarse lifecycle state of a role as seen from outside.
 *
 * <p>{@link #STOPPED} means the role ended because it was asked to;
 * {@link #ERROR} means it ended, or lost a session, unexpectedly.</p>
 */
public enum RoleState
{
    RUNNING("running"),
    STOPPED("stopped"),
    ERROR("error");

    private final String wireName;

    RoleState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
