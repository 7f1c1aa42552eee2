package com.questrail.mitm.status;

/**
 * The three network roles of a simulation session.
 */
public enum Role
{
    SOURCE("source"),
    RELAY("relay"),
    DESTINATION("destination");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
