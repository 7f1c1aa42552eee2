package com.questrail.mitm.attack;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of transformation policies the relay can apply.
 *
 * <p>Each mode's behavior lives in {@link AttackPolicy#decide()}; modes share
 * nothing beyond "consume a frame, decide what happens to it".</p>
 */
public enum AttackMode
{
    /** Forward immediately, unmodified. Control condition. */
    TRANSPARENT("transparent"),

    /** Forward after an independent uniform delay per frame. */
    RANDOM_DELAY("random_delay"),

    /** Discard each frame with a fixed probability. */
    DROP("drop"),

    /** Hold frames in a bounded buffer and release them out of arrival order. */
    REORDER("reorder");

    /** Names from an older, incompatible vocabulary. Never mapped. */
    private static final Set<String> SUPERSEDED = Set.of("modify", "replay", "delay");

    private final String wireName;

    AttackMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a configured mode name (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown names, including the
     *         superseded {@code modify | replay | delay} vocabulary
     */
    public static AttackMode fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Attack mode must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AttackMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        if (SUPERSEDED.contains(normalized)) {
            throw new IllegalArgumentException("Attack mode '" + name
                    + "' belongs to the superseded modify|replay|delay vocabulary; use one of "
                    + "transparent|random_delay|drop|reorder");
        }
        throw new IllegalArgumentException("Unknown attack mode: " + name);
    }
}
