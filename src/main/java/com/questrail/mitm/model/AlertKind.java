package com.questrail.mitm.model;

/**
 * Classification of an anomaly raised by the detection engine.
 */
public enum AlertKind
{
    /** Sequence differs from the expected one (gaps from drops, reordering). */
    OUT_OF_ORDER("out_of_order"),

    /** Sequence was already observed: replay or retransmission. */
    DUPLICATE("duplicate"),

    /** Estimated transit delay exceeds the configured maximum. */
    EXCESSIVE_DELAY("excessive_delay"),

    /** Bytes could not be decoded as a message. */
    MALFORMED("malformed");

    private final String wireName;

    AlertKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used on the produced status/alert surface.
     */
    public String wireName() {
        return wireName;
    }
}
