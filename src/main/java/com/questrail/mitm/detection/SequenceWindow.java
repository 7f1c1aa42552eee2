package com.questrail.mitm.detection;

import java.util.Arrays;

/**
 * Fixed-capacity memory of recently seen sequence numbers.
 *
 * <p>Sequence {@code s} lives in slot {@code s % capacity}. Recording a
 * sequence overwrites whatever older sequence shared its slot, so the window
 * never grows and a sequence is forgotten once a number {@code capacity}
 * higher has been recorded. Forgotten sequences can no longer be recognized
 * as replays.</p>
 *
 * <p>Not thread-safe.</p>
 */
final class SequenceWindow
{
    private static final long EMPTY = -1L;

    private final long[] slots;

    SequenceWindow(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.slots = new long[capacity];
        Arrays.fill(slots, EMPTY);
    }

    boolean contains(long sequence)
    {
        return slots[slot(sequence)] == sequence;
    }

    /**
     * Remember {@code sequence}. A sequence older than the one already in its
     * slot is not recorded: the newer entry wins.
     */
    void record(long sequence)
    {
        int i = slot(sequence);
        if (slots[i] == EMPTY || slots[i] < sequence) {
            slots[i] = sequence;
        }
    }

    int capacity()
    {
        return slots.length;
    }

    private int slot(long sequence)
    {
        return (int) (sequence % slots.length);
    }
}
