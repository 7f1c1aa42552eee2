package com.questrail.mitm.status;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded, append-only output of one role.
 *
 * <p>Holds at most {@code capacity} lines; appending beyond that evicts the
 * oldest. Appends and tail reads may run concurrently.</p>
 */
public final class RoleLog
{
    private final int capacity;
    private final ArrayDeque<String> lines;

    public RoleLog(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void append(String line)
    {
        if (lines.size() == capacity) {
            lines.pollFirst();
        }
        lines.addLast(line);
    }

    /**
     * The most recent {@code count} lines, oldest first.
     */
    public synchronized List<String> tail(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        if (count == 0 || lines.isEmpty()) {
            return Collections.emptyList();
        }
        int skip = Math.max(0, lines.size() - count);
        List<String> out = new ArrayList<>(lines.size() - skip);
        int i = 0;
        for (String line : lines) {
            if (i++ >= skip) {
                out.add(line);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public synchronized int size()
    {
        return lines.size();
    }

    public int capacity()
    {
        return capacity;
    }
}
