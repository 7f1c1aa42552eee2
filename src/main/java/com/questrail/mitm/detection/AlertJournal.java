package com.questrail.mitm.detection;

import com.questrail.mitm.model.Alert;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of every alert emitted in a session.
 *
 * <p>{@link #all()} returns everything since the session started;
 * {@link #pollNew()} returns what was appended since the previous poll. Both
 * return copies and are safe to call while alerts are being appended.</p>
 */
public final class AlertJournal
{
    private final List<Alert> alerts = new ArrayList<>();
    private int polledUpTo;

    public synchronized void append(Alert alert)
    {
        alerts.add(alert);
    }

    public synchronized List<Alert> all()
    {
        return List.copyOf(alerts);
    }

    public synchronized List<Alert> pollNew()
    {
        List<Alert> fresh = List.copyOf(alerts.subList(polledUpTo, alerts.size()));
        polledUpTo = alerts.size();
        return fresh;
    }

    public synchronized int size()
    {
        return alerts.size();
    }
}
