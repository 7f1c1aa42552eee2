package com.questrail.mitm.detection;

/**
 * Detection state for one source identity. Mutated only while holding its
 * own monitor, so one identity is classified in strict arrival order.
 */
final class ConnectionState
{
    private final SequenceWindow seen;
    private long expectedSequence;
    private long messagesObserved;

    ConnectionState(long initialSequence, int replayWindow)
    {
        this.expectedSequence = initialSequence;
        this.seen = new SequenceWindow(replayWindow);
    }

    long expectedSequence()
    {
        return expectedSequence;
    }

    long messagesObserved()
    {
        return messagesObserved;
    }

    boolean isDuplicate(long sequence)
    {
        return seen.contains(sequence);
    }

    /**
     * Record a non-duplicate sequence and move the expectation past it. The
     * expectation never moves backwards, so a gap left by a lost message does
     * not flag every later message.
     */
    void accept(long sequence)
    {
        seen.record(sequence);
        messagesObserved++;
        if (sequence >= expectedSequence) {
            expectedSequence = sequence + 1;
        }
    }

    void countDuplicate()
    {
        messagesObserved++;
    }
}
