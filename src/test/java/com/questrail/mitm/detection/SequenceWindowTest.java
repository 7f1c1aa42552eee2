package com.questrail.mitm.detection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SequenceWindowTest {

    @Test
    void remembersRecordedSequences() {
        SequenceWindow w = new SequenceWindow(8);
        w.record(1);
        w.record(2);

        assertTrue(w.contains(1));
        assertTrue(w.contains(2));
        assertFalse(w.contains(3));
        assertFalse(w.contains(0), "Empty slots must not match sequence 0");
    }

    @Test
    void oldestEntriesAreEvictedOnceCapacityIsExceeded() {
        SequenceWindow w = new SequenceWindow(4);
        for (long s = 1; s <= 6; s++) {
            w.record(s);
        }

        // 1 and 2 shared slots with 5 and 6.
        assertFalse(w.contains(1));
        assertFalse(w.contains(2));
        for (long s = 3; s <= 6; s++) {
            assertTrue(w.contains(s), "seq " + s);
        }
    }

    @Test
    void lateOldSequenceDoesNotEvictNewerEntry() {
        SequenceWindow w = new SequenceWindow(4);
        w.record(9);
        w.record(5);

        assertTrue(w.contains(9));
        assertFalse(w.contains(5));
    }

    @Test
    void memoryStaysBoundedForLongSessions() {
        SequenceWindow w = new SequenceWindow(16);
        for (long s = 1; s <= 1_000_000; s++) {
            w.record(s);
        }
        assertEquals(16, w.capacity());
        assertTrue(w.contains(1_000_000));
        assertFalse(w.contains(1));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SequenceWindow(0));
    }
}
