package io.postscheduler.utils;

import io.postscheduler.core.Recurrence;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RecurrenceEngineTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 1, 1, 10, 0);

    @Test
    void nextOccurrenceShouldFollowPolicy() {
        assertEquals(LocalDateTime.of(2025, 1, 2, 10, 0), RecurrenceEngine.nextOccurrence(BASE, Recurrence.DAILY));
        assertEquals(LocalDateTime.of(2025, 1, 8, 10, 0), RecurrenceEngine.nextOccurrence(BASE, "weekly"));
        assertNull(RecurrenceEngine.nextOccurrence(BASE, Recurrence.NONE));
    }

    @Test
    void nullPolicyShouldNotRepeat() {
        assertNull(RecurrenceEngine.nextOccurrence(BASE, (Recurrence) null));
    }

    @Test
    void malformedStoredValueShouldBeTreatedAsNone() {
        assertEquals(Recurrence.NONE, RecurrenceEngine.parseOrNone("every other tuesday", "job-1"));
        assertNull(RecurrenceEngine.nextOccurrence(BASE, "fortnightly"));
    }
}
