package io.postscheduler.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStatusTest {

    @Test
    void pendingShouldMoveToRunningOrCancelled() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.FAILED));
    }

    @Test
    void runningShouldOnlyFinish() {
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
    }

    @Test
    void terminalStatesShouldHaveNoOutgoingEdges() {
        for (JobStatus terminal : new JobStatus[]{JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED}) {
            assertTrue(terminal.isTerminal());
            for (JobStatus next : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
    }

    @Test
    void wireValueShouldRoundTrip() {
        assertEquals("cancelled", JobStatus.CANCELLED.value());
        assertEquals(JobStatus.RUNNING, JobStatus.fromValue("running"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue(" "));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue("paused"));
    }
}
