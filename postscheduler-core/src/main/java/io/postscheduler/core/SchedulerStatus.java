package io.postscheduler.core;

import java.time.LocalDateTime;

/**
 * Snapshot returned by start/stop/status.
 *
 * <p>{@code nextDue} is the earliest pending job according to the store, or null when there is
 * none or the lookup failed (in which case {@code error} carries the reason).
 */
public record SchedulerStatus(
        LoopState state,
        LocalDateTime lastCycleAt,
        CycleSummary lastCycle,
        JobSummary nextDue,
        String error
) {
    public boolean running() {
        return state == LoopState.RUNNING;
    }
}
