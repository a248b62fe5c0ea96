package io.postscheduler.core;

import java.time.LocalDateTime;

/**
 * Outcome of one poll cycle.
 *
 * swept   : stale running jobs moved to failed
 * due     : jobs returned by the due query
 * skipped : due jobs left alone (raced, or their profile was still busy)
 * aborted : the cycle stopped early because the store failed
 */
public record CycleSummary(
        long cycle,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        int swept,
        int due,
        int completed,
        int failed,
        int skipped,
        boolean aborted,
        String abortReason
) {
}
