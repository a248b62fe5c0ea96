package io.postscheduler.core;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Diagnostic view of a single job.
 *
 * secondsUntilDue : negative when overdue
 * problems        : snapshot fields the execution agent would reject
 */
public record JobDiagnostic(
        String id,
        JobStatus status,
        String listingRef,
        String profileDisplayName,
        LocalDateTime nextRunAt,
        Recurrence recurrence,
        boolean due,
        Long secondsUntilDue,
        List<String> problems
) {
}
