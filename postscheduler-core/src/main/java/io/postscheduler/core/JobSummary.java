package io.postscheduler.core;

import java.time.LocalDateTime;

public record JobSummary(
        String id,
        String listingRef,
        String profileRef,
        String profileDisplayName,
        LocalDateTime nextRunAt,
        Recurrence recurrence,
        JobStatus status
) {
}
