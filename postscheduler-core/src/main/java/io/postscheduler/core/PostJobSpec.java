package io.postscheduler.core;

import java.time.LocalDateTime;

/**
 * Immutable job definition produced by PostJobBuilder.build() or derived from a finished job.
 * This is a pure data object with no persistence logic; the store assigns id and status.
 */
public record PostJobSpec(

        // identity
        String listingRef,
        String profileRef,

        // profile snapshot
        String profileDisplayName,
        String profileFolderPath,
        String location,

        // scheduling
        LocalDateTime scheduledAt,
        LocalDateTime nextRunAt,
        Recurrence recurrence,

        // lineage, null for a fresh request
        String originJobId
) {
}
