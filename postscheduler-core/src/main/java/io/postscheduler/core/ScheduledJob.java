package io.postscheduler.core;

import java.time.LocalDateTime;

/**
 * Persisted scheduled post as read from the store.
 *
 * <p>The profile fields are a snapshot taken when the post was scheduled, so the job stays
 * executable if the source profile is later edited or deleted. All timestamps are naive
 * local wall-clock values.
 */
public record ScheduledJob(

        // identity
        String id,
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

        // execution state
        JobStatus status,
        String errorMessage,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,

        // lineage
        String originJobId,

        // bookkeeping
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    /**
     * True when the job is pending and its next run falls at or before {@code cutoff}.
     */
    public boolean isDue(LocalDateTime cutoff) {
        return status == JobStatus.PENDING
                && nextRunAt != null
                && !nextRunAt.isAfter(cutoff);
    }

    public JobSummary summary() {
        return new JobSummary(id, listingRef, profileRef, profileDisplayName, nextRunAt, recurrence, status);
    }

    /**
     * Spec of the next occurrence of this job, starting at {@code nextRunAt}.
     * The profile snapshot is carried over unchanged.
     */
    public PostJobSpec followUp(LocalDateTime nextRunAt) {
        return new PostJobSpec(
                listingRef,
                profileRef,
                profileDisplayName,
                profileFolderPath,
                location,
                nextRunAt,
                nextRunAt,
                recurrence,
                id
        );
    }
}
