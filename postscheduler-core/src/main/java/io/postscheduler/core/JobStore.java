package io.postscheduler.core;

import io.postscheduler.exception.JobNotFoundException;
import io.postscheduler.exception.JobStoreException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of scheduled posts.
 *
 * <p>Implementations never cache: each call reads the backing store so that edits made
 * elsewhere (a cancel from the dashboard while a cycle is running) are observed. Every
 * failure to reach the store is reported as {@link JobStoreException}.
 */
public interface JobStore {

    /**
     * Pending jobs with {@code nextRunAt <= before}, earliest first.
     */
    List<ScheduledJob> listDue(LocalDateTime before);

    /**
     * Atomically moves a job from {@code from} to {@code to}.
     *
     * <p>This is a single conditional update keyed on {@code (id, status == from)}, never a
     * read-then-write pair, so two writers racing on the same job see exactly one success.
     * RUNNING stamps startedAt, COMPLETED/FAILED stamp finishedAt, COMPLETED clears the error
     * message and FAILED records it.
     *
     * @return the job as stored after the update
     * @throws JobNotFoundException  if no job with that id currently has status {@code from}
     * @throws IllegalStateException if {@code from -> to} is not an edge of the state machine
     */
    ScheduledJob transition(String id, JobStatus from, JobStatus to, String errorMessage, LocalDateTime at);

    /**
     * Persist a new pending job.
     *
     * @return the assigned id
     */
    String insert(PostJobSpec spec, LocalDateTime createdAt);

    Optional<ScheduledJob> findById(String id);

    /**
     * Jobs matching {@code query}, ordered by nextRunAt ascending.
     */
    List<ScheduledJob> findAll(JobQuery query);

    /**
     * Earliest pending job, if any.
     */
    Optional<ScheduledJob> findNextPending();

    /**
     * Hard delete.
     *
     * @return true if a job was removed
     */
    boolean delete(String id);

    /**
     * Explicitly move a pending job to a new time (and optionally a new recurrence).
     * This is the only operation allowed to move nextRunAt backwards. A null {@code recurrence}
     * keeps the current policy.
     *
     * @throws JobNotFoundException if the job does not exist or is not pending
     */
    ScheduledJob reschedule(String id, LocalDateTime scheduledAt, Recurrence recurrence, LocalDateTime at);

    /**
     * Cancel every pending job matching {@code query}.
     */
    CancelResult cancelMatching(JobQuery query, LocalDateTime at);

    /**
     * Crash recovery: move RUNNING jobs whose startedAt is before {@code startedBefore} to FAILED.
     *
     * @return number of jobs swept
     */
    int failStaleRunning(LocalDateTime startedBefore, String errorMessage, LocalDateTime at);

    /**
     * Completed recurring jobs finished at or after {@code finishedSince} that no row references
     * through {@code originJobId}. These are occurrences whose follow-up insert was lost.
     */
    List<ScheduledJob> findMissingFollowUps(LocalDateTime finishedSince);

    Map<JobStatus, Long> countByStatus();

    /**
     * Pending jobs with {@code from <= nextRunAt <= to}.
     */
    long countPendingBetween(LocalDateTime from, LocalDateTime to);

    /**
     * Store-side clock, read as a naive local timestamp. Doubles as a connectivity probe.
     */
    LocalDateTime currentTime();
}
