package io.postscheduler;

import io.postscheduler.core.CancelResult;
import io.postscheduler.core.CycleSummary;
import io.postscheduler.core.DiagnosticReport;
import io.postscheduler.core.JobQuery;
import io.postscheduler.core.Recurrence;
import io.postscheduler.core.ScheduleStats;
import io.postscheduler.core.ScheduledJob;
import io.postscheduler.core.SchedulerStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API: control surface of the polling loop plus job management for the dashboard.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.schedule("listing-42", new PostJobBuilder.Profile("p-7", "Dealer A", "profiles/dealer-a", "Austin, TX"))
 *          .at(LocalDateTime.of(2026, 1, 20, 9, 30))
 *          .recurrence(Recurrence.WEEKLY)
 *          .save();
 *
 * scheduler.stop();
 * }</pre>
 */
public interface PostScheduler {

    /**
     * Start the polling loop. Idempotent: returns the current status if already running.
     */
    SchedulerStatus start();

    /**
     * Ask the loop to exit after the job in flight. Idempotent and non-blocking.
     */
    SchedulerStatus stop();

    /**
     * Wait until the loop thread has exited.
     *
     * @return true if the loop is stopped
     */
    boolean awaitStopped(Duration timeout) throws InterruptedException;

    SchedulerStatus status();

    /**
     * Run a single poll cycle on the calling thread.
     */
    CycleSummary runCycle();

    /**
     * Read-only report on store connectivity, every job's due state, and clock issues.
     */
    DiagnosticReport runDiagnostic();

    PostJobBuilder schedule(String listingRef, PostJobBuilder.Profile profile);

    Optional<ScheduledJob> get(String id);

    List<ScheduledJob> list(JobQuery query);

    /**
     * Cancel a pending job.
     *
     * @throws io.postscheduler.exception.JobNotFoundException if it does not exist or is not pending
     */
    ScheduledJob cancel(String id);

    CancelResult cancel(JobQuery query);

    boolean delete(String id);

    ScheduledJob reschedule(String id, LocalDateTime time, Recurrence recurrence);

    /**
     * Queue a new pending copy of a failed or cancelled job.
     *
     * @return id of the new job
     */
    String retry(String id, LocalDateTime time);

    ScheduleStats stats();
}
