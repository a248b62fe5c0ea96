package io.postscheduler.internal;

import io.postscheduler.core.CycleSummary;
import io.postscheduler.core.JobStatus;
import io.postscheduler.core.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

/**
 * Append-only execution log: one line per cycle boundary, transition, sweep, skip or error.
 *
 * <p>Written to the dedicated logger {@value #LOGGER_NAME} so it can be routed to its own
 * file appender; the logging backend supplies the timestamp.
 */
final class ExecutionLog {

    static final String LOGGER_NAME = "io.postscheduler.execution";

    private final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    void cycleStarted(long cycle, LocalDateTime now, LocalDateTime cutoff) {
        log.info("event=cycle-start cycle={} now={} dueCutoff={}", cycle, now, cutoff);
    }

    void cycleFinished(CycleSummary s) {
        if (s.aborted()) {
            log.warn("event=cycle-end cycle={} aborted=true reason=\"{}\" swept={} due={} completed={} failed={} skipped={}",
                    s.cycle(), s.abortReason(), s.swept(), s.due(), s.completed(), s.failed(), s.skipped());
            return;
        }
        log.info("event=cycle-end cycle={} swept={} due={} completed={} failed={} skipped={}",
                s.cycle(), s.swept(), s.due(), s.completed(), s.failed(), s.skipped());
    }

    void transition(ScheduledJob job, JobStatus from, JobStatus to, String detail) {
        if (detail == null) {
            log.info("event=transition job={} listing={} profile={} from={} to={}",
                    job.id(), job.listingRef(), job.profileRef(), from.value(), to.value());
        } else {
            log.info("event=transition job={} listing={} profile={} from={} to={} detail=\"{}\"",
                    job.id(), job.listingRef(), job.profileRef(), from.value(), to.value(), detail);
        }
    }

    void rescheduled(ScheduledJob job, String followUpId, LocalDateTime nextRunAt) {
        log.info("event=reschedule job={} followUp={} recurrence={} nextRunAt={}",
                job.id(), followUpId, job.recurrence().value(), nextRunAt);
    }

    void swept(int count, LocalDateTime startedBefore) {
        log.warn("event=sweep count={} startedBefore={}", count, startedBefore);
    }

    void skipped(ScheduledJob job, String reason) {
        log.info("event=skip job={} profile={} reason={}", job.id(), job.profileRef(), reason);
    }

    void error(String stage, String jobId, Throwable e) {
        log.error("event=error stage={} job={} msg=\"{}\"", stage, jobId, e.getMessage());
    }
}
