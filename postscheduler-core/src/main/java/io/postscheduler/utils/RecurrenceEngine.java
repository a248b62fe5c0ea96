package io.postscheduler.utils;

import io.postscheduler.core.Recurrence;
import io.postscheduler.exception.RecurrenceConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

/**
 * Computes follow-up run times for recurring posts.
 *
 * <p>The base is the occurrence's own nextRunAt, not the time the run finished, so a
 * daily post stays at the same wall-clock time no matter how long the agent took.
 */
public final class RecurrenceEngine {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceEngine.class);

    private RecurrenceEngine() {
    }

    /**
     * @param base   nextRunAt of the occurrence that just ran
     * @param policy recurrence policy; null is treated as {@link Recurrence#NONE}
     * @return next run time, or {@code null} when the policy does not repeat
     */
    public static LocalDateTime nextOccurrence(LocalDateTime base, Recurrence policy) {
        if (policy == null) {
            return null;
        }
        return policy.nextOccurrence(base);
    }

    /**
     * Same as {@link #nextOccurrence(LocalDateTime, Recurrence)} for a raw stored value.
     * Unknown values fall back to no recurrence.
     */
    public static LocalDateTime nextOccurrence(LocalDateTime base, String policy) {
        return nextOccurrence(base, parseOrNone(policy, null));
    }

    /**
     * Lenient parse for values read back from the store: an unknown policy is logged and treated
     * as {@link Recurrence#NONE}, so an unschedulable job is never rescheduled.
     *
     * @param jobId only used for the log line; may be null
     */
    public static Recurrence parseOrNone(String value, String jobId) {
        try {
            return Recurrence.fromValue(value);
        } catch (RecurrenceConfigException e) {
            log.warn("invalid recurrence on stored job; treating as none jobId={} value={}", jobId, value);
            return Recurrence.NONE;
        }
    }
}
