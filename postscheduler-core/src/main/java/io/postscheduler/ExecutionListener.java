package io.postscheduler;

import io.postscheduler.core.ScheduledJob;

/**
 * Callbacks fired after an outcome has been written to the store, e.g. to record upload history.
 * A listener that throws is logged and ignored; it never changes the job outcome.
 */
public interface ExecutionListener {

    default void onCompleted(ScheduledJob job) {
    }

    default void onFailed(ScheduledJob job) {
    }

    /**
     * A recurring job completed and its next occurrence was inserted.
     */
    default void onRescheduled(ScheduledJob completed, String followUpId) {
    }
}
