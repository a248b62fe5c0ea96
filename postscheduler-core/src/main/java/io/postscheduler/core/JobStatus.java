package io.postscheduler.core;

import java.util.Locale;

/**
 * Lifecycle of one scheduled occurrence.
 *
 * <pre>
 * PENDING -> RUNNING -> COMPLETED | FAILED
 * PENDING -> CANCELLED
 * </pre>
 * A recurring job re-enters PENDING as a new row after COMPLETED.
 */
public enum JobStatus {
    PENDING {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == RUNNING || next == CANCELLED;
        }
    },
    RUNNING {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == COMPLETED || next == FAILED;
        }
    },
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Terminal states have no outgoing edges.
     */
    public boolean canTransitionTo(JobStatus next) {
        return false;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Lower-case wire value used by the dashboard ("pending", "running", ...).
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
