package io.postscheduler.core;

import java.time.LocalDateTime;

/**
 * JobQuery describes which jobs to list or cancel.
 *
 * <p>This is an API-layer object (NOT a MongoDB query). The store layer translates it
 * into an actual database query. An empty query matches every job.
 */
public final class JobQuery {

    private static final JobQuery ALL = new JobQuery(null, null, null, null);

    private final JobStatus status;
    private final String listingRef;
    private final String profileRef;
    private final LocalDateTime nextRunFrom;

    private JobQuery(JobStatus status, String listingRef, String profileRef, LocalDateTime nextRunFrom) {
        this.status = status;
        this.listingRef = (listingRef == null || listingRef.isBlank()) ? null : listingRef;
        this.profileRef = (profileRef == null || profileRef.isBlank()) ? null : profileRef;
        this.nextRunFrom = nextRunFrom;
    }

    public static JobQuery all() {
        return ALL;
    }

    public JobStatus status() {
        return status;
    }

    public String listingRef() {
        return listingRef;
    }

    public String profileRef() {
        return profileRef;
    }

    /**
     * Lower bound (inclusive) on nextRunAt, used by the dashboard's "upcoming" filter.
     */
    public LocalDateTime nextRunFrom() {
        return nextRunFrom;
    }

    public boolean isEmpty() {
        return status == null
                && listingRef == null
                && profileRef == null
                && nextRunFrom == null;
    }

    public boolean matches(ScheduledJob job) {
        if (status != null && job.status() != status) {
            return false;
        }
        if (listingRef != null && !listingRef.equals(job.listingRef())) {
            return false;
        }
        if (profileRef != null && !profileRef.equals(job.profileRef())) {
            return false;
        }
        return nextRunFrom == null
                || (job.nextRunAt() != null && !job.nextRunAt().isBefore(nextRunFrom));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private JobStatus status;
        private String listingRef;
        private String profileRef;
        private LocalDateTime nextRunFrom;

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder listingRef(String listingRef) {
            this.listingRef = listingRef;
            return this;
        }

        public Builder profileRef(String profileRef) {
            this.profileRef = profileRef;
            return this;
        }

        /**
         * Pending jobs whose next run is at or after {@code from}.
         */
        public Builder upcoming(LocalDateTime from) {
            this.status = JobStatus.PENDING;
            this.nextRunFrom = from;
            return this;
        }

        public JobQuery build() {
            return new JobQuery(status, listingRef, profileRef, nextRunFrom);
        }
    }

    @Override
    public String toString() {
        return "JobQuery{status=" + status + ", listingRef=" + listingRef + ", profileRef=" + profileRef
                + ", nextRunFrom=" + nextRunFrom + "}";
    }
}
