package io.postscheduler.core;

import java.util.Map;

/**
 * Per-status counts plus the number of pending posts due within the next seven days.
 */
public record ScheduleStats(
        Map<JobStatus, Long> countsByStatus,
        long total,
        long upcomingSevenDays
) {
    public long count(JobStatus status) {
        return countsByStatus.getOrDefault(status, 0L);
    }
}
