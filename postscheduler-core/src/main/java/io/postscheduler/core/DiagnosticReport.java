package io.postscheduler.core;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only health report produced by {@code PostScheduler.runDiagnostic()}.
 */
public record DiagnosticReport(
        LocalDateTime generatedAt,
        LocalDateTime dueCutoff,
        LoopState loopState,
        boolean storeReachable,
        String storeError,
        LocalDateTime storeTime,
        List<JobDiagnostic> jobs,
        List<String> warnings
) {
    public long dueCount() {
        return jobs.stream().filter(JobDiagnostic::due).count();
    }
}
