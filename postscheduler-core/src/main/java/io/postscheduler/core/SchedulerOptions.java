package io.postscheduler.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of the scheduler loop.
 *
 * <ul>
 *   <li>pollInterval: sleep between cycles</li>
 *   <li>dueBuffer: lookahead added to "now" when selecting due jobs</li>
 *   <li>agentTimeout: upper bound of one execution agent call</li>
 *   <li>staleRunningThreshold: running jobs older than this are swept to failed</li>
 *   <li>pauseBetweenJobs: gap between two posts of the same cycle (zero allowed)</li>
 *   <li>clockSkewWarning: store/local clock difference reported by diagnostics</li>
 *   <li>stopSignalFile: optional sentinel file; its presence stops the loop</li>
 * </ul>
 */
public record SchedulerOptions(
        Duration pollInterval,
        Duration dueBuffer,
        Duration agentTimeout,
        Duration staleRunningThreshold,
        Duration pauseBetweenJobs,
        Duration clockSkewWarning,
        Path stopSignalFile
) {

    public SchedulerOptions {
        requirePositive(pollInterval, "pollInterval");
        requirePositive(agentTimeout, "agentTimeout");
        requirePositive(staleRunningThreshold, "staleRunningThreshold");
        requirePositive(clockSkewWarning, "clockSkewWarning");
        Objects.requireNonNull(dueBuffer, "dueBuffer must not be null");
        Objects.requireNonNull(pauseBetweenJobs, "pauseBetweenJobs must not be null");
        if (dueBuffer.isNegative()) {
            throw new IllegalArgumentException("dueBuffer must not be negative");
        }
        if (pauseBetweenJobs.isNegative()) {
            throw new IllegalArgumentException("pauseBetweenJobs must not be negative");
        }
        if (staleRunningThreshold.compareTo(agentTimeout) <= 0) {
            throw new IllegalArgumentException(
                    "staleRunningThreshold must be longer than agentTimeout, otherwise live jobs get swept");
        }
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(
                Duration.ofSeconds(60),
                Duration.ofMinutes(2),
                Duration.ofMinutes(10),
                Duration.ofMinutes(15),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                null
        );
    }

    public SchedulerOptions withPollInterval(Duration value) {
        return new SchedulerOptions(value, dueBuffer, agentTimeout, staleRunningThreshold, pauseBetweenJobs,
                clockSkewWarning, stopSignalFile);
    }

    public SchedulerOptions withAgentTimeout(Duration value) {
        return new SchedulerOptions(pollInterval, dueBuffer, value, staleRunningThreshold, pauseBetweenJobs,
                clockSkewWarning, stopSignalFile);
    }

    public SchedulerOptions withStaleRunningThreshold(Duration value) {
        return new SchedulerOptions(pollInterval, dueBuffer, agentTimeout, value, pauseBetweenJobs,
                clockSkewWarning, stopSignalFile);
    }

    public SchedulerOptions withPauseBetweenJobs(Duration value) {
        return new SchedulerOptions(pollInterval, dueBuffer, agentTimeout, staleRunningThreshold, value,
                clockSkewWarning, stopSignalFile);
    }

    public SchedulerOptions withStopSignalFile(Path value) {
        return new SchedulerOptions(pollInterval, dueBuffer, agentTimeout, staleRunningThreshold, pauseBetweenJobs,
                clockSkewWarning, value);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
