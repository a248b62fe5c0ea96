package io.postscheduler.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.postscheduler.core.SchedulerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the post scheduler.
 */
@ConfigurationProperties(prefix = "postscheduler")
public class PostSchedulerProperties {
    private boolean enabled = true;
    private boolean autoStart = true;
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration dueBuffer = Duration.ofMinutes(2);
    private Duration agentTimeout = Duration.ofMinutes(10);
    private Duration staleRunningThreshold = Duration.ofMinutes(15); // must exceed agentTimeout
    private Duration pauseBetweenJobs = Duration.ofSeconds(5);
    private Duration clockSkewWarning = Duration.ofSeconds(30);
    private Path stopSignalFile;
    private boolean ensureIndexesOnStartup = false;
    private final Agent agent = new Agent();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getDueBuffer() {
        return dueBuffer;
    }

    public void setDueBuffer(Duration dueBuffer) {
        this.dueBuffer = dueBuffer;
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public Duration getStaleRunningThreshold() {
        return staleRunningThreshold;
    }

    public void setStaleRunningThreshold(Duration staleRunningThreshold) {
        this.staleRunningThreshold = staleRunningThreshold;
    }

    public Duration getPauseBetweenJobs() {
        return pauseBetweenJobs;
    }

    public void setPauseBetweenJobs(Duration pauseBetweenJobs) {
        this.pauseBetweenJobs = pauseBetweenJobs;
    }

    public Duration getClockSkewWarning() {
        return clockSkewWarning;
    }

    public void setClockSkewWarning(Duration clockSkewWarning) {
        this.clockSkewWarning = clockSkewWarning;
    }

    public Path getStopSignalFile() {
        return stopSignalFile;
    }

    public void setStopSignalFile(Path stopSignalFile) {
        this.stopSignalFile = stopSignalFile;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Agent getAgent() {
        return agent;
    }

    /**
     * Validated loop options. Invalid combinations fail here, at context startup.
     */
    public SchedulerOptions toOptions() {
        return new SchedulerOptions(
                pollInterval,
                dueBuffer,
                agentTimeout,
                staleRunningThreshold,
                pauseBetweenJobs,
                clockSkewWarning,
                stopSignalFile
        );
    }

    /**
     * External process used as the execution agent. Leave {@code command} empty to
     * provide an {@code ExecutionAgent} bean instead.
     */
    public static class Agent {
        private List<String> command = new ArrayList<>();
        private Path workingDirectory;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public Path getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
        }
    }
}
