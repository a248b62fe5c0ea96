package io.postscheduler.internal;

import io.postscheduler.ExecutionAgent;
import io.postscheduler.ExecutionListener;
import io.postscheduler.PostJobBuilder;
import io.postscheduler.PostScheduler;
import io.postscheduler.core.AgentRequest;
import io.postscheduler.core.AgentResult;
import io.postscheduler.core.CancelResult;
import io.postscheduler.core.CycleSummary;
import io.postscheduler.core.DiagnosticReport;
import io.postscheduler.core.JobDiagnostic;
import io.postscheduler.core.JobQuery;
import io.postscheduler.core.JobStatus;
import io.postscheduler.core.JobStore;
import io.postscheduler.core.JobSummary;
import io.postscheduler.core.LoopState;
import io.postscheduler.core.PostJobSpec;
import io.postscheduler.core.Recurrence;
import io.postscheduler.core.ScheduleStats;
import io.postscheduler.core.ScheduledJob;
import io.postscheduler.core.SchedulerOptions;
import io.postscheduler.core.SchedulerStatus;
import io.postscheduler.exception.AgentExecutionException;
import io.postscheduler.exception.JobNotFoundException;
import io.postscheduler.exception.JobStoreException;
import io.postscheduler.exception.JobValidationException;
import io.postscheduler.utils.RecurrenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Polling scheduler that hands due posts to an {@link ExecutionAgent}.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>One loop thread per instance; due jobs of a cycle run one after another, earliest first</li>
 *   <li>The PENDING -> RUNNING store transition is the claim: a job another writer already moved is skipped</li>
 *   <li>Each agent call is bounded by {@code agentTimeout}; a timeout is a failure, not a hang</li>
 *   <li>RUNNING jobs older than {@code staleRunningThreshold} are swept to FAILED at the start of every cycle</li>
 *   <li>Failed occurrences are never rescheduled; completed recurring ones get exactly one follow-up row</li>
 * </ul>
 *
 * <p>All state shared with the rest of the application lives in the {@link JobStore}. Instances are
 * independent of each other, so several can coexist (e.g. in tests).
 */
public class DefaultPostScheduler implements PostScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultPostScheduler.class);

    static final int MAX_ERROR_MESSAGE = 500;
    private static final Duration UPCOMING_WINDOW = Duration.ofDays(7);
    private static final int HEARTBEAT_EVERY = 10;
    // completed recurring jobs this recent are checked for a lost follow-up
    static final Duration FOLLOW_UP_REPAIR_WINDOW = Duration.ofDays(1);

    private final SchedulerOptions options;
    private final JobStore store;
    private final ExecutionAgent agent;
    private final List<ExecutionListener> listeners;
    private final Clock clock;
    private final ExecutionLog executionLog = new ExecutionLog();

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final AtomicReference<CycleSummary> lastCycle = new AtomicReference<>();

    // profiles with an agent call still alive, including calls that outlived their timeout
    private final Set<String> busyProfiles = ConcurrentHashMap.newKeySet();

    private volatile Thread loopThread;
    private ExecutorService agentPool;

    private enum JobOutcome {
        COMPLETED,
        FAILED,
        SKIPPED
    }

    public DefaultPostScheduler(SchedulerOptions options, JobStore store, ExecutionAgent agent) {
        this(options, store, agent, List.of(), Clock.systemDefaultZone());
    }

    public DefaultPostScheduler(SchedulerOptions options,
                                JobStore store,
                                ExecutionAgent agent,
                                List<ExecutionListener> listeners,
                                Clock clock) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ================= lifecycle ================= */

    @Override
    public SchedulerStatus start() {
        synchronized (lifecycleLock) {
            Thread current = loopThread;
            if (current != null && current.isAlive()) {
                if (stopRequested.get()) {
                    log.info("PostScheduler start ignored; previous loop is still finishing its job");
                }
                return status();
            }

            clearStopSignalFile();
            stopRequested.set(false);
            wakeSignal.drainPermits();

            log.info("PostScheduler starting with pollInterval={}, dueBuffer={}, agentTimeout={}, staleRunningThreshold={}, pauseBetweenJobs={}, stopSignalFile={}",
                    options.pollInterval(),
                    options.dueBuffer(),
                    options.agentTimeout(),
                    options.staleRunningThreshold(),
                    options.pauseBetweenJobs(),
                    options.stopSignalFile());

            Thread t = new Thread(this::loop);
            t.setName("postscheduler.loop");
            t.setDaemon(true);
            loopThread = t;
            t.start();
        }
        return status();
    }

    @Override
    public SchedulerStatus stop() {
        synchronized (lifecycleLock) {
            Thread current = loopThread;
            if (current != null && current.isAlive() && stopRequested.compareAndSet(false, true)) {
                log.info("PostScheduler stopping...");
                wakeSignal.release();
            }
        }
        return status();
    }

    @Override
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        Thread t = loopThread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1L, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public SchedulerStatus status() {
        CycleSummary last = lastCycle.get();
        JobSummary nextDue = null;
        String error = null;
        try {
            nextDue = store.findNextPending().map(ScheduledJob::summary).orElse(null);
        } catch (JobStoreException e) {
            error = e.getMessage();
            log.warn("postscheduler status could not read next pending job msg={}", e.getMessage());
        }
        return new SchedulerStatus(loopState(), last == null ? null : last.startedAt(), last, nextDue, error);
    }

    private LoopState loopState() {
        Thread t = loopThread;
        if (t == null || !t.isAlive()) {
            return LoopState.STOPPED;
        }
        return stopRequested.get() ? LoopState.STOPPING : LoopState.RUNNING;
    }

    private void loop() {
        log.info("PostScheduler started successfully.");
        try {
            while (!shouldStop()) {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("postscheduler cycle failed msg={}", e.getMessage(), e);
                }

                if (shouldStop()) {
                    break;
                }
                // a permit means stop() woke us up; the loop condition decides
                wakeSignal.tryAcquire(options.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            shutdownAgentPool();
            log.info("PostScheduler stopped successfully.");
        }
    }

    private boolean shouldStop() {
        if (stopRequested.get()) {
            return true;
        }
        if (stopSignalPresent()) {
            log.info("Stop signal file detected path={}", options.stopSignalFile());
            return true;
        }
        return false;
    }

    private boolean stopSignalPresent() {
        return options.stopSignalFile() != null && Files.exists(options.stopSignalFile());
    }

    private void clearStopSignalFile() {
        if (options.stopSignalFile() == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(options.stopSignalFile())) {
                log.info("Removed leftover stop signal file path={}", options.stopSignalFile());
            }
        } catch (IOException e) {
            log.warn("Could not remove stop signal file path={} msg={}", options.stopSignalFile(), e.getMessage());
        }
    }

    /* ================= poll cycle ================= */

    @Override
    public CycleSummary runCycle() {
        long cycle = cycleCounter.incrementAndGet();
        LocalDateTime startedAt = now();
        LocalDateTime cutoff = startedAt.plus(options.dueBuffer());

        if (cycle % HEARTBEAT_EVERY == 1) {
            log.info("PostScheduler is running cycle={} localTime={}", cycle, startedAt);
        }
        executionLog.cycleStarted(cycle, startedAt, cutoff);

        int swept = 0;
        int due = 0;
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        String abortReason = null;

        try {
            swept = sweepStaleRunning(startedAt);
            repairMissingFollowUps(startedAt);

            List<ScheduledJob> jobs = store.listDue(cutoff);
            due = jobs.size();
            log.debug("postscheduler polled jobs count={} cutoff={}", due, cutoff);

            for (int i = 0; i < jobs.size(); i++) {
                if (shouldStop()) {
                    log.info("Stop requested; leaving remaining due jobs pending remaining={}", jobs.size() - i);
                    break;
                }

                ScheduledJob job = jobs.get(i);
                JobOutcome outcome;
                try {
                    outcome = processJob(job);
                } catch (JobStoreException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("postscheduler job processing failed jobId={} msg={}", job.id(), e.getMessage(), e);
                    executionLog.error("process", job.id(), e);
                    outcome = JobOutcome.FAILED;
                }

                switch (outcome) {
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }

                boolean more = i < jobs.size() - 1;
                if (more && outcome != JobOutcome.SKIPPED && !pauseBetweenJobs()) {
                    break;
                }
            }
        } catch (JobStoreException e) {
            abortReason = e.getMessage();
            log.error("postscheduler cycle aborted; store unavailable cycle={} msg={}", cycle, e.getMessage(), e);
            executionLog.error("cycle", null, e);
        }

        CycleSummary summary = new CycleSummary(
                cycle,
                startedAt,
                now(),
                swept,
                due,
                completed,
                failed,
                skipped,
                abortReason != null,
                abortReason
        );
        lastCycle.set(summary);
        executionLog.cycleFinished(summary);
        return summary;
    }

    private int sweepStaleRunning(LocalDateTime now) {
        LocalDateTime startedBefore = now.minus(options.staleRunningThreshold());
        String message = "Interrupted: job was still running after " + options.staleRunningThreshold()
                + "; the scheduler likely crashed or was killed mid-execution";

        int swept = store.failStaleRunning(startedBefore, message, now);
        if (swept > 0) {
            log.warn("swept stale running jobs to failed count={} startedBefore={}", swept, startedBefore);
            executionLog.swept(swept, startedBefore);
        }
        return swept;
    }

    /**
     * Re-inserts follow-ups that a store error dropped after their occurrence was already completed.
     */
    private void repairMissingFollowUps(LocalDateTime now) {
        for (ScheduledJob completed : store.findMissingFollowUps(now.minus(FOLLOW_UP_REPAIR_WINDOW))) {
            log.warn("completed recurring job has no follow-up; inserting it jobId={}", completed.id());
            insertFollowUp(completed);
        }
    }

    /**
     * @return false if the pause was cut short by a stop request or an interrupt
     */
    private boolean pauseBetweenJobs() {
        Duration pause = options.pauseBetweenJobs();
        if (pause.isZero()) {
            return true;
        }
        try {
            if (wakeSignal.tryAcquire(pause.toMillis(), TimeUnit.MILLISECONDS)) {
                // hand the permit back so the outer loop also sees the wake-up
                wakeSignal.release();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private JobOutcome processJob(ScheduledJob job) {
        String profileKey = profileKey(job);
        if (!busyProfiles.add(profileKey)) {
            log.warn("profile still busy with an earlier agent call; leaving job pending jobId={} profileRef={}",
                    job.id(), job.profileRef());
            executionLog.skipped(job, "profile-busy");
            return JobOutcome.SKIPPED;
        }

        boolean handedOff = false;
        try {
            ScheduledJob running;
            try {
                running = store.transition(job.id(), JobStatus.PENDING, JobStatus.RUNNING, null, now());
            } catch (JobNotFoundException e) {
                log.info("job no longer pending; skipping jobId={}", job.id());
                executionLog.skipped(job, "not-pending");
                return JobOutcome.SKIPPED;
            }
            executionLog.transition(running, JobStatus.PENDING, JobStatus.RUNNING, null);
            log.info("executing scheduled post jobId={} listingRef={} profile={}",
                    running.id(), running.listingRef(), running.profileDisplayName());

            AgentResult result;
            try {
                validate(running);
                handedOff = true;
                result = invokeAgent(running, profileKey);
            } catch (Exception e) {
                return fail(running, describe(e));
            }

            if (!result.success()) {
                String msg = result.errorMessage() == null || result.errorMessage().isBlank()
                        ? "Execution agent reported failure"
                        : result.errorMessage();
                return fail(running, msg);
            }
            return complete(running);
        } finally {
            if (!handedOff) {
                busyProfiles.remove(profileKey);
            }
        }
    }

    private AgentResult invokeAgent(ScheduledJob job, String profileKey) {
        AgentRequest request = AgentRequest.from(job);

        // whoever flips this first owns releasing the profile: the task when it starts, or the caller
        // when it cancels a task that never started
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<AgentResult> future;
        try {
            future = agentPool().submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return agent.execute(request);
                } finally {
                    busyProfiles.remove(profileKey);
                }
            });
        } catch (RejectedExecutionException e) {
            busyProfiles.remove(profileKey);
            throw new AgentExecutionException("Execution agent pool rejected the job", e);
        }

        try {
            AgentResult result = future.get(options.agentTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : AgentResult.failure("Execution agent returned no result");
        } catch (TimeoutException e) {
            cancel(future, claimed, profileKey);
            log.error("execution agent timed out jobId={} timeout={}", job.id(), options.agentTimeout());
            throw new AgentExecutionException("Execution timeout after " + options.agentTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AgentExecutionException(messageOf(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(future, claimed, profileKey);
            throw new AgentExecutionException("Interrupted while waiting for the execution agent", e);
        }
    }

    private void cancel(Future<AgentResult> future, AtomicBoolean claimed, String profileKey) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            busyProfiles.remove(profileKey);
        }
    }

    private JobOutcome complete(ScheduledJob running) {
        ScheduledJob completed;
        try {
            completed = store.transition(running.id(), JobStatus.RUNNING, JobStatus.COMPLETED, null, now());
        } catch (JobNotFoundException e) {
            log.warn("job vanished while running; post succeeded but was not recorded jobId={}", running.id());
            executionLog.skipped(running, "vanished-after-success");
            return JobOutcome.COMPLETED;
        }
        executionLog.transition(completed, JobStatus.RUNNING, JobStatus.COMPLETED, null);
        log.info("scheduled post completed jobId={}", completed.id());
        notifyListeners(l -> l.onCompleted(completed));

        // a store error here aborts the cycle; the next cycle's repair step inserts the follow-up
        insertFollowUp(completed);
        return JobOutcome.COMPLETED;
    }

    private void insertFollowUp(ScheduledJob completed) {
        LocalDateTime next = RecurrenceEngine.nextOccurrence(completed.nextRunAt(), completed.recurrence());
        if (next == null) {
            return;
        }
        String followUpId = store.insert(completed.followUp(next), now());
        log.info("recurring post rescheduled jobId={} followUpId={} recurrence={} nextRunAt={}",
                completed.id(), followUpId, completed.recurrence().value(), next);
        executionLog.rescheduled(completed, followUpId, next);
        notifyListeners(l -> l.onRescheduled(completed, followUpId));
    }

    private JobOutcome fail(ScheduledJob running, String message) {
        String error = truncate(message, MAX_ERROR_MESSAGE);
        try {
            ScheduledJob failed = store.transition(running.id(), JobStatus.RUNNING, JobStatus.FAILED, error, now());
            log.warn("scheduled post failed jobId={} msg={}", running.id(), error);
            executionLog.transition(failed, JobStatus.RUNNING, JobStatus.FAILED, error);
            notifyListeners(l -> l.onFailed(failed));
        } catch (JobNotFoundException e) {
            log.warn("job vanished before its failure was recorded jobId={} msg={}", running.id(), error);
        } catch (JobStoreException e) {
            log.error("could not record job failure; it stays running until swept jobId={} msg={}",
                    running.id(), e.getMessage(), e);
            executionLog.error("record-failure", running.id(), e);
        }
        return JobOutcome.FAILED;
    }

    private void validate(ScheduledJob job) {
        List<String> problems = snapshotProblems(job);
        if (!problems.isEmpty()) {
            throw new JobValidationException(String.join("; ", problems));
        }
    }

    private static List<String> snapshotProblems(ScheduledJob job) {
        List<String> problems = new ArrayList<>(3);
        if (isBlank(job.listingRef())) {
            problems.add("Missing listing reference");
        }
        if (isBlank(job.profileFolderPath())) {
            problems.add("Missing profile folder path");
        }
        if (isBlank(job.location())) {
            problems.add("Missing location");
        }
        return problems;
    }

    private void notifyListeners(Consumer<ExecutionListener> call) {
        for (ExecutionListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("execution listener failed listener={} msg={}", listener.getClass().getName(), e.getMessage());
            }
        }
    }

    private synchronized ExecutorService agentPool() {
        if (agentPool == null) {
            AtomicInteger seq = new AtomicInteger();
            agentPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setName("postscheduler.agent-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return agentPool;
    }

    // Calls that outlived their timeout keep running until the agent returns.
    private synchronized void shutdownAgentPool() {
        if (agentPool != null) {
            agentPool.shutdown();
            agentPool = null;
        }
    }

    /* ================= diagnostics ================= */

    @Override
    public DiagnosticReport runDiagnostic() {
        LocalDateTime now = now();
        LocalDateTime cutoff = now.plus(options.dueBuffer());
        LoopState state = loopState();
        List<String> warnings = new ArrayList<>();

        boolean reachable = false;
        String storeError = null;
        LocalDateTime storeTime = null;
        List<ScheduledJob> jobs = List.of();
        try {
            storeTime = store.currentTime();
            jobs = store.findAll(JobQuery.all());
            reachable = true;
        } catch (JobStoreException e) {
            storeError = e.getMessage();
            warnings.add("Schedule store unreachable: " + e.getMessage());
        }

        if (storeTime != null) {
            Duration skew = Duration.between(now, storeTime).abs();
            if (skew.compareTo(options.clockSkewWarning()) > 0) {
                warnings.add("Clock skew: store time " + storeTime + " differs from local time " + now
                        + " by " + skew.getSeconds() + "s; due times are compared against the local clock");
            }
        }

        List<JobDiagnostic> diagnostics = new ArrayList<>(jobs.size());
        for (ScheduledJob job : jobs) {
            diagnostics.add(diagnose(job, now, cutoff));
        }

        long due = diagnostics.stream().filter(JobDiagnostic::due).count();
        if (due > 0 && state != LoopState.RUNNING) {
            warnings.add(due + " job(s) are due but the scheduler loop is " + state.name().toLowerCase(Locale.ROOT));
        }

        if (state == LoopState.RUNNING) {
            LocalDateTime overdueLimit = now.minus(options.pollInterval()).minus(options.dueBuffer());
            long overdue = jobs.stream()
                    .filter(j -> j.status() == JobStatus.PENDING && j.nextRunAt() != null
                            && j.nextRunAt().isBefore(overdueLimit))
                    .count();
            if (overdue > 0) {
                warnings.add(overdue + " pending job(s) are overdue by more than pollInterval + dueBuffer;"
                        + " the loop is busy or stalled");
            }
        }

        LocalDateTime staleLimit = now.minus(options.staleRunningThreshold());
        long stale = jobs.stream()
                .filter(j -> j.status() == JobStatus.RUNNING && j.startedAt() != null
                        && j.startedAt().isBefore(staleLimit))
                .count();
        if (stale > 0) {
            warnings.add(stale + " running job(s) exceed the staleness threshold and will be marked failed"
                    + " on the next cycle");
        }

        if (stopSignalPresent()) {
            warnings.add("Stop signal file present: " + options.stopSignalFile());
        }

        return new DiagnosticReport(now, cutoff, state, reachable, storeError, storeTime,
                List.copyOf(diagnostics), List.copyOf(warnings));
    }

    private static JobDiagnostic diagnose(ScheduledJob job, LocalDateTime now, LocalDateTime cutoff) {
        Long secondsUntilDue = job.nextRunAt() == null
                ? null
                : Duration.between(now, job.nextRunAt()).getSeconds();
        List<String> problems = job.status() == JobStatus.PENDING ? snapshotProblems(job) : List.of();
        return new JobDiagnostic(
                job.id(),
                job.status(),
                job.listingRef(),
                job.profileDisplayName(),
                job.nextRunAt(),
                job.recurrence(),
                job.isDue(cutoff),
                secondsUntilDue,
                List.copyOf(problems)
        );
    }

    /* ================= job management ================= */

    @Override
    public PostJobBuilder schedule(String listingRef, PostJobBuilder.Profile profile) {
        return new SimplePostJobBuilder(listingRef, profile, this::insertNew, clock);
    }

    private String insertNew(PostJobSpec spec) {
        String id = store.insert(spec, now());
        log.info("scheduled post created id={} listingRef={} profileRef={} nextRunAt={} recurrence={}",
                id, spec.listingRef(), spec.profileRef(), spec.nextRunAt(), spec.recurrence().value());
        return id;
    }

    @Override
    public Optional<ScheduledJob> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.findById(id);
    }

    @Override
    public List<ScheduledJob> list(JobQuery query) {
        return store.findAll(query == null ? JobQuery.all() : query);
    }

    @Override
    public ScheduledJob cancel(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduledJob cancelled = store.transition(id, JobStatus.PENDING, JobStatus.CANCELLED, null, now());
        executionLog.transition(cancelled, JobStatus.PENDING, JobStatus.CANCELLED, null);
        return cancelled;
    }

    @Override
    public CancelResult cancel(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        if (query.isEmpty()) {
            throw new IllegalArgumentException("JobQuery must include at least one condition to cancel by");
        }
        CancelResult result = store.cancelMatching(query, now());
        log.info("cancelled pending jobs query={} matched={} modified={}", query, result.matched(), result.modified());
        return result;
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("scheduled post deleted id={}", id);
        }
        return deleted;
    }

    @Override
    public ScheduledJob reschedule(String id, LocalDateTime time, Recurrence recurrence) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(time, "time must not be null");
        ScheduledJob updated = store.reschedule(id, time, recurrence, now());
        log.info("scheduled post rescheduled id={} nextRunAt={} recurrence={}",
                id, updated.nextRunAt(), updated.recurrence().value());
        return updated;
    }

    @Override
    public String retry(String id, LocalDateTime time) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduledJob source = store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        if (source.status() != JobStatus.FAILED && source.status() != JobStatus.CANCELLED) {
            throw new IllegalStateException("Only failed or cancelled jobs can be retried: " + id
                    + " is " + source.status().value());
        }

        LocalDateTime runAt = time != null ? time : now();
        PostJobSpec spec = new PostJobSpec(
                source.listingRef(),
                source.profileRef(),
                source.profileDisplayName(),
                source.profileFolderPath(),
                source.location(),
                runAt,
                runAt,
                source.recurrence(),
                source.id()
        );
        String newId = store.insert(spec, now());
        log.info("scheduled post queued for retry sourceId={} newId={} nextRunAt={}", id, newId, runAt);
        return newId;
    }

    @Override
    public ScheduleStats stats() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        counts.putAll(store.countByStatus());
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        LocalDateTime now = now();
        long upcoming = store.countPendingBetween(now, now.plus(UPCOMING_WINDOW));
        return new ScheduleStats(Map.copyOf(counts), total, upcoming);
    }

    /* ================= helper ================= */

    /**
     * Current scheduler time (naive local wall clock).
     */
    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String profileKey(ScheduledJob job) {
        return job.profileRef() != null ? job.profileRef() : "job:" + job.id();
    }

    private static String describe(Exception e) {
        if (e instanceof AgentExecutionException || e instanceof JobValidationException) {
            return e.getMessage();
        }
        return messageOf(e);
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
