package io.postscheduler.internal.mongo;

import com.mongodb.client.MongoClients;
import io.postscheduler.core.AgentResult;
import io.postscheduler.core.CancelResult;
import io.postscheduler.core.JobQuery;
import io.postscheduler.core.JobStatus;
import io.postscheduler.core.PostJobSpec;
import io.postscheduler.core.Recurrence;
import io.postscheduler.core.ScheduledJob;
import io.postscheduler.core.SchedulerOptions;
import io.postscheduler.exception.JobNotFoundException;
import io.postscheduler.internal.DefaultPostScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Mongo keeps millisecond precision
    private static final LocalDateTime NOW = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "postscheduler_test");
        mongoTemplate.dropCollection(ScheduledPostDocument.class);
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScheduledPostDocument.class);
    }

    @Test
    void insertShouldStorePendingJobWithSnapshot() {
        String id = jobStore.insert(spec("listing-1", "profile-1", NOW.plusHours(1), Recurrence.DAILY), NOW);

        ScheduledJob job = jobStore.findById(id).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals("listing-1", job.listingRef());
        assertEquals("/profiles/profile-1", job.profileFolderPath());
        assertEquals(NOW.plusHours(1), job.nextRunAt());
        assertEquals(Recurrence.DAILY, job.recurrence());
        assertEquals(NOW, job.createdAt());
        assertNull(job.startedAt());
    }

    @Test
    void listDueShouldReturnPendingJobsEarliestFirst() {
        String late = jobStore.insert(spec("listing-late", "p1", NOW.minusMinutes(1), Recurrence.NONE), NOW);
        String early = jobStore.insert(spec("listing-early", "p2", NOW.minusMinutes(10), Recurrence.NONE), NOW);
        jobStore.insert(spec("listing-future", "p3", NOW.plusHours(1), Recurrence.NONE), NOW);
        String cancelled = jobStore.insert(spec("listing-cancelled", "p4", NOW.minusMinutes(5), Recurrence.NONE), NOW);
        jobStore.transition(cancelled, JobStatus.PENDING, JobStatus.CANCELLED, null, NOW);

        List<ScheduledJob> due = jobStore.listDue(NOW);

        assertEquals(List.of(early, late), due.stream().map(ScheduledJob::id).toList());
    }

    @Test
    void transitionShouldBeConditionalOnCurrentStatus() {
        String id = jobStore.insert(spec("listing-1", "p1", NOW, Recurrence.NONE), NOW);

        ScheduledJob running = jobStore.transition(id, JobStatus.PENDING, JobStatus.RUNNING, null, NOW.plusSeconds(1));
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(NOW.plusSeconds(1), running.startedAt());

        JobNotFoundException ex = assertThrows(JobNotFoundException.class,
                () -> jobStore.transition(id, JobStatus.PENDING, JobStatus.CANCELLED, null, NOW));
        assertEquals(JobStatus.PENDING, ex.expectedStatus());

        ScheduledJob failed = jobStore.transition(id, JobStatus.RUNNING, JobStatus.FAILED, "login expired", NOW.plusSeconds(9));
        assertEquals("login expired", failed.errorMessage());
        assertEquals(NOW.plusSeconds(9), failed.finishedAt());

        assertThrows(IllegalStateException.class,
                () -> jobStore.transition(id, JobStatus.FAILED, JobStatus.PENDING, null, NOW));
    }

    @Test
    void concurrentClaimAndCancelShouldHaveExactlyOneWinner() throws Exception {
        String id = jobStore.insert(spec("listing-1", "p1", NOW, Recurrence.NONE), NOW);
        CountDownLatch go = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> claim = pool.submit(attempt(go, id, JobStatus.RUNNING));
            Future<Boolean> cancel = pool.submit(attempt(go, id, JobStatus.CANCELLED));
            go.countDown();

            assertTrue(claim.get() ^ cancel.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failStaleRunningShouldOnlySweepOldRunningJobs() {
        String stale = jobStore.insert(spec("listing-1", "p1", NOW, Recurrence.DAILY), NOW);
        String fresh = jobStore.insert(spec("listing-2", "p2", NOW, Recurrence.DAILY), NOW);
        String pending = jobStore.insert(spec("listing-3", "p3", NOW.minusHours(2), Recurrence.DAILY), NOW);
        jobStore.transition(stale, JobStatus.PENDING, JobStatus.RUNNING, null, NOW.minusMinutes(30));
        jobStore.transition(fresh, JobStatus.PENDING, JobStatus.RUNNING, null, NOW.minusMinutes(2));

        int swept = jobStore.failStaleRunning(NOW.minusMinutes(15), "Interrupted: crashed", NOW);

        assertEquals(1, swept);
        ScheduledJob sweptJob = jobStore.findById(stale).orElseThrow();
        assertEquals(JobStatus.FAILED, sweptJob.status());
        assertEquals("Interrupted: crashed", sweptJob.errorMessage());
        assertEquals(JobStatus.RUNNING, jobStore.findById(fresh).orElseThrow().status());
        assertEquals(JobStatus.PENDING, jobStore.findById(pending).orElseThrow().status());
    }

    @Test
    void findMissingFollowUpsShouldReturnRecentRecurringJobsNothingPointsTo() {
        String orphan = jobStore.insert(spec("listing-1", "p1", NOW, Recurrence.DAILY), NOW);
        String linked = jobStore.insert(spec("listing-2", "p2", NOW, Recurrence.WEEKLY), NOW);
        String oneOff = jobStore.insert(spec("listing-3", "p3", NOW, Recurrence.NONE), NOW);
        String old = jobStore.insert(spec("listing-4", "p4", NOW.minusDays(3), Recurrence.DAILY), NOW);
        for (String id : List.of(orphan, linked, oneOff, old)) {
            jobStore.transition(id, JobStatus.PENDING, JobStatus.RUNNING, null, NOW);
        }
        jobStore.transition(orphan, JobStatus.RUNNING, JobStatus.COMPLETED, null, NOW);
        ScheduledJob linkedDone = jobStore.transition(linked, JobStatus.RUNNING, JobStatus.COMPLETED, null, NOW);
        jobStore.transition(oneOff, JobStatus.RUNNING, JobStatus.COMPLETED, null, NOW);
        jobStore.transition(old, JobStatus.RUNNING, JobStatus.COMPLETED, null, NOW.minusDays(2));
        jobStore.insert(linkedDone.followUp(NOW.plusDays(7)), NOW);

        List<ScheduledJob> missing = jobStore.findMissingFollowUps(NOW.minusDays(1));

        assertEquals(List.of(orphan), missing.stream().map(ScheduledJob::id).toList());
    }

    @Test
    void cancelMatchingShouldOnlyTouchPendingJobs() {
        jobStore.insert(spec("listing-1", "p1", NOW.plusHours(1), Recurrence.NONE), NOW);
        jobStore.insert(spec("listing-2", "p1", NOW.plusHours(2), Recurrence.NONE), NOW);
        String done = jobStore.insert(spec("listing-3", "p1", NOW.minusHours(1), Recurrence.NONE), NOW);
        jobStore.transition(done, JobStatus.PENDING, JobStatus.RUNNING, null, NOW);
        jobStore.transition(done, JobStatus.RUNNING, JobStatus.COMPLETED, null, NOW);
        String other = jobStore.insert(spec("listing-4", "p2", NOW.plusHours(1), Recurrence.NONE), NOW);

        CancelResult result = jobStore.cancelMatching(JobQuery.builder().profileRef("p1").build(), NOW);

        assertEquals(2, result.modified());
        assertEquals(JobStatus.COMPLETED, jobStore.findById(done).orElseThrow().status());
        assertEquals(JobStatus.PENDING, jobStore.findById(other).orElseThrow().status());
        assertFalse(jobStore.cancelMatching(JobQuery.builder().status(JobStatus.FAILED).build(), NOW).hasEffect());
    }

    @Test
    void rescheduleShouldOnlyMovePendingJobs() {
        String id = jobStore.insert(spec("listing-1", "p1", NOW.plusDays(2), Recurrence.WEEKLY), NOW);

        ScheduledJob moved = jobStore.reschedule(id, NOW.plusHours(1), null, NOW);

        assertEquals(NOW.plusHours(1), moved.nextRunAt());
        assertEquals(NOW.plusHours(1), moved.scheduledAt());
        assertEquals(Recurrence.WEEKLY, moved.recurrence());

        jobStore.transition(id, JobStatus.PENDING, JobStatus.CANCELLED, null, NOW);
        assertThrows(JobNotFoundException.class, () -> jobStore.reschedule(id, NOW.plusHours(3), Recurrence.NONE, NOW));
    }

    @Test
    void findAllAndCountsShouldReflectQueries() {
        jobStore.insert(spec("listing-1", "p1", NOW.plusDays(1), Recurrence.NONE), NOW);
        jobStore.insert(spec("listing-1", "p2", NOW.plusDays(3), Recurrence.NONE), NOW);
        jobStore.insert(spec("listing-2", "p1", NOW.plusDays(9), Recurrence.NONE), NOW);
        String cancelled = jobStore.insert(spec("listing-3", "p3", NOW.plusDays(2), Recurrence.NONE), NOW);
        jobStore.transition(cancelled, JobStatus.PENDING, JobStatus.CANCELLED, null, NOW);

        assertEquals(2, jobStore.findAll(JobQuery.builder().listingRef("listing-1").build()).size());
        assertEquals(4, jobStore.findAll(JobQuery.all()).size());
        assertEquals(3, jobStore.findAll(JobQuery.builder().upcoming(NOW).build()).size());

        Map<JobStatus, Long> counts = jobStore.countByStatus();
        assertEquals(3L, counts.get(JobStatus.PENDING));
        assertEquals(1L, counts.get(JobStatus.CANCELLED));
        assertEquals(0L, counts.get(JobStatus.RUNNING));

        assertEquals(2, jobStore.countPendingBetween(NOW, NOW.plusDays(7)));
        assertEquals(NOW.plusDays(1), jobStore.findNextPending().orElseThrow().nextRunAt());
    }

    @Test
    void deleteShouldReportWhetherARowWasRemoved() {
        String id = jobStore.insert(spec("listing-1", "p1", NOW, Recurrence.NONE), NOW);

        assertTrue(jobStore.delete(id));
        assertFalse(jobStore.delete(id));
        assertTrue(jobStore.findById(id).isEmpty());
    }

    @Test
    void currentTimeShouldComeFromTheServer() {
        LocalDateTime storeTime = jobStore.currentTime();

        assertNotNull(storeTime);
        assertTrue(Duration.between(LocalDateTime.now(), storeTime).abs().toMinutes() < 5);
    }

    @Test
    void schedulerShouldRunDailyPostAgainstMongo() {
        String id = jobStore.insert(spec("listing-1", "p1", NOW.minusMinutes(1), Recurrence.DAILY), NOW);
        SchedulerOptions options = SchedulerOptions.defaults().withPauseBetweenJobs(Duration.ZERO);
        DefaultPostScheduler scheduler = new DefaultPostScheduler(options, jobStore,
                request -> AgentResult.succeeded(), List.of(), Clock.systemDefaultZone());

        scheduler.runCycle();

        assertEquals(JobStatus.COMPLETED, jobStore.findById(id).orElseThrow().status());
        List<ScheduledJob> pending = jobStore.findAll(JobQuery.builder().status(JobStatus.PENDING).build());
        assertEquals(1, pending.size());
        assertEquals(NOW.minusMinutes(1).plusDays(1), pending.get(0).nextRunAt());
        assertEquals(id, pending.get(0).originJobId());
    }

    private Callable<Boolean> attempt(CountDownLatch go, String id, JobStatus to) {
        return () -> {
            go.await();
            try {
                jobStore.transition(id, JobStatus.PENDING, to, null, NOW);
                return true;
            } catch (JobNotFoundException e) {
                return false;
            }
        };
    }

    private static PostJobSpec spec(String listingRef, String profileRef, LocalDateTime at, Recurrence recurrence) {
        return new PostJobSpec(listingRef, profileRef, "Seller " + profileRef, "/profiles/" + profileRef,
                "Austin, TX", at, at, recurrence, null);
    }
}
