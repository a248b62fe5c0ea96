package io.postscheduler.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.postscheduler.core.CancelResult;
import io.postscheduler.core.JobQuery;
import io.postscheduler.core.JobStatus;
import io.postscheduler.core.JobStore;
import io.postscheduler.core.PostJobSpec;
import io.postscheduler.core.Recurrence;
import io.postscheduler.core.ScheduledJob;
import io.postscheduler.exception.JobNotFoundException;
import io.postscheduler.exception.JobStoreException;
import io.postscheduler.utils.RecurrenceEngine;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for scheduled posts.
 *
 * <p>Every status change is a single {@code findAndModify} / {@code updateMulti} conditioned on the
 * current status, so the loop and the dashboard can race on the same document safely. Driver and
 * Spring Data failures are rethrown as {@link JobStoreException}.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduledJob> listDue(LocalDateTime before) {
        Objects.requireNonNull(before, "before must not be null");

        Query q = new Query(
                Criteria.where("status").is(JobStatus.PENDING)
                        .and("nextRunAt").ne(null).lte(before)
        );
        q.with(Sort.by(Sort.Order.asc("nextRunAt")));

        return call("listDue", () -> toJobs(mongoTemplate.find(q, ScheduledPostDocument.class)));
    }

    @Override
    public ScheduledJob transition(String id, JobStatus from, JobStatus to, String errorMessage, LocalDateTime at) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(at, "at must not be null");
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal status transition " + from.value() + " -> " + to.value());
        }

        Query q = new Query(Criteria.where("_id").is(id).and("status").is(from));

        Update u = new Update()
                .set("status", to)
                .set("updatedAt", at);

        switch (to) {
            case RUNNING -> u.set("startedAt", at).unset("finishedAt").set("errorMessage", null);
            case COMPLETED -> u.set("finishedAt", at).set("errorMessage", null);
            case FAILED -> u.set("finishedAt", at).set("errorMessage", errorMessage);
            case CANCELLED, PENDING -> {
                // no extra stamps
            }
        }

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
        ScheduledPostDocument doc = call("transition",
                () -> mongoTemplate.findAndModify(q, u, options, ScheduledPostDocument.class));
        if (doc == null) {
            throw new JobNotFoundException(id, from);
        }
        return toJob(doc);
    }

    @Override
    public String insert(PostJobSpec spec, LocalDateTime createdAt) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");

        ScheduledPostDocument doc = toDocument(spec, createdAt);
        return call("insert", () -> mongoTemplate.insert(doc).getId());
    }

    @Override
    public Optional<ScheduledJob> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return call("findById", () -> Optional.ofNullable(mongoTemplate.findById(id, ScheduledPostDocument.class))
                .map(MongoJobStore::toJob));
    }

    @Override
    public List<ScheduledJob> findAll(JobQuery query) {
        Query q = new Query(buildCriteria(query == null ? JobQuery.all() : query));
        q.with(Sort.by(Sort.Order.asc("nextRunAt")));

        return call("findAll", () -> toJobs(mongoTemplate.find(q, ScheduledPostDocument.class)));
    }

    @Override
    public Optional<ScheduledJob> findNextPending() {
        Query q = new Query(Criteria.where("status").is(JobStatus.PENDING).and("nextRunAt").ne(null));
        q.with(Sort.by(Sort.Order.asc("nextRunAt")));

        return call("findNextPending", () -> Optional.ofNullable(mongoTemplate.findOne(q, ScheduledPostDocument.class))
                .map(MongoJobStore::toJob));
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return call("delete", () -> mongoTemplate.remove(q, ScheduledPostDocument.class).getDeletedCount() > 0);
    }

    @Override
    public ScheduledJob reschedule(String id, LocalDateTime scheduledAt, Recurrence recurrence, LocalDateTime at) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        Objects.requireNonNull(at, "at must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("status").is(JobStatus.PENDING));

        Update u = new Update()
                .set("scheduledAt", scheduledAt)
                .set("nextRunAt", scheduledAt)
                .set("updatedAt", at);
        if (recurrence != null) {
            u.set("recurrence", recurrence.value());
        }

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
        ScheduledPostDocument doc = call("reschedule",
                () -> mongoTemplate.findAndModify(q, u, options, ScheduledPostDocument.class));
        if (doc == null) {
            throw new JobNotFoundException(id, JobStatus.PENDING);
        }
        return toJob(doc);
    }

    @Override
    public CancelResult cancelMatching(JobQuery query, LocalDateTime at) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(at, "at must not be null");
        if (query.status() != null && query.status() != JobStatus.PENDING) {
            // only pending jobs can be cancelled
            return CancelResult.empty();
        }

        JobQuery.Builder pendingOnly = JobQuery.builder()
                .status(JobStatus.PENDING)
                .listingRef(query.listingRef())
                .profileRef(query.profileRef());
        if (query.nextRunFrom() != null) {
            pendingOnly.upcoming(query.nextRunFrom());
        }

        Update u = new Update()
                .set("status", JobStatus.CANCELLED)
                .set("updatedAt", at);

        Query q = new Query(buildCriteria(pendingOnly.build()));
        UpdateResult r = call("cancelMatching", () -> mongoTemplate.updateMulti(q, u, ScheduledPostDocument.class));
        return new CancelResult(r.getMatchedCount(), r.getModifiedCount());
    }

    @Override
    public int failStaleRunning(LocalDateTime startedBefore, String errorMessage, LocalDateTime at) {
        Objects.requireNonNull(startedBefore, "startedBefore must not be null");
        Objects.requireNonNull(at, "at must not be null");

        Query q = new Query(
                Criteria.where("status").is(JobStatus.RUNNING)
                        .and("startedAt").lt(startedBefore)
        );

        Update u = new Update()
                .set("status", JobStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("finishedAt", at)
                .set("updatedAt", at);

        UpdateResult r = call("failStaleRunning", () -> mongoTemplate.updateMulti(q, u, ScheduledPostDocument.class));
        return (int) r.getModifiedCount();
    }

    @Override
    public List<ScheduledJob> findMissingFollowUps(LocalDateTime finishedSince) {
        Objects.requireNonNull(finishedSince, "finishedSince must not be null");

        Query q = new Query(
                Criteria.where("status").is(JobStatus.COMPLETED)
                        .and("recurrence").ne(Recurrence.NONE.value())
                        .and("finishedAt").gte(finishedSince)
        );
        q.with(Sort.by(Sort.Order.asc("nextRunAt")));

        return call("findMissingFollowUps", () -> {
            List<ScheduledJob> missing = new ArrayList<>();
            for (ScheduledPostDocument d : mongoTemplate.find(q, ScheduledPostDocument.class)) {
                Query followUp = new Query(Criteria.where("originJobId").is(d.getId()));
                if (!mongoTemplate.exists(followUp, ScheduledPostDocument.class)) {
                    missing.add(toJob(d));
                }
            }
            return missing;
        });
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        return call("countByStatus", () -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus s : JobStatus.values()) {
                counts.put(s, mongoTemplate.count(new Query(Criteria.where("status").is(s)), ScheduledPostDocument.class));
            }
            return counts;
        });
    }

    @Override
    public long countPendingBetween(LocalDateTime from, LocalDateTime to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");

        Query q = new Query(
                Criteria.where("status").is(JobStatus.PENDING)
                        .and("nextRunAt").gte(from).lte(to)
        );
        return call("countPendingBetween", () -> mongoTemplate.count(q, ScheduledPostDocument.class));
    }

    @Override
    public LocalDateTime currentTime() {
        Document hello = call("currentTime", () -> mongoTemplate.executeCommand(new Document("hello", 1)));
        Object localTime = hello == null ? null : hello.get("localTime");
        if (!(localTime instanceof Date date)) {
            throw new JobStoreException("Store did not report its local time");
        }
        return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
    }

    /* ================= mapping ================= */

    static ScheduledPostDocument toDocument(PostJobSpec spec, LocalDateTime createdAt) {
        ScheduledPostDocument doc = new ScheduledPostDocument();
        doc.setListingRef(spec.listingRef());
        doc.setProfileRef(spec.profileRef());
        doc.setProfileDisplayName(spec.profileDisplayName());
        doc.setProfileFolderPath(spec.profileFolderPath());
        doc.setLocation(spec.location());
        doc.setScheduledAt(spec.scheduledAt());
        doc.setNextRunAt(spec.nextRunAt());
        doc.setRecurrence((spec.recurrence() == null ? Recurrence.NONE : spec.recurrence()).value());
        doc.setStatus(JobStatus.PENDING);
        doc.setOriginJobId(spec.originJobId());
        doc.setCreatedAt(createdAt);
        doc.setUpdatedAt(createdAt);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(PostJobSpec, LocalDateTime)}.
     *
     * <p>An unparseable stored recurrence is read as {@link Recurrence#NONE}.
     */
    static ScheduledJob toJob(ScheduledPostDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return new ScheduledJob(
                doc.getId(),
                doc.getListingRef(),
                doc.getProfileRef(),
                doc.getProfileDisplayName(),
                doc.getProfileFolderPath(),
                doc.getLocation(),
                doc.getScheduledAt(),
                doc.getNextRunAt(),
                RecurrenceEngine.parseOrNone(doc.getRecurrence(), doc.getId()),
                doc.getStatus(),
                doc.getErrorMessage(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getOriginJobId(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static List<ScheduledJob> toJobs(List<ScheduledPostDocument> docs) {
        List<ScheduledJob> jobs = new ArrayList<>(docs.size());
        for (ScheduledPostDocument d : docs) {
            if (d != null) {
                jobs.add(toJob(d));
            }
        }
        return jobs;
    }

    static Criteria buildCriteria(JobQuery query) {
        List<Criteria> parts = new ArrayList<>(4);

        if (query.status() != null) {
            parts.add(Criteria.where("status").is(query.status()));
        }
        if (query.listingRef() != null) {
            parts.add(Criteria.where("listingRef").is(query.listingRef()));
        }
        if (query.profileRef() != null) {
            parts.add(Criteria.where("profileRef").is(query.profileRef()));
        }
        if (query.nextRunFrom() != null) {
            parts.add(Criteria.where("nextRunAt").gte(query.nextRunFrom()));
        }

        if (parts.isEmpty()) {
            return new Criteria();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new JobStoreException("Schedule store operation failed: " + operation + " (" + e.getMessage() + ")", e);
        }
    }
}
