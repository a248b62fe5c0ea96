package io.postscheduler.config;

import io.postscheduler.internal.mongo.ScheduledPostDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the post scheduler.
 *
 * <p>Indexes are <b>not</b> created at application startup unless
 * {@code postscheduler.ensure-indexes-on-startup=true}; in production they are usually
 * managed by migration scripts.
 *
 * <h3>Required indexes (collection: {@code scheduled_posts})</h3>
 * <ul>
 *   <li><b>idx_status_next_run</b>: { status: 1, nextRunAt: 1 }
 *       <br/>Used by the due-job poll, the next-pending lookup and the upcoming count.</li>
 *   <li><b>idx_profile_status</b>: { profileRef: 1, status: 1 }
 *       <br/>Used by per-profile listing and bulk cancel.</li>
 *   <li><b>idx_listing</b>: { listingRef: 1 }
 *       <br/>Used when a listing's scheduled posts are listed or cancelled.</li>
 *   <li><b>idx_origin</b>: { originJobId: 1 }
 *       <br/>Used by the lost follow-up check at the start of every cycle.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_posts.createIndex({ status: 1, nextRunAt: 1 }, { name: "idx_status_next_run" });
 * db.scheduled_posts.createIndex({ profileRef: 1, status: 1 }, { name: "idx_profile_status" });
 * db.scheduled_posts.createIndex({ listingRef: 1 }, { name: "idx_listing" });
 * db.scheduled_posts.createIndex({ originJobId: 1 }, { name: "idx_origin" });
 * </pre>
 */
public class PostSchedulerMongoIndexConfig {

    public static final String IDX_STATUS_NEXT_RUN = "idx_status_next_run";
    public static final String IDX_PROFILE_STATUS = "idx_profile_status";
    public static final String IDX_LISTING = "idx_listing";
    public static final String IDX_ORIGIN = "idx_origin";

    private final MongoTemplate mongoTemplate;

    public PostSchedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the required indexes. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledPostDocument.class).ensureIndex(statusNextRunIndex());
        mongoTemplate.indexOps(ScheduledPostDocument.class).ensureIndex(profileStatusIndex());
        mongoTemplate.indexOps(ScheduledPostDocument.class).ensureIndex(listingIndex());
        mongoTemplate.indexOps(ScheduledPostDocument.class).ensureIndex(originIndex());
    }

    /**
     * Keys: status ASC, nextRunAt ASC
     */
    public static Index statusNextRunIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_STATUS_NEXT_RUN);
    }

    /**
     * Keys: profileRef ASC, status ASC
     */
    public static Index profileStatusIndex() {
        return new Index()
                .on("profileRef", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_PROFILE_STATUS);
    }

    public static Index listingIndex() {
        return new Index()
                .on("listingRef", Sort.Direction.ASC)
                .named(IDX_LISTING);
    }

    public static Index originIndex() {
        return new Index()
                .on("originJobId", Sort.Direction.ASC)
                .named(IDX_ORIGIN);
    }
}
