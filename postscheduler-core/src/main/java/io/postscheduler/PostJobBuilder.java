package io.postscheduler;

import io.postscheduler.core.PostJobSpec;
import io.postscheduler.core.Recurrence;

import java.time.LocalDateTime;

/**
 * Fluent builder for a scheduled post.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): validates and returns an in-memory job spec</li>
 *   <li>save(): build() + insert into the store</li>
 * </ul>
 */
public interface PostJobBuilder {

    /**
     * Profile snapshot the post runs as. Copied into the job so later profile edits do not
     * affect it.
     */
    record Profile(String profileRef, String displayName, String folderPath, String location) {
    }

    PostJobBuilder profile(Profile profile);

    /**
     * Run once at the given local wall-clock time. Must be in the future.
     */
    PostJobBuilder at(LocalDateTime time);

    PostJobBuilder recurrence(Recurrence recurrence);

    /**
     * Recurrence by wire value ("none", "daily", "weekly", "monthly").
     */
    PostJobBuilder recurrence(String recurrence);

    PostJobSpec build();

    /**
     * Build + persist.
     *
     * @return id of the new job
     */
    String save();
}
