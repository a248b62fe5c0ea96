package io.postscheduler.internal.mongo;

import io.postscheduler.core.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

/**
 * Mongo document model for persisted scheduled posts.
 *
 * <p>Recurrence is kept as its wire string so that a malformed stored value can be
 * read back (as none) instead of failing the whole mapping.
 */
@Document(collection = "scheduled_posts")
public class ScheduledPostDocument {

    @Id
    private String id;

    private String listingRef;
    private String profileRef;

    private String profileDisplayName;
    private String profileFolderPath;
    private String location;

    private LocalDateTime scheduledAt;

    @Field(write = Field.Write.ALWAYS)
    private LocalDateTime nextRunAt;

    private String recurrence;
    private JobStatus status;

    @Field(write = Field.Write.ALWAYS)
    private String errorMessage;

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    private String originJobId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public ScheduledPostDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getListingRef() {
        return listingRef;
    }

    public void setListingRef(String listingRef) {
        this.listingRef = listingRef;
    }

    public String getProfileRef() {
        return profileRef;
    }

    public void setProfileRef(String profileRef) {
        this.profileRef = profileRef;
    }

    public String getProfileDisplayName() {
        return profileDisplayName;
    }

    public void setProfileDisplayName(String profileDisplayName) {
        this.profileDisplayName = profileDisplayName;
    }

    public String getProfileFolderPath() {
        return profileFolderPath;
    }

    public void setProfileFolderPath(String profileFolderPath) {
        this.profileFolderPath = profileFolderPath;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public LocalDateTime getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(LocalDateTime scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public LocalDateTime getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(LocalDateTime nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public String getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(String recurrence) {
        this.recurrence = recurrence;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(LocalDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getOriginJobId() {
        return originJobId;
    }

    public void setOriginJobId(String originJobId) {
        this.originJobId = originJobId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
