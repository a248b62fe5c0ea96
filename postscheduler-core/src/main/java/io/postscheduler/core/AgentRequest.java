package io.postscheduler.core;

/**
 * Input handed to the execution agent for one post.
 */
public record AgentRequest(
        String jobId,
        String listingRef,
        String profileRef,
        String profileDisplayName,
        String profileFolderPath,
        String location
) {
    public static AgentRequest from(ScheduledJob job) {
        return new AgentRequest(
                job.id(),
                job.listingRef(),
                job.profileRef(),
                job.profileDisplayName(),
                job.profileFolderPath(),
                job.location()
        );
    }
}
