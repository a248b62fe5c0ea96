package io.postscheduler.core;

/**
 * Outcome reported by the execution agent.
 *
 * errorMessage : set when success is false, may be null otherwise
 */
public record AgentResult(
        boolean success,
        String errorMessage
) {
    public static AgentResult succeeded() {
        return new AgentResult(true, null);
    }

    public static AgentResult failure(String errorMessage) {
        return new AgentResult(false, errorMessage);
    }
}
