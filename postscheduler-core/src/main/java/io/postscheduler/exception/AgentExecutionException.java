package io.postscheduler.exception;

/**
 * The execution agent reported a failure, threw, or exceeded its time budget.
 */
public class AgentExecutionException extends PostSchedulerException {
    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
