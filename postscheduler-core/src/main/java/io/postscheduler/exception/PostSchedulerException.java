package io.postscheduler.exception;

/**
 * Base type for failures raised by the scheduler and its collaborators.
 */
public class PostSchedulerException extends RuntimeException {
    public PostSchedulerException(String message) {
        super(message);
    }

    public PostSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
