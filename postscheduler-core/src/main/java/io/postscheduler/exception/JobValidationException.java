package io.postscheduler.exception;

/**
 * A job request or a persisted job snapshot lacks data required to post it.
 */
public class JobValidationException extends PostSchedulerException {
    public JobValidationException(String message) {
        super(message);
    }
}
