package io.postscheduler.exception;

/**
 * The schedule store could not be reached or returned an inconsistent answer.
 */
public class JobStoreException extends PostSchedulerException {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
