package io.postscheduler.exception;

public class RecurrenceConfigException extends PostSchedulerException {

    private final String value;

    public RecurrenceConfigException(String value) {
        super("Unsupported recurrence policy: '" + value + "'. Expected one of none, daily, weekly, monthly");
        this.value = value;
    }

    public String value() {
        return value;
    }
}
