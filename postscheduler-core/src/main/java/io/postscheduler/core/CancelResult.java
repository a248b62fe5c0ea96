package io.postscheduler.core;

/**
 * Result of a bulk cancel.
 *
 * matched  : number of jobs matched by the query
 * modified : number of pending jobs moved to cancelled
 */
public record CancelResult(
        long matched,
        long modified
) {

    public static CancelResult empty() {
        return new CancelResult(0, 0);
    }

    public boolean hasEffect() {
        return modified > 0;
    }
}
