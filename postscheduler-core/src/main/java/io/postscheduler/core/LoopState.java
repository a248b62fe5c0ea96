package io.postscheduler.core;

public enum LoopState {
    STOPPED,
    RUNNING,
    /**
     * Stop requested; the loop exits once the in-flight job (if any) finishes.
     */
    STOPPING
}
