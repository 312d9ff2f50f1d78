package io.schedule4j.core;

/**
 * What a tick does with a leased job whose handler id is not registered.
 */
public enum MissingHandlerPolicy {
    /**
     * Disable the job and clear {@code nextRunAfter}, the same as a schedule configuration error.
     */
    DISABLE,
    /**
     * Keep the job enabled and advance its schedule as a skipped run.
     * Suited to rolling deploys where a handler may be briefly absent on some instances.
     */
    RESCHEDULE
}
