package io.schedule4j;

import java.time.Instant;

/**
 * Main scheduler API.
 *
 * <p>A tick is a bounded call: it scans due jobs once, runs those it can lease, and returns. Something
 * outside (a timer or an HTTP endpoint) invokes it periodically; any number of instances may
 * do so concurrently against the same store.
 */
public interface Scheduler {

    /**
     * Run all jobs due at the scheduler clock's current instant.
     */
    TickResult runDueScheduledJobs(TickOptions options);

    /**
     * Same as {@link #runDueScheduledJobs(TickOptions)} with the configured lease duration.
     */
    TickResult runDueScheduledJobs();

    /**
     * Run all jobs due at {@code now}.
     */
    TickResult tick(Instant now, TickOptions options);

    /**
     * Run one job's handler immediately, bypassing lease and schedule.
     */
    ManualRunResult runNow(String taskId);
}
