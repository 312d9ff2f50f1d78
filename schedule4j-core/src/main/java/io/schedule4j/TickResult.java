package io.schedule4j;

/**
 * Aggregate outcome of one tick.
 *
 * dueCount      : jobs returned by the due-scan
 * executedCount : handler ran and returned normally
 * skippedCount  : lease contention, missing handler or unusable schedule
 * failedCount   : handler threw, or processing the job failed
 */
public record TickResult(
        int dueCount,
        int executedCount,
        int skippedCount,
        int failedCount
) {

    public static TickResult empty() {
        return new TickResult(0, 0, 0, 0);
    }

    public boolean hasActivity() {
        return executedCount > 0 || failedCount > 0;
    }
}
