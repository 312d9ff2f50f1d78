package io.schedule4j.core;

import java.time.Instant;

/**
 * Scheduling fields to write back after one tick processed a job.
 *
 * <p>{@code disabledReason} is non-null only when this update forces a previously enabled job to
 * {@code enabled=false} because its schedule configuration is unusable.
 */
public record ScheduleUpdate(
        Instant nextRunAfter,
        boolean enabled,
        int runCountDelta,
        int failureCountDelta,
        String disabledReason
) {

    /**
     * Passthrough for a job that is already disabled.
     */
    public static ScheduleUpdate unchanged(Instant nextRunAfter) {
        return new ScheduleUpdate(nextRunAfter, false, 0, 0, null);
    }

    public static ScheduleUpdate advance(Instant nextRunAfter, int runCountDelta, int failureCountDelta) {
        return new ScheduleUpdate(nextRunAfter, true, runCountDelta, failureCountDelta, null);
    }

    public static ScheduleUpdate disable(String reason, int runCountDelta, int failureCountDelta) {
        return new ScheduleUpdate(null, false, runCountDelta, failureCountDelta, reason);
    }

    /**
     * True when this update turns an enabled job off.
     */
    public boolean forcesDisable() {
        return disabledReason != null;
    }
}
