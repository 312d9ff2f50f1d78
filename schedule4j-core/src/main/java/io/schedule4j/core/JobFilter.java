package io.schedule4j.core;

/**
 * Optional selectors for listing jobs. Null fields match everything.
 */
public record JobFilter(Boolean enabled, String handlerId) {

    public static JobFilter all() {
        return new JobFilter(null, null);
    }

    public boolean matches(ScheduledJob job) {
        if (enabled != null && job.enabled() != enabled) {
            return false;
        }
        return handlerId == null || handlerId.isBlank() || handlerId.equals(job.handlerId());
    }
}
