package io.schedule4j.core;

import io.schedule4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutual exclusion on a job row through one conditional update.
 *
 * <p>There is no explicit release: the final commit of a run clears the lease. A lease held by a
 * crashed process expires after its duration and is picked up by the next due-scan that observes it.
 */
public class LeaseManager {
    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private final JobStore jobStore;

    public LeaseManager(JobStore jobStore) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
    }

    /**
     * Try to take the lease of {@code taskId} until {@code now + leaseDuration}.
     *
     * @return true when exclusivity was obtained; false when another holder has it or the job was disabled
     */
    public boolean acquire(String taskId, Instant now, Duration leaseDuration) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(leaseDuration, "leaseDuration must not be null");
        if (leaseDuration.isZero() || leaseDuration.isNegative()) {
            throw new IllegalArgumentException("leaseDuration must be a positive duration");
        }

        Instant lockUntil = now.plus(leaseDuration);
        boolean acquired = jobStore.tryAcquireLease(taskId, now, lockUntil);
        if (acquired) {
            log.debug("lease acquired taskId={} lockUntil={}", taskId, lockUntil);
        } else {
            log.debug("lease not acquired taskId={} (held elsewhere or disabled)", taskId);
        }
        return acquired;
    }
}
