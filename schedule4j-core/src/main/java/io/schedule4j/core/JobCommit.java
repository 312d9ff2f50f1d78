package io.schedule4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * The final per-job write of a tick: releases the lease, stamps the last run and applies the
 * schedule update with relative counter increments.
 */
public record JobCommit(
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        ScheduleUpdate update
) {
    public JobCommit {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(update, "update must not be null");
    }
}
