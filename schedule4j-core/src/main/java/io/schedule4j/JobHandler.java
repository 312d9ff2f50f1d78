package io.schedule4j;

import io.schedule4j.core.HandlerCategory;

import java.util.Map;

/**
 * Pluggable unit of business logic a scheduled job runs.
 *
 * <p>A handler may run again while a previous invocation is still in progress if that invocation outlives
 * the lease duration, so implementations should be idempotent or finish well within the lease.
 *
 * @param <C> type the stored job configuration is converted to
 */
public interface JobHandler<C> {

    /**
     * Identifier jobs reference through {@code handlerId}.
     */
    String id();

    String name();

    default String description() {
        return "";
    }

    HandlerCategory category();

    /**
     * Target type of the job configuration document. Defaults to the raw {@code Map}.
     */
    @SuppressWarnings("unchecked")
    default Class<C> configClass() {
        return (Class<C>) (Class<?>) Map.class;
    }

    /**
     * Runs the job. Throwing marks the run as failed; the job keeps its schedule.
     *
     * @return optional summary, may be null
     */
    HandlerResult run(JobContext<C> context) throws Exception;
}
