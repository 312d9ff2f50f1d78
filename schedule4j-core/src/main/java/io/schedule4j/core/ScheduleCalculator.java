package io.schedule4j.core;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Objects;

/**
 * Computes the scheduling state a job moves to after a run.
 *
 * <p>{@link #compute} is a pure function of its arguments (and of the {@link CronEvaluator}, which is
 * deterministic for a fixed zone). There is no backoff: a failed run keeps the normal cadence.
 */
public class ScheduleCalculator {

    private final CronEvaluator cronEvaluator;

    public ScheduleCalculator(CronEvaluator cronEvaluator) {
        this.cronEvaluator = Objects.requireNonNull(cronEvaluator, "cronEvaluator must not be null");
    }

    public ScheduleUpdate compute(ScheduledJob job, RunStatus outcome, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (!job.enabled()) {
            return ScheduleUpdate.unchanged(job.nextRunAfter());
        }

        int runCountDelta = outcome.isAttempt() ? 1 : 0;
        int failureCountDelta = outcome == RunStatus.FAILURE ? 1 : 0;

        Schedule schedule = job.schedule();
        if (schedule == null) {
            return ScheduleUpdate.disable("unknown schedule type", runCountDelta, failureCountDelta);
        }

        try {
            Instant next = nextRunAfter(schedule, now);
            return ScheduleUpdate.advance(next, runCountDelta, failureCountDelta);
        } catch (IllegalArgumentException e) {
            return ScheduleUpdate.disable(e.getMessage(), runCountDelta, failureCountDelta);
        }
    }

    /**
     * First run time of {@code schedule} after {@code from}.
     *
     * @throws IllegalArgumentException when the schedule cannot produce a run time
     */
    public Instant nextRunAfter(Schedule schedule, Instant from) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        return switch (schedule.type()) {
            case INTERVAL -> {
                long seconds = ((Schedule.Interval) schedule).seconds();
                if (seconds <= 0) {
                    throw new IllegalArgumentException("interval must be a positive number of seconds: " + seconds);
                }
                try {
                    yield from.plusSeconds(seconds);
                } catch (DateTimeException | ArithmeticException e) {
                    throw new IllegalArgumentException("interval out of range: " + seconds, e);
                }
            }
            case CRON -> {
                String expression = ((Schedule.Cron) schedule).expression();
                if (expression == null || expression.isBlank()) {
                    throw new IllegalArgumentException("cron expression is missing");
                }
                yield cronEvaluator.nextOccurrenceAfter(expression, from);
            }
        };
    }
}
