package io.schedule4j.core;

/**
 * How a job recurs. Exactly two kinds exist: a fixed interval in seconds, or a cron expression.
 *
 * <p>Values are not validated on construction: a persisted row may carry a non-positive interval or a
 * broken cron expression, and {@link ScheduleCalculator} is responsible for disabling such jobs.
 */
public sealed interface Schedule permits Schedule.Interval, Schedule.Cron {

    ScheduleType type();

    static Schedule interval(long seconds) {
        return new Interval(seconds);
    }

    static Schedule cron(String expression) {
        return new Cron(expression);
    }

    record Interval(long seconds) implements Schedule {
        @Override
        public ScheduleType type() {
            return ScheduleType.INTERVAL;
        }
    }

    record Cron(String expression) implements Schedule {
        @Override
        public ScheduleType type() {
            return ScheduleType.CRON;
        }
    }
}
