package io.schedule4j.core;

import io.schedule4j.utils.QuartzCronEvaluator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:15:00Z");

    private final ScheduleCalculator calculator = new ScheduleCalculator(new QuartzCronEvaluator());

    @Test
    void successAdvancesIntervalFromNow() {
        ScheduleUpdate update = calculator.compute(job(Schedule.interval(90)), RunStatus.SUCCESS, NOW);

        assertEquals(NOW.plusSeconds(90), update.nextRunAfter());
        assertTrue(update.enabled());
        assertEquals(1, update.runCountDelta());
        assertEquals(0, update.failureCountDelta());
        assertFalse(update.forcesDisable());
    }

    @Test
    void failureKeepsCadenceAndCountsFailure() {
        ScheduleUpdate update = calculator.compute(job(Schedule.interval(90)), RunStatus.FAILURE, NOW);

        assertEquals(NOW.plusSeconds(90), update.nextRunAfter());
        assertEquals(1, update.runCountDelta());
        assertEquals(1, update.failureCountDelta());
    }

    @Test
    void skipDoesNotCountAsRun() {
        ScheduleUpdate update = calculator.compute(job(Schedule.interval(90)), RunStatus.SKIPPED, NOW);

        assertEquals(0, update.runCountDelta());
        assertEquals(0, update.failureCountDelta());
    }

    @Test
    void nonPositiveIntervalDisables() {
        ScheduleUpdate zero = calculator.compute(job(Schedule.interval(0)), RunStatus.SUCCESS, NOW);
        ScheduleUpdate negative = calculator.compute(job(Schedule.interval(-5)), RunStatus.SUCCESS, NOW);

        assertFalse(zero.enabled());
        assertNull(zero.nextRunAfter());
        assertTrue(zero.forcesDisable());
        assertFalse(negative.enabled());
        assertNull(negative.nextRunAfter());
    }

    @Test
    void cronAdvancesToNextOccurrence() {
        ScheduleUpdate update = calculator.compute(job(Schedule.cron("0 * * * *")), RunStatus.SUCCESS, NOW);

        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), update.nextRunAfter());
        assertTrue(update.enabled());
    }

    @Test
    void missingOrInvalidCronDisables() {
        ScheduleUpdate blank = calculator.compute(job(Schedule.cron("  ")), RunStatus.SUCCESS, NOW);
        ScheduleUpdate invalid = calculator.compute(job(Schedule.cron("invalid((")), RunStatus.SUCCESS, NOW);

        assertFalse(blank.enabled());
        assertEquals("cron expression is missing", blank.disabledReason());
        assertFalse(invalid.enabled());
        assertNull(invalid.nextRunAfter());
        assertTrue(invalid.forcesDisable());
    }

    @Test
    void unknownScheduleKindDisables() {
        ScheduleUpdate update = calculator.compute(job(null), RunStatus.SUCCESS, NOW);

        assertFalse(update.enabled());
        assertEquals("unknown schedule type", update.disabledReason());
    }

    @Test
    void disabledJobPassesThroughUnchanged() {
        Instant next = NOW.plusSeconds(30);
        ScheduledJob disabled = ScheduledJob.builder("off")
                .enabled(false)
                .schedule(Schedule.interval(0))
                .nextRunAfter(next)
                .build();

        ScheduleUpdate update = calculator.compute(disabled, RunStatus.SUCCESS, NOW);

        assertEquals(ScheduleUpdate.unchanged(next), update);
        assertFalse(update.forcesDisable());
    }

    @Test
    void computeIsPure() {
        ScheduledJob job = job(Schedule.cron("*/5 * * * *"));

        assertEquals(
                calculator.compute(job, RunStatus.FAILURE, NOW),
                calculator.compute(job, RunStatus.FAILURE, NOW)
        );
    }

    @Test
    void cronIsEvaluatedFromTickTime() {
        AtomicReference<Instant> from = new AtomicReference<>();
        ScheduleCalculator stubbed = new ScheduleCalculator((expression, after) -> {
            from.set(after);
            return after.plusSeconds(1);
        });

        stubbed.compute(job(Schedule.cron("* * * * *")), RunStatus.SUCCESS, NOW);

        assertEquals(NOW, from.get());
    }

    @Test
    void nextRunAfterRejectsUnusableSchedule() {
        assertThrows(IllegalArgumentException.class, () -> calculator.nextRunAfter(Schedule.interval(0), NOW));
        assertThrows(IllegalArgumentException.class, () -> calculator.nextRunAfter(Schedule.cron(null), NOW));
    }

    @Test
    void cronRestrictingBothDayFieldsDisablesWithReason() {
        ScheduleUpdate update = calculator.compute(job(Schedule.cron("0 0 1 * 1")), RunStatus.SKIPPED, NOW);

        assertTrue(update.forcesDisable());
        assertTrue(update.disabledReason().contains("day-of-month"), update.disabledReason());
        assertEquals(0, update.runCountDelta());
    }

    @Test
    void scheduleKindsAreClosed() {
        assertTrue(Schedule.class.isSealed());
        assertEquals(List.of(Schedule.Interval.class, Schedule.Cron.class),
                List.of(Schedule.class.getPermittedSubclasses()));
    }

    private static ScheduledJob job(Schedule schedule) {
        return ScheduledJob.builder("job")
                .handlerId("noop")
                .enabled(true)
                .schedule(schedule)
                .build();
    }
}
