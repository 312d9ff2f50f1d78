package io.schedule4j.utils;

import io.schedule4j.core.CronEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * {@link CronEvaluator} backed by Quartz, evaluating expressions in a fixed zone.
 */
public class QuartzCronEvaluator implements CronEvaluator {

    private final ZoneId zone;

    public QuartzCronEvaluator() {
        this(ZoneOffset.UTC);
    }

    public QuartzCronEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public Instant nextOccurrenceAfter(String expression, Instant after) {
        return CronExpressions.nextOccurrenceAfter(expression, zone, after);
    }

    public ZoneId zone() {
        return zone;
    }
}
