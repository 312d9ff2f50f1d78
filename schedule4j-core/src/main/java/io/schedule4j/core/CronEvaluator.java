package io.schedule4j.core;

import java.time.Instant;

/**
 * Narrow contract to the cron library.
 */
@FunctionalInterface
public interface CronEvaluator {

    /**
     * Next occurrence of {@code expression} strictly after {@code after}.
     *
     * @throws IllegalArgumentException when the expression is missing, unparsable or has no future occurrence
     */
    Instant nextOccurrenceAfter(String expression, Instant after);
}
