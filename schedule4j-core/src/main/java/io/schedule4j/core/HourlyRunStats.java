package io.schedule4j.core;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Run counts grouped into contiguous one-hour buckets, oldest first.
 */
public record HourlyRunStats(int windowHours, List<Bucket> buckets) {

    public static final int DEFAULT_WINDOW_HOURS = 24;
    public static final int MAX_WINDOW_HOURS = 7 * 24;

    public record Bucket(Instant start, Instant end, int totalRuns, int success, int failure, int skipped) {
    }

    /**
     * First instant covered by a window of {@code windowHours} hours ending with the hour containing {@code now}.
     */
    public static Instant windowStart(int windowHours, Instant now) {
        Instant endHour = now.truncatedTo(ChronoUnit.HOURS);
        return endHour.minus(Duration.ofHours(clampWindow(windowHours) - 1L));
    }

    public static int clampWindow(int windowHours) {
        if (windowHours <= 0) {
            return DEFAULT_WINDOW_HOURS;
        }
        return Math.min(windowHours, MAX_WINDOW_HOURS);
    }

    /**
     * Buckets the given runs by the hour of {@code startedAt}. Runs outside the window are ignored and every
     * hour of the window gets a bucket, empty or not.
     */
    public static HourlyRunStats of(Collection<JobRun> runs, int windowHours, Instant now) {
        int window = clampWindow(windowHours);
        Instant start = windowStart(window, now);

        int[][] counts = new int[window][3];
        for (JobRun run : runs) {
            if (run.startedAt() == null || run.status() == null || run.startedAt().isBefore(start)) {
                continue;
            }
            long index = Duration.between(start, run.startedAt()).toHours();
            if (index >= window) {
                continue;
            }
            counts[(int) index][run.status().ordinal()]++;
        }

        List<Bucket> buckets = new ArrayList<>(window);
        for (int i = 0; i < window; i++) {
            Instant bucketStart = start.plus(Duration.ofHours(i));
            int success = counts[i][RunStatus.SUCCESS.ordinal()];
            int failure = counts[i][RunStatus.FAILURE.ordinal()];
            int skipped = counts[i][RunStatus.SKIPPED.ordinal()];
            buckets.add(new Bucket(
                    bucketStart,
                    bucketStart.plus(Duration.ofHours(1)),
                    success + failure + skipped,
                    success,
                    failure,
                    skipped
            ));
        }
        return new HourlyRunStats(window, List.copyOf(buckets));
    }
}
