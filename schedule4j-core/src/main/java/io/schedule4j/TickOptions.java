package io.schedule4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-tick options.
 *
 * @param leaseDuration how long a job stays leased to this tick before other instances may take it over
 */
public record TickOptions(Duration leaseDuration) {

    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(300);

    public TickOptions {
        Objects.requireNonNull(leaseDuration, "leaseDuration must not be null");
        if (leaseDuration.isZero() || leaseDuration.isNegative()) {
            throw new IllegalArgumentException("leaseDuration must be a positive duration");
        }
    }

    public static TickOptions defaults() {
        return new TickOptions(DEFAULT_LEASE_DURATION);
    }

    /**
     * Non-positive values fall back to the default lease duration.
     */
    public static TickOptions ofLeaseSeconds(long leaseDurationSec) {
        if (leaseDurationSec <= 0) {
            return defaults();
        }
        return new TickOptions(Duration.ofSeconds(leaseDurationSec));
    }
}
