package io.schedule4j.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Persisted discriminator for {@link Schedule} kinds.
 */
public enum ScheduleType {
    INTERVAL("interval"),
    CRON("cron");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Case-insensitive lookup of a persisted value. Unknown or blank values yield empty.
     */
    public static Optional<ScheduleType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
