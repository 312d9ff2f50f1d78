package io.schedule4j.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of one execution attempt.
 */
public enum RunStatus {
    SUCCESS("success"),
    FAILURE("failure"),
    SKIPPED("skipped");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether this outcome counts as an attempted execution (and so bumps {@code runCount}).
     */
    public boolean isAttempt() {
        return this == SUCCESS || this == FAILURE;
    }

    public static Optional<RunStatus> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RunStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
