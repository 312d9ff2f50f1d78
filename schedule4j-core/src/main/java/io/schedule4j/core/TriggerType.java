package io.schedule4j.core;

import java.util.Locale;

/**
 * What started a run: the periodic tick or an operator.
 */
public enum TriggerType {
    AUTO("auto"),
    MANUAL("manual");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Unknown or blank values fall back to {@link #AUTO}.
     */
    public static TriggerType fromValue(String raw) {
        if (raw != null && MANUAL.value.equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return MANUAL;
        }
        return AUTO;
    }
}
