package io.schedule4j;

import java.util.Map;

/**
 * What a handler reports back after a successful run. Both fields are optional.
 */
public record HandlerResult(String summary, Map<String, Object> details) {

    public static HandlerResult empty() {
        return new HandlerResult(null, null);
    }

    public static HandlerResult of(String summary) {
        return new HandlerResult(summary, null);
    }

    public static HandlerResult of(String summary, Map<String, Object> details) {
        return new HandlerResult(summary, details == null ? null : Map.copyOf(details));
    }
}
