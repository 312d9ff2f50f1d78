package io.schedule4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the run history.
 */
public record JobRun(
        String taskId,
        RunStatus status,
        TriggerType triggerType,
        Instant startedAt,
        Instant finishedAt,
        Long durationMs,
        String summary,
        String errorMessage,
        Map<String, Object> details
) {
}
