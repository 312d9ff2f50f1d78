package io.schedule4j;

import io.schedule4j.core.RunStatus;

public record ManualRunResult(
        String taskId,
        RunStatus status,
        long durationMs,
        String summary,
        String errorMessage
) {
}
