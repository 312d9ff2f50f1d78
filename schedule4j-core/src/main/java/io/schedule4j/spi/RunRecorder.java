package io.schedule4j.spi;

import io.schedule4j.core.JobRun;

/**
 * Append-only sink for run history entries.
 */
@FunctionalInterface
public interface RunRecorder {

    void record(JobRun run) throws RunRecordingException;

    static RunRecorder noop() {
        return run -> {
        };
    }
}
