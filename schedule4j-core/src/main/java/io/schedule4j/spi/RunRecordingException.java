package io.schedule4j.spi;

/**
 * Raised by a {@link RunRecorder} that could not persist a run entry.
 *
 * <p>Checked on purpose: callers have to decide explicitly what a lost history entry means for them.
 */
public class RunRecordingException extends Exception {

    public RunRecordingException(String message, Throwable cause) {
        super(message, cause);
    }
}
