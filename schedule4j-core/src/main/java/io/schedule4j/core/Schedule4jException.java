package io.schedule4j.core;

/**
 * Base type of unchecked errors raised by the scheduler.
 */
public class Schedule4jException extends RuntimeException {

    public Schedule4jException(String message) {
        super(message);
    }

    public Schedule4jException(String message, Throwable cause) {
        super(message, cause);
    }
}
