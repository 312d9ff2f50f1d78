package io.schedule4j.core;

/**
 * Wraps a failure of the underlying job store.
 */
public class JobStoreException extends Schedule4jException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
