package io.schedule4j.core;

public class JobValidationException extends Schedule4jException {

    public JobValidationException(String message) {
        super(message);
    }
}
