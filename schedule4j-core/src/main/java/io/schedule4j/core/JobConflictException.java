package io.schedule4j.core;

public class JobConflictException extends Schedule4jException {

    public JobConflictException(String message) {
        super(message);
    }
}
