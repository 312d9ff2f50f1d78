package io.schedule4j.core;

public class JobNotFoundException extends Schedule4jException {

    public JobNotFoundException(String message) {
        super(message);
    }
}
