package io.schedule4j.core;

public enum HandlerCategory {
    MAINTENANCE,
    BUSINESS
}
