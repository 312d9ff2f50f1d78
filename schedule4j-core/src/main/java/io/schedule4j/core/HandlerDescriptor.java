package io.schedule4j.core;

/**
 * Read-only metadata about a registered handler.
 */
public record HandlerDescriptor(
        String id,
        String name,
        String description,
        HandlerCategory category
) {
}
