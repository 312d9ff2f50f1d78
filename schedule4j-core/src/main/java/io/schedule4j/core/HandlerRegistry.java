package io.schedule4j.core;

import io.schedule4j.JobHandler;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable lookup of handlers by id, built once from the handlers supplied at construction.
 */
public class HandlerRegistry {

    private final Map<String, JobHandler<?>> handlersById;

    public HandlerRegistry(List<? extends JobHandler<?>> handlers) {
        handlers.forEach(HandlerRegistry::validate);
        this.handlersById = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::id,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler id: " + a.id());
                        }
                ));
    }

    private static void validate(JobHandler<?> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (handler.id() == null || handler.id().isBlank()) {
            throw new IllegalArgumentException("handler id must not be blank");
        }
        if (handler.name() == null || handler.name().isBlank()) {
            throw new IllegalArgumentException("handler name must not be blank (id=" + handler.id() + ")");
        }
        if (handler.category() == null) {
            throw new IllegalArgumentException("handler category must not be null (id=" + handler.id() + ")");
        }
    }

    public Optional<JobHandler<?>> lookup(String handlerId) {
        if (handlerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlersById.get(handlerId));
    }

    public JobHandler<?> getRequired(String handlerId) {
        return lookup(handlerId)
                .orElseThrow(() -> new JobNotFoundException("No JobHandler registered for id: " + handlerId));
    }

    public Optional<HandlerDescriptor> describe(String handlerId) {
        return lookup(handlerId).map(HandlerRegistry::toDescriptor);
    }

    /**
     * Metadata of all registered handlers, ordered by id.
     */
    public List<HandlerDescriptor> describeAll() {
        return handlersById.values().stream()
                .map(HandlerRegistry::toDescriptor)
                .sorted(Comparator.comparing(HandlerDescriptor::id))
                .toList();
    }

    private static HandlerDescriptor toDescriptor(JobHandler<?> h) {
        return new HandlerDescriptor(
                h.id(),
                h.name(),
                h.description() == null ? "" : h.description(),
                h.category()
        );
    }
}
