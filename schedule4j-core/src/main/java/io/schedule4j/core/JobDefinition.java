package io.schedule4j.core;

import java.util.Map;
import java.util.Objects;

/**
 * Input for creating a job. Validation happens when the definition is saved, not here.
 */
public record JobDefinition(
        String taskId,
        String handlerId,
        String name,
        String description,
        boolean enabled,
        Schedule schedule,
        Map<String, Object> config
) {

    public static Builder builder(String handlerId) {
        return new Builder(handlerId);
    }

    /**
     * Fluent builder. Jobs are enabled by default and carry an empty config.
     */
    public static final class Builder {
        private final String handlerId;
        private String taskId;
        private String name;
        private String description;
        private boolean enabled = true;
        private Schedule schedule;
        private Map<String, Object> config = Map.of();

        private Builder(String handlerId) {
            this.handlerId = handlerId;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Repeat every {@code seconds} seconds.
         */
        public Builder every(long seconds) {
            this.schedule = Schedule.interval(seconds);
            return this;
        }

        public Builder cron(String expression) {
            this.schedule = Schedule.cron(expression);
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(taskId, handlerId, name, description, enabled, schedule, config);
        }
    }
}
