package io.schedule4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a job definition. Fields left unset keep their stored value.
 */
public final class JobUpdate {

    private final String name;
    private final String description;
    private final Boolean enabled;
    private final Schedule schedule;
    private final Map<String, Object> config;

    private JobUpdate(String name, String description, Boolean enabled, Schedule schedule, Map<String, Object> config) {
        this.name = name;
        this.description = description;
        this.enabled = enabled;
        this.schedule = schedule;
        this.config = config == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Boolean enabled() {
        return enabled;
    }

    /**
     * Replacement schedule. Setting one resets {@code nextRunAfter}.
     */
    public Schedule schedule() {
        return schedule;
    }

    public Map<String, Object> config() {
        return config;
    }

    public boolean isEmpty() {
        return name == null
                && description == null
                && enabled == null
                && schedule == null
                && config == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Boolean enabled;
        private Schedule schedule;
        private Map<String, Object> config;

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
            this.config = config;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(name, description, enabled, schedule, config);
        }
    }
}
