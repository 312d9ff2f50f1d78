package io.schedule4j.config;

import io.schedule4j.internal.PollingTickTrigger;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the polling trigger once the context is refreshed and stops it on shutdown.
 *
 * <p>{@link #isRunning()} reflects the trigger itself, which may give up on its own after repeated tick
 * failures.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final PollingTickTrigger trigger;

    public SchedulerLifecycle(PollingTickTrigger trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
    }

    @Override
    public void start() {
        trigger.start();
    }

    @Override
    public void stop() {
        trigger.stop();
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return trigger.isRunning();
    }

    // Last to start, first to stop: handlers may depend on any other bean.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
