package io.schedule4j.config;

import io.schedule4j.core.MissingHandlerPolicy;

import java.time.Duration;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    private boolean enabled = true;
    private Duration leaseDuration = Duration.ofSeconds(300);
    private Duration processEvery = Duration.ofSeconds(60);
    private MissingHandlerPolicy missingHandlerPolicy = MissingHandlerPolicy.DISABLE;
    private String cronZone = "UTC";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public MissingHandlerPolicy getMissingHandlerPolicy() {
        return missingHandlerPolicy;
    }

    public void setMissingHandlerPolicy(MissingHandlerPolicy missingHandlerPolicy) {
        this.missingHandlerPolicy = missingHandlerPolicy;
    }

    public String getCronZone() {
        return cronZone;
    }

    public void setCronZone(String cronZone) {
        this.cronZone = cronZone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
