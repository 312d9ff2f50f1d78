package io.schedule4j.internal;

import io.schedule4j.Scheduler;
import io.schedule4j.TickOptions;
import io.schedule4j.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background thread that fires {@link Scheduler#runDueScheduledJobs(TickOptions)} every
 * {@code processEvery}. Several processes may run one each against the same store; the lease keeps
 * their ticks from executing a job twice.
 */
public class PollingTickTrigger {
    private static final Logger log = LoggerFactory.getLogger(PollingTickTrigger.class);

    static final int MAX_SYSTEM_ERRORS = 30;

    private final SchedulerProperties props;
    private final Scheduler scheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread pollerThread;

    public PollingTickTrigger(SchedulerProperties props, Scheduler scheduler) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Start polling. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "schedule4j.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("schedule4j.processEvery must be a positive duration");
        }
        Duration lease = Objects.requireNonNull(props.getLeaseDuration(), "schedule4j.leaseDuration must not be null");
        if (lease.isZero() || lease.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("schedule4j.leaseDuration must be a positive duration");
        }

        log.info("Scheduler polling starting with processEvery={}, leaseDuration={}, missingHandlerPolicy={}",
                interval, lease, props.getMissingHandlerPolicy());

        Thread t = new Thread(this::pollerLoop);
        t.setName("schedule4j.poller");
        t.setDaemon(true);
        pollerThread = t;
        t.start();
        log.info("Scheduler polling started successfully.");
    }

    /**
     * Stop polling. The poller thread is interrupted; a tick in progress finishes the job it is running
     * and leaves the remaining due jobs unleased. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Scheduler polling stopping...");
        Thread t = pollerThread;
        pollerThread = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
        log.info("Scheduler polling stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void pollerLoop() {
        int systemErrorCount = 0;
        while (isCurrentPoller()) {
            try {
                scheduler.runDueScheduledJobs(new TickOptions(props.getLeaseDuration()));
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("scheduler tick failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    if (isCurrentPoller()) {
                        log.error("Scheduler polling stopped due to repeated system failures...");
                        stop();
                    }
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!isCurrentPoller()) {
                break;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // A stop followed by a start hands polling to a new thread; the old one exits after its tick.
    private boolean isCurrentPoller() {
        return started.get() && Thread.currentThread() == pollerThread;
    }

    // Exponential backoff for repeated tick failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
