package io.schedule4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedule4j.HandlerResult;
import io.schedule4j.JobContext;
import io.schedule4j.JobHandler;
import io.schedule4j.ManualRunResult;
import io.schedule4j.Scheduler;
import io.schedule4j.TickOptions;
import io.schedule4j.TickResult;
import io.schedule4j.config.SchedulerProperties;
import io.schedule4j.core.HandlerRegistry;
import io.schedule4j.core.JobCommit;
import io.schedule4j.core.JobNotFoundException;
import io.schedule4j.core.JobRun;
import io.schedule4j.core.LeaseManager;
import io.schedule4j.core.MissingHandlerPolicy;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.ScheduleCalculator;
import io.schedule4j.core.ScheduleUpdate;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.core.TriggerType;
import io.schedule4j.spi.JobStore;
import io.schedule4j.spi.RunRecorder;
import io.schedule4j.spi.RunRecordingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Store-agnostic scheduler loop.
 *
 * <p>Per due job: lease, handler lookup, schedule validation, handler run, one commit, best-effort
 * history entry. Jobs are processed one after another and independently: whatever goes wrong with one job
 * is logged and counted, and the loop moves on to the next.
 *
 * <pre>{@code
 * Scheduler scheduler = new DefaultScheduler(props, jobStore, registry, calculator, recorder, objectMapper);
 * TickResult result = scheduler.runDueScheduledJobs(TickOptions.ofLeaseSeconds(300));
 * }</pre>
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    static final String HANDLER_NOT_FOUND = "handler not found";

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final LeaseManager leaseManager;
    private final HandlerRegistry handlerRegistry;
    private final ScheduleCalculator scheduleCalculator;
    private final RunRecorder runRecorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private enum JobOutcome {
        EXECUTED,
        SKIPPED,
        FAILED
    }

    public DefaultScheduler(SchedulerProperties props,
                            JobStore jobStore,
                            HandlerRegistry handlerRegistry,
                            ScheduleCalculator scheduleCalculator,
                            RunRecorder runRecorder,
                            ObjectMapper objectMapper) {
        this(props, jobStore, handlerRegistry, scheduleCalculator, runRecorder, objectMapper, Clock.systemUTC());
    }

    public DefaultScheduler(SchedulerProperties props,
                            JobStore jobStore,
                            HandlerRegistry handlerRegistry,
                            ScheduleCalculator scheduleCalculator,
                            RunRecorder runRecorder,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.scheduleCalculator = Objects.requireNonNull(scheduleCalculator, "scheduleCalculator must not be null");
        this.runRecorder = Objects.requireNonNull(runRecorder, "runRecorder must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.leaseManager = new LeaseManager(jobStore);
    }

    @Override
    public TickResult runDueScheduledJobs(TickOptions options) {
        return tick(clock.instant(), options);
    }

    @Override
    public TickResult runDueScheduledJobs() {
        return runDueScheduledJobs(new TickOptions(props.getLeaseDuration()));
    }

    @Override
    public TickResult tick(Instant now, TickOptions options) {
        Objects.requireNonNull(now, "now must not be null");
        if (options == null) {
            options = new TickOptions(props.getLeaseDuration());
        }

        List<ScheduledJob> due = jobStore.selectDue(now);
        if (due.isEmpty()) {
            log.debug("Scheduler tick found no due jobs now={}", now);
            return TickResult.empty();
        }

        int executed = 0;
        int skipped = 0;
        int failed = 0;

        for (int i = 0; i < due.size(); i++) {
            // Unleased jobs stay due for the next tick.
            if (Thread.currentThread().isInterrupted()) {
                int remaining = due.size() - i;
                log.info("Scheduler tick interrupted now={} untouched={}", now, remaining);
                skipped += remaining;
                break;
            }

            ScheduledJob job = due.get(i);
            JobOutcome outcome;
            try {
                outcome = processJob(job, now, options.leaseDuration());
            } catch (Exception e) {
                log.error("scheduled job processing aborted taskId={} msg={}", job.taskId(), e.getMessage(), e);
                outcome = JobOutcome.FAILED;
            }

            switch (outcome) {
                case EXECUTED -> executed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        TickResult result = new TickResult(due.size(), executed, skipped, failed);
        if (result.hasActivity()) {
            log.info("Scheduler tick finished now={} due={} executed={} skipped={} failed={}",
                    now, result.dueCount(), executed, skipped, failed);
        } else {
            log.debug("Scheduler tick finished now={} due={} skipped={}", now, result.dueCount(), skipped);
        }
        return result;
    }

    private JobOutcome processJob(ScheduledJob job, Instant now, Duration leaseDuration) {
        String taskId = job.taskId();
        Instant startedAt = clock.instant();

        if (!leaseManager.acquire(taskId, now, leaseDuration)) {
            return JobOutcome.SKIPPED;
        }

        Optional<JobHandler<?>> handler = handlerRegistry.lookup(job.handlerId());
        if (handler.isEmpty()) {
            MissingHandlerPolicy policy = props.getMissingHandlerPolicy();
            log.warn("scheduled job handler not found taskId={} handlerId={} policy={}", taskId, job.handlerId(), policy);
            ScheduleUpdate update = policy == MissingHandlerPolicy.RESCHEDULE
                    ? scheduleCalculator.compute(job, RunStatus.SKIPPED, now)
                    : ScheduleUpdate.disable(HANDLER_NOT_FOUND, 0, 0);
            finish(job, RunStatus.SKIPPED, startedAt, update, HANDLER_NOT_FOUND, null, null);
            return JobOutcome.SKIPPED;
        }

        ScheduleUpdate precheck = scheduleCalculator.compute(job, RunStatus.SKIPPED, now);
        if (precheck.forcesDisable()) {
            log.warn("scheduled job disabled, unusable schedule taskId={} reason={}", taskId, precheck.disabledReason());
            finish(job, RunStatus.SKIPPED, startedAt, precheck,
                    "schedule configuration error: " + precheck.disabledReason(), null, null);
            return JobOutcome.SKIPPED;
        }

        Map<String, Object> config = parseConfig(job);

        RunStatus status;
        HandlerResult result = HandlerResult.empty();
        String errorMessage = null;
        try {
            log.debug("scheduled job started taskId={} handlerId={}", taskId, job.handlerId());
            result = execute(handler.get(), job, now, config, TriggerType.AUTO);
            status = RunStatus.SUCCESS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("scheduled job interrupted taskId={}", taskId);
            status = RunStatus.FAILURE;
            errorMessage = messageOf(e);
        } catch (Exception e) {
            log.warn("scheduled job failed taskId={} msg={}", taskId, e.getMessage(), e);
            status = RunStatus.FAILURE;
            errorMessage = messageOf(e);
        }

        ScheduleUpdate update = scheduleCalculator.compute(job, status, now);
        if (update.forcesDisable()) {
            log.warn("scheduled job disabled after run taskId={} reason={}", taskId, update.disabledReason());
        }
        finish(job, status, startedAt, update, result.summary(), errorMessage, result.details());
        return status == RunStatus.SUCCESS ? JobOutcome.EXECUTED : JobOutcome.FAILED;
    }

    private void finish(ScheduledJob job,
                        RunStatus status,
                        Instant startedAt,
                        ScheduleUpdate update,
                        String summary,
                        String errorMessage,
                        Map<String, Object> details) {
        Instant finishedAt = clock.instant();
        boolean found = jobStore.commit(job.taskId(), new JobCommit(status, startedAt, finishedAt, update));
        if (!found) {
            log.warn("scheduled job disappeared before its outcome was committed taskId={}", job.taskId());
        }

        recordRun(new JobRun(
                job.taskId(),
                status,
                TriggerType.AUTO,
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt).toMillis(),
                summary,
                errorMessage,
                details
        ));
    }

    @Override
    public ManualRunResult runNow(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        ScheduledJob job = jobStore.findById(taskId)
                .orElseThrow(() -> new JobNotFoundException("scheduled job not found: " + taskId));
        JobHandler<?> handler = handlerRegistry.getRequired(job.handlerId());

        Instant startedAt = clock.instant();
        Map<String, Object> config = parseConfig(job);

        RunStatus status;
        HandlerResult result = HandlerResult.empty();
        String errorMessage = null;
        try {
            result = execute(handler, job, startedAt, config, TriggerType.MANUAL);
            status = RunStatus.SUCCESS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = RunStatus.FAILURE;
            errorMessage = messageOf(e);
        } catch (Exception e) {
            log.warn("manual run failed taskId={} msg={}", taskId, e.getMessage(), e);
            status = RunStatus.FAILURE;
            errorMessage = messageOf(e);
        }
        Instant finishedAt = clock.instant();
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();

        if (!jobStore.recordManualRun(taskId, status, startedAt, finishedAt)) {
            log.warn("scheduled job disappeared during manual run taskId={}", taskId);
        }
        recordRun(new JobRun(
                taskId,
                status,
                TriggerType.MANUAL,
                startedAt,
                finishedAt,
                durationMs,
                result.summary(),
                errorMessage,
                result.details()
        ));

        log.info("manual run finished taskId={} status={} durationMs={}", taskId, status.value(), durationMs);
        return new ManualRunResult(taskId, status, durationMs, result.summary(), errorMessage);
    }

    private <C> HandlerResult execute(JobHandler<C> handler,
                                      ScheduledJob job,
                                      Instant now,
                                      Map<String, Object> rawConfig,
                                      TriggerType triggerType) throws Exception {
        C config = objectMapper.convertValue(rawConfig, handler.configClass());
        HandlerResult result = handler.run(new JobContext<>(job.taskId(), job.handlerId(), now, config, triggerType));
        return result == null ? HandlerResult.empty() : result;
    }

    private Map<String, Object> parseConfig(ScheduledJob job) {
        String json = job.configJson();
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, CONFIG_TYPE);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("scheduled job config is not a JSON object, using empty config taskId={} msg={}",
                    job.taskId(), e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    // History is best-effort: a lost entry never undoes the commit that precedes it.
    private void recordRun(JobRun run) {
        try {
            runRecorder.record(run);
        } catch (RunRecordingException | RuntimeException e) {
            log.warn("run history entry dropped taskId={} status={} msg={}",
                    run.taskId(), run.status().value(), e.getMessage(), e);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
