package io.schedule4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedule4j.core.JobConflictException;
import io.schedule4j.core.JobDefinition;
import io.schedule4j.core.JobFilter;
import io.schedule4j.core.JobNotFoundException;
import io.schedule4j.core.JobUpdate;
import io.schedule4j.core.JobValidationException;
import io.schedule4j.core.Schedule;
import io.schedule4j.core.ScheduleCalculator;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.utils.QuartzCronEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultScheduledJobServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:15:00Z");

    private InMemoryJobStore store;
    private DefaultScheduledJobService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        service = new DefaultScheduledJobService(
                store,
                new ScheduleCalculator(new QuartzCronEvaluator()),
                new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void createComputesFirstRunAndDefaults() {
        ScheduledJob job = service.create(JobDefinition.builder("cleanup_upload_sessions")
                .taskId("cleanup")
                .every(3600)
                .config(Map.of("keepHours", 24))
                .build());

        assertEquals("cleanup", job.taskId());
        assertEquals("cleanup_upload_sessions", job.name());
        assertTrue(job.enabled());
        assertEquals(NOW.plusSeconds(3600), job.nextRunAfter());
        assertEquals("{\"keepHours\":24}", job.configJson());
        assertEquals(0, job.runCount());
        assertEquals(job, store.findById("cleanup").orElseThrow());
    }

    @Test
    void createWithCronUsesFirstOccurrence() {
        ScheduledJob job = service.create(JobDefinition.builder("sync").taskId("nightly").cron("0 2 * * *").build());

        assertEquals(Instant.parse("2026-01-02T02:00:00Z"), job.nextRunAfter());
    }

    @Test
    void createGeneratesTaskIdFromHandler() {
        ScheduledJob job = service.create(JobDefinition.builder("Scheduled-Sync.Copy").every(60).build());

        assertTrue(job.taskId().matches("scheduled_sync_copy_[0-9a-f]{8}"), job.taskId());
    }

    @Test
    void createRejectsInvalidInput() {
        assertThrows(JobValidationException.class,
                () -> service.create(JobDefinition.builder(" ").every(60).build()));
        assertThrows(JobValidationException.class,
                () -> service.create(JobDefinition.builder("sync").build()));
        assertThrows(JobValidationException.class,
                () -> service.create(JobDefinition.builder("sync").every(0).build()));
        assertThrows(JobValidationException.class,
                () -> service.create(JobDefinition.builder("sync").cron("invalid((").build()));
        assertTrue(store.find(JobFilter.all()).isEmpty());
    }

    @Test
    void createRejectsDuplicateTaskId() {
        service.create(JobDefinition.builder("sync").taskId("dup").every(60).build());

        assertThrows(JobConflictException.class,
                () -> service.create(JobDefinition.builder("sync").taskId("dup").every(60).build()));
    }

    @Test
    void getAndDeleteRequireExistingJob() {
        assertThrows(JobNotFoundException.class, () -> service.get("missing"));
        assertThrows(JobNotFoundException.class, () -> service.delete("missing"));

        service.create(JobDefinition.builder("sync").taskId("gone").every(60).build());
        service.delete("gone");

        assertTrue(store.findById("gone").isEmpty());
    }

    @Test
    void listFiltersByEnabledAndHandler() {
        service.create(JobDefinition.builder("sync").taskId("a").every(60).build());
        service.create(JobDefinition.builder("sync").taskId("b").every(60).enabled(false).build());
        service.create(JobDefinition.builder("cleanup").taskId("c").every(60).build());

        assertEquals(3, service.list(null).size());
        assertEquals(List.of("a", "c"), ids(service.list(new JobFilter(true, null))));
        assertEquals(List.of("a", "b"), ids(service.list(new JobFilter(null, "sync"))));
    }

    @Test
    void updateRenameKeepsSchedule() {
        ScheduledJob created = service.create(JobDefinition.builder("sync").taskId("job").every(60).build());
        store.put(created.toBuilder().nextRunAfter(NOW.plusSeconds(5)).runCount(3).build());

        ScheduledJob updated = service.update("job", JobUpdate.builder().name("Renamed").build());

        assertEquals("Renamed", updated.name());
        assertEquals(NOW.plusSeconds(5), updated.nextRunAfter());
        assertEquals(3, updated.runCount());
    }

    @Test
    void updateScheduleResetsNextRun() {
        service.create(JobDefinition.builder("sync").taskId("job").every(60).build());

        ScheduledJob updated = service.update("job", JobUpdate.builder().every(600).build());

        assertEquals(Schedule.interval(600), updated.schedule());
        assertEquals(NOW.plusSeconds(600), updated.nextRunAfter());
    }

    @Test
    void reEnableResetsNextRun() {
        ScheduledJob created = service.create(JobDefinition.builder("sync").taskId("job").every(60).build());
        store.put(created.toBuilder().enabled(false).nextRunAfter(null).build());

        ScheduledJob updated = service.update("job", JobUpdate.builder().enabled(true).build());

        assertTrue(updated.enabled());
        assertEquals(NOW.plusSeconds(60), updated.nextRunAfter());
    }

    @Test
    void updateRejectsEmptyOrInvalidChanges() {
        service.create(JobDefinition.builder("sync").taskId("job").every(60).build());

        assertThrows(JobValidationException.class, () -> service.update("job", JobUpdate.builder().build()));
        assertThrows(JobValidationException.class, () -> service.update("job", JobUpdate.builder().cron("bad((").build()));
        assertThrows(JobNotFoundException.class, () -> service.update("missing", JobUpdate.builder().name("x").build()));
    }

    @Test
    void previewListsUpcomingRuns() {
        ScheduledJob job = service.create(JobDefinition.builder("sync").taskId("job").every(60).build());

        List<Instant> runs = service.previewNextRuns(job, 3);

        assertEquals(List.of(NOW.plusSeconds(60), NOW.plusSeconds(120), NOW.plusSeconds(180)), runs);
    }

    @Test
    void previewIsEmptyForDisabledJob() {
        ScheduledJob job = service.create(JobDefinition.builder("sync").taskId("job").every(60).enabled(false).build());

        assertFalse(job.enabled());
        assertTrue(service.previewNextRuns(job, 5).isEmpty());
    }

    private static List<String> ids(List<ScheduledJob> jobs) {
        return jobs.stream().map(ScheduledJob::taskId).toList();
    }
}
