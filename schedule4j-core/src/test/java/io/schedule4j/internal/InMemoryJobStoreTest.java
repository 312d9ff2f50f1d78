package io.schedule4j.internal;

import io.schedule4j.core.JobCommit;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.Schedule;
import io.schedule4j.core.ScheduleUpdate;
import io.schedule4j.core.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void leaseIsExclusiveUntilItExpires() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.put(job("a").build());

        assertTrue(store.tryAcquireLease("a", NOW, NOW.plusSeconds(60)));
        assertFalse(store.tryAcquireLease("a", NOW.plusSeconds(30), NOW.plusSeconds(90)));
        assertTrue(store.tryAcquireLease("a", NOW.plusSeconds(60), NOW.plusSeconds(120)));
    }

    @Test
    void leaseIsRefusedForDisabledOrMissingJob() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.put(job("off").enabled(false).build());

        assertFalse(store.tryAcquireLease("off", NOW, NOW.plusSeconds(60)));
        assertFalse(store.tryAcquireLease("missing", NOW, NOW.plusSeconds(60)));
    }

    @Test
    void commitIncrementsCountersAndClearsLease() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.put(job("a").runCount(2).failureCount(1).lockUntil(NOW.plusSeconds(60)).build());

        boolean found = store.commit("a", new JobCommit(RunStatus.FAILURE, NOW, NOW.plusSeconds(1),
                ScheduleUpdate.advance(NOW.plusSeconds(60), 1, 1)));

        ScheduledJob job = store.findById("a").orElseThrow();
        assertTrue(found);
        assertNull(job.lockUntil());
        assertEquals(3, job.runCount());
        assertEquals(2, job.failureCount());
        assertEquals(NOW.plusSeconds(60), job.nextRunAfter());
        assertEquals(RunStatus.FAILURE, job.lastRunStatus());
    }

    @Test
    void commitNeverReEnables() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.put(job("a").enabled(false).build());

        store.commit("a", new JobCommit(RunStatus.SUCCESS, NOW, NOW, ScheduleUpdate.advance(NOW.plusSeconds(60), 1, 0)));

        assertFalse(store.findById("a").orElseThrow().enabled());
    }

    @Test
    void selectDueHonoursEnabledAndNextRun() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.put(job("due").nextRunAfter(NOW).build());
        store.put(job("never-run").build());
        store.put(job("future").nextRunAfter(NOW.plusSeconds(1)).build());
        store.put(job("off").enabled(false).build());

        assertEquals(2, store.selectDue(NOW).size());
    }

    private static ScheduledJob.Builder job(String taskId) {
        return ScheduledJob.builder(taskId)
                .handlerId("noop")
                .enabled(true)
                .schedule(Schedule.interval(60));
    }
}
