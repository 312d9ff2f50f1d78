package io.schedule4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedule4j.HandlerResult;
import io.schedule4j.Scheduler;
import io.schedule4j.TickOptions;
import io.schedule4j.TickResult;
import io.schedule4j.config.SchedulerProperties;
import io.schedule4j.core.HandlerRegistry;
import io.schedule4j.core.RunStatus;
import io.schedule4j.core.Schedule;
import io.schedule4j.core.ScheduleCalculator;
import io.schedule4j.core.ScheduledJob;
import io.schedule4j.utils.QuartzCronEvaluator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PollingTickTriggerTest {

    @Test
    void ticksRepeatedlyUntilStopped() {
        SchedulerProperties props = new SchedulerProperties();
        props.setProcessEvery(Duration.ofMillis(20));
        Scheduler scheduler = mock(Scheduler.class);
        when(scheduler.runDueScheduledJobs(any(TickOptions.class))).thenReturn(TickResult.empty());

        PollingTickTrigger trigger = new PollingTickTrigger(props, scheduler);
        trigger.start();
        trigger.start();
        try {
            assertTrue(trigger.isRunning());
            verify(scheduler, timeout(2000).atLeast(2)).runDueScheduledJobs(any(TickOptions.class));
        } finally {
            trigger.stop();
        }
        assertFalse(trigger.isRunning());
    }

    @Test
    void rejectsNonPositiveInterval() {
        SchedulerProperties props = new SchedulerProperties();
        props.setProcessEvery(Duration.ZERO);

        PollingTickTrigger trigger = new PollingTickTrigger(props, mock(Scheduler.class));

        assertThrows(IllegalArgumentException.class, trigger::start);
        assertFalse(trigger.isRunning());
    }

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        assertEquals(Duration.ofSeconds(2), PollingTickTrigger.backoff(1));
        assertEquals(Duration.ofSeconds(16), PollingTickTrigger.backoff(4));
        assertEquals(Duration.ofSeconds(60), PollingTickTrigger.backoff(12));
    }

    @Test
    void stopDuringTickLeavesUnreachedJobsUntouched() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        for (String taskId : List.of("a", "b", "c")) {
            store.put(ScheduledJob.builder(taskId)
                    .handlerId("slow")
                    .enabled(true)
                    .schedule(Schedule.interval(60))
                    .build());
        }
        CountDownLatch entered = new CountDownLatch(1);
        DefaultSchedulerTest.TestHandler handler = new DefaultSchedulerTest.TestHandler("slow", ctx -> {
            entered.countDown();
            Thread.sleep(5_000);
            return HandlerResult.empty();
        });
        SchedulerProperties props = new SchedulerProperties();
        props.setProcessEvery(Duration.ofHours(1));
        DefaultScheduler scheduler = new DefaultScheduler(props, store, new HandlerRegistry(List.of(handler)),
                new ScheduleCalculator(new QuartzCronEvaluator()), run -> { }, new ObjectMapper());

        PollingTickTrigger trigger = new PollingTickTrigger(props, scheduler);
        trigger.start();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        trigger.stop();

        long deadline = System.currentTimeMillis() + 2_000;
        while (store.findById("a").orElseThrow().lastRunStatus() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(RunStatus.FAILURE, store.findById("a").orElseThrow().lastRunStatus());
        assertEquals(1, handler.invocations.get());
        for (String taskId : List.of("b", "c")) {
            ScheduledJob job = store.findById(taskId).orElseThrow();
            assertNull(job.lastRunStatus());
            assertEquals(0, job.runCount());
            assertEquals(0, job.failureCount());
        }
    }

    @Test
    void restartWhileTickInFlightKeepsOnePoller() throws Exception {
        SchedulerProperties props = new SchedulerProperties();
        props.setProcessEvery(Duration.ofMillis(10));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        List<Thread> callers = new CopyOnWriteArrayList<>();
        Scheduler scheduler = mock(Scheduler.class);
        when(scheduler.runDueScheduledJobs(any(TickOptions.class))).thenAnswer(invocation -> {
            callers.add(Thread.currentThread());
            if (calls.getAndIncrement() == 0) {
                entered.countDown();
                while (true) {
                    try {
                        release.await();
                        break;
                    } catch (InterruptedException ignored) {
                        // stays busy through stop() until released
                    }
                }
            }
            return TickResult.empty();
        });

        PollingTickTrigger trigger = new PollingTickTrigger(props, scheduler);
        trigger.start();
        assertTrue(entered.await(2, TimeUnit.SECONDS));
        trigger.stop();
        trigger.start();
        try {
            release.countDown();
            verify(scheduler, timeout(2000).atLeast(6)).runDueScheduledJobs(any(TickOptions.class));
        } finally {
            trigger.stop();
        }

        Thread first = callers.get(0);
        Thread second = callers.get(1);
        assertNotNull(second);
        assertNotEquals(first, second);
        assertTrue(callers.subList(1, callers.size()).stream().allMatch(t -> t == second));
    }
}
