package com.tandem.process;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.WorkerType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProcessLifecycleManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private ProcessLifecycleManager manager;

    @BeforeEach
    void setUp() {
        manager = new ProcessLifecycleManager(ProcessTestSupport.shellLauncher(), Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Nested
    @DisplayName("spawn and getOutput")
    class SpawnAndOutput {

        @Test
        @DisplayName("spawn returns before the worker finishes")
        void spawnDoesNotBlock() {
            long start = System.nanoTime();
            var handle = manager.spawn(WorkerType.EXPLORE, "sleep 2; echo done");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 1500, "spawn took " + elapsedMs + "ms");
            assertEquals(HandleStatus.RUNNING, handle.status());
            assertTrue(handle.agentTaskId().startsWith("agent_"));
            manager.cancel(handle.agentTaskId());
        }

        @Test
        @DisplayName("Blocking getOutput waits for the worker and returns its output")
        void blockingOutput() {
            var handle = manager.spawn(WorkerType.EXPLORE, "sleep 0.2; echo X");

            var output = manager.getOutput(handle.agentTaskId(), true);
            assertEquals(HandleStatus.COMPLETED, output.status());
            assertEquals("X\n", output.output());
            assertEquals(0, output.exitCode());
            assertTrue(output.isTerminal());
        }

        @Test
        @DisplayName("Non-blocking getOutput returns a running snapshot")
        void nonBlockingOutput() {
            var handle = manager.spawn(WorkerType.EXPLORE, "sleep 5");

            var output = manager.getOutput(handle.agentTaskId(), false);
            assertEquals(HandleStatus.RUNNING, output.status());
            assertNull(output.exitCode());
            manager.cancel(handle.agentTaskId());
        }

        @Test
        @DisplayName("Bounded getOutput gives up after the timeout")
        void boundedOutput() {
            var handle = manager.spawn(WorkerType.EXPLORE, "sleep 5");

            var output = manager.getOutput(handle.agentTaskId(), true, Duration.ofMillis(200));
            assertFalse(output.isTerminal());
            manager.cancel(handle.agentTaskId());
        }

        @Test
        @DisplayName("Non-zero exit marks the handle FAILED with its exit code")
        void failedExit() {
            var handle = manager.spawn(WorkerType.EXPLORE, "echo broken; exit 3");

            var output = manager.getOutput(handle.agentTaskId(), true);
            assertEquals(HandleStatus.FAILED, output.status());
            assertEquals(3, output.exitCode());
            assertEquals("broken\n", output.output());
        }

        @Test
        @DisplayName("Concurrent workers do not wait on each other")
        void concurrentWorkers() {
            var slow = manager.spawn(WorkerType.EXPLORE, "sleep 5");
            var fast = manager.spawn(WorkerType.EXPLORE, "echo fast");

            var output = manager.getOutput(fast.agentTaskId(), true, WAIT);
            assertEquals(HandleStatus.COMPLETED, output.status());
            assertEquals(HandleStatus.RUNNING, slow.status());
            manager.cancel(slow.agentTaskId());
        }

        @Test
        @DisplayName("Unknown agent task id raises HandleNotFoundException")
        void unknownHandle() {
            var e = assertThrows(HandleNotFoundException.class, () -> manager.getOutput("agent_missing", false));
            assertEquals("agent_missing", e.agentTaskId());
        }

        @Test
        @DisplayName("Launch failure is reported synchronously and nothing is registered")
        void launchFailure() {
            var properties = new TandemProperties();
            properties.getWorker().getRoutes().put(TandemProperties.DEFAULT_ROUTE,
                    new TandemProperties.Route(List.of("/nonexistent/tandem-worker-binary"), java.util.Map.of()));
            var registry = new SimpleMeterRegistry();
            var failing = new ProcessLifecycleManager(new CommandLineWorkerLauncher(properties), Duration.ofSeconds(1),
                    new EventBus(), new TandemMetrics(registry), Clock.systemUTC());

            assertThrows(SpawnException.class, () -> failing.spawn(WorkerType.EXPLORE, "x"));
            assertTrue(failing.listHandles().isEmpty());
            assertEquals(1.0, registry.find("tandem.worker.spawn_failures").counter().count());
            failing.shutdown();
        }

        @Test
        @DisplayName("Unexpected launcher errors are wrapped in SpawnException")
        void launcherErrorWrapped() {
            var launcher = mock(WorkerLauncher.class);
            when(launcher.launch(any())).thenThrow(new IllegalStateException("boom"));
            var broken = new ProcessLifecycleManager(launcher, Duration.ofSeconds(1));

            var e = assertThrows(SpawnException.class, () -> broken.spawn(WorkerType.DELPHI, "x"));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            broken.shutdown();
        }
    }

    @Nested
    @DisplayName("Progress")
    class Progress {

        @Test
        @DisplayName("getProgress returns the last lines and elapsed time")
        void progressTail() {
            var handle = manager.spawn(WorkerType.EXPLORE, "for i in 1 2 3 4 5; do echo line$i; done");
            manager.getOutput(handle.agentTaskId(), true, WAIT);

            var progress = manager.getProgress(handle.agentTaskId(), 2);
            assertEquals(List.of("line4", "line5"), progress.recentLines());
            assertEquals(5, progress.totalLines());
            assertEquals(HandleStatus.COMPLETED, progress.status());
            assertFalse(progress.elapsed().isNegative());
        }

        @Test
        @DisplayName("Elapsed time of a running worker follows the manager's clock")
        void elapsedUsesManagerClock() {
            var clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
            var fixed = new ProcessLifecycleManager(ProcessTestSupport.shellLauncher(), Duration.ofSeconds(1),
                    new EventBus(), new TandemMetrics(new SimpleMeterRegistry()), clock);
            try {
                var handle = fixed.spawn(WorkerType.EXPLORE, "sleep 30");

                assertEquals(HandleStatus.RUNNING, handle.status());
                assertEquals(clock.instant(), handle.startTime());
                assertEquals(Duration.ZERO, fixed.getProgress(handle.agentTaskId(), 5).elapsed());
            } finally {
                fixed.shutdown();
            }
        }

        @Test
        @DisplayName("Progress of a worker that printed nothing is empty")
        void emptyProgress() {
            var handle = manager.spawn(WorkerType.EXPLORE, "true");
            manager.getOutput(handle.agentTaskId(), true, WAIT);

            assertTrue(manager.getProgress(handle.agentTaskId(), 10).recentLines().isEmpty());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel terminates a running worker once; the second call is a no-op")
        void cancelOnce() throws Exception {
            var handle = manager.spawn(WorkerType.EXPLORE, "sleep 30");

            assertTrue(manager.cancel(handle.agentTaskId()));
            assertFalse(manager.cancel(handle.agentTaskId()));
            assertEquals(HandleStatus.CANCELLED, handle.status());
            assertTrue(handle.process().onExit().get(5, TimeUnit.SECONDS) != null);
        }

        @Test
        @DisplayName("Blocking getOutput on a cancelled handle returns at once")
        void outputAfterCancel() {
            var handle = manager.spawn(WorkerType.EXPLORE, "echo partial; sleep 30");
            manager.cancel(handle.agentTaskId());

            var output = manager.getOutput(handle.agentTaskId(), true, WAIT);
            assertEquals(HandleStatus.CANCELLED, output.status());
        }

        @Test
        @DisplayName("Cancelling a finished worker changes nothing")
        void cancelFinished() {
            var handle = manager.spawn(WorkerType.EXPLORE, "echo ok");
            manager.getOutput(handle.agentTaskId(), true, WAIT);

            assertFalse(manager.cancel(handle.agentTaskId()));
            assertEquals(HandleStatus.COMPLETED, handle.status());
        }

        @Test
        @DisplayName("A worker ignoring SIGTERM is killed after the grace period")
        void escalation() throws Exception {
            var handle = manager.spawn(WorkerType.EXPLORE, "trap '' TERM; sleep 30");
            Thread.sleep(200);

            manager.cancel(handle.agentTaskId());
            assertNotNull(handle.process().onExit().get(10, TimeUnit.SECONDS));
            assertFalse(handle.process().isAlive());
        }

        @Test
        @DisplayName("stopAll cancels only running workers")
        void stopAll() {
            var done = manager.spawn(WorkerType.EXPLORE, "echo ok");
            manager.getOutput(done.agentTaskId(), true, WAIT);
            manager.spawn(WorkerType.EXPLORE, "sleep 30");
            manager.spawn(WorkerType.EXPLORE, "sleep 30");

            assertEquals(2, manager.stopAll());
            assertTrue(manager.listHandles().stream().allMatch(WorkerProcessHandle::isTerminal));
        }
    }

    @Nested
    @DisplayName("Registry management")
    class Registry {

        @Test
        @DisplayName("retry spawns the same work under a new id")
        void retry() {
            var original = manager.spawn(WorkerType.EXPLORE, "echo again; exit 1",
                    SpawnOptions.forSession("TNDM-1", "flaky"));
            manager.getOutput(original.agentTaskId(), true, WAIT);

            var retried = manager.retry(original.agentTaskId());
            assertNotEquals(original.agentTaskId(), retried.agentTaskId());
            assertEquals(original.payload(), retried.payload());
            assertEquals("TNDM-1", retried.parentSessionId());
            assertTrue(retried.description().startsWith("Retry of " + original.agentTaskId()));
            assertEquals("again\n", manager.getOutput(retried.agentTaskId(), true, WAIT).output());
        }

        @Test
        @DisplayName("retry and discard refuse running workers")
        void refuseRunning() {
            var running = manager.spawn(WorkerType.EXPLORE, "sleep 30");
            assertThrows(IllegalStateException.class, () -> manager.retry(running.agentTaskId()));
            assertThrows(IllegalStateException.class, () -> manager.discard(running.agentTaskId()));
            manager.cancel(running.agentTaskId());
        }

        @Test
        @DisplayName("discard removes a finished handle and its output")
        void discard() {
            var handle = manager.spawn(WorkerType.EXPLORE, "echo bye");
            manager.getOutput(handle.agentTaskId(), true, WAIT);

            assertTrue(manager.discard(handle.agentTaskId()));
            assertTrue(manager.getHandle(handle.agentTaskId()).isEmpty());
            assertThrows(HandleNotFoundException.class, () -> manager.getOutput(handle.agentTaskId(), false));
        }

        @Test
        @DisplayName("listHandles filters by parent session")
        void listBySession() {
            var a = manager.spawn(WorkerType.EXPLORE, "true", SpawnOptions.forSession("TNDM-A", "a"));
            manager.spawn(WorkerType.EXPLORE, "true", SpawnOptions.forSession("TNDM-B", "b"));
            manager.spawn(WorkerType.EXPLORE, "true");

            assertEquals(List.of(a.agentTaskId()),
                    manager.listHandles("TNDM-A").stream().map(WorkerProcessHandle::agentTaskId).toList());
            assertEquals(3, manager.listHandles().size());
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("Completion listeners fire once per handle")
        void completionListener() throws Exception {
            var latch = new CountDownLatch(1);
            var seen = new CopyOnWriteArrayList<String>();
            manager.addCompletionListener(h -> {
                seen.add(h.agentTaskId());
                latch.countDown();
            });

            var handle = manager.spawn(WorkerType.EXPLORE, "echo hi");
            assertTrue(latch.await(10, TimeUnit.SECONDS));
            manager.cancel(handle.agentTaskId());

            assertEquals(List.of(handle.agentTaskId()), seen);
        }

        @Test
        @DisplayName("A throwing listener does not break the others")
        void throwingListener() throws Exception {
            var latch = new CountDownLatch(1);
            manager.addCompletionListener(h -> {
                throw new IllegalStateException("listener bug");
            });
            manager.addCompletionListener(h -> latch.countDown());

            manager.spawn(WorkerType.EXPLORE, "true");
            assertTrue(latch.await(10, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Spawn and exit events are published with the parent session")
        void events() throws Exception {
            var bus = new EventBus();
            var events = new CopyOnWriteArrayList<TandemEvent>();
            var exited = new CountDownLatch(1);
            bus.subscribe("TNDM-EV", e -> {
                events.add(e);
                if (e.eventType().equals("worker.exited")) {
                    exited.countDown();
                }
            });
            var registry = new SimpleMeterRegistry();
            var observed = new ProcessLifecycleManager(ProcessTestSupport.shellLauncher(), Duration.ofSeconds(1),
                    bus, new TandemMetrics(registry), Clock.systemUTC());

            var handle = observed.spawn(WorkerType.DEWEY, "exit 2", SpawnOptions.forSession("TNDM-EV", "x"));
            assertTrue(exited.await(10, TimeUnit.SECONDS));

            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("worker.spawned")));
            var exit = events.stream().filter(e -> e.eventType().equals("worker.exited")).findFirst().orElseThrow();
            assertEquals(handle.agentTaskId(), exit.taskId());
            assertEquals("FAILED", exit.payload().get("status"));
            assertEquals(2, exit.payload().get("exitCode"));
            assertEquals(1.0, registry.find("tandem.worker.spawns").tag("worker", "dewey").counter().count());
            observed.shutdown();
        }
    }
}
