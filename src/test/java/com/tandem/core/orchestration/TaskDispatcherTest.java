package com.tandem.core.orchestration;

import com.tandem.core.enforcer.DelegationEnforcer;
import com.tandem.core.enforcer.DependencyFailedException;
import com.tandem.core.enforcer.SpawnValidation;
import com.tandem.core.enforcer.SpawnValidationException;
import com.tandem.core.graph.TaskGraph;
import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.TaskSpec;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.model.WorkerType;
import com.tandem.process.ProcessLifecycleManager;
import com.tandem.process.SpawnException;
import com.tandem.process.SpawnOptions;
import com.tandem.process.WorkerProcessHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TaskDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ProcessLifecycleManager manager;
    private TaskDispatcher dispatcher;
    private DelegationEnforcer enforcer;

    @BeforeEach
    void setUp() {
        manager = mock(ProcessLifecycleManager.class);
        dispatcher = new TaskDispatcher(manager);
        var graph = TaskGraph.of(
                TaskSpec.of("research", WorkerType.DEWEY, "Find examples"),
                TaskSpec.of("docs", WorkerType.EXPLORE, "Read docs"),
                TaskSpec.of("implement", WorkerType.FRONTEND, "Build it", "research", "docs"));
        enforcer = new DelegationEnforcer(graph, Duration.ofMillis(500), true, "TNDM-T", null, null,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WorkerProcessHandle runningHandle(String agentTaskId) {
        var handle = mock(WorkerProcessHandle.class);
        when(handle.agentTaskId()).thenReturn(agentTaskId);
        when(handle.status()).thenReturn(HandleStatus.RUNNING);
        return handle;
    }

    @Test
    @DisplayName("Accepted spawn records the spawn time and links the worker")
    void acceptedSpawn() {
        var handle = runningHandle("agent_r");
        when(manager.spawn(eq(WorkerType.DEWEY), eq("payload"), any(SpawnOptions.class))).thenReturn(handle);

        String agentTaskId = dispatcher.spawnTask("research", WorkerType.DEWEY, "payload", enforcer);

        assertEquals("agent_r", agentTaskId);
        var task = enforcer.graph().getTask("research").orElseThrow();
        assertEquals(TaskStatus.RUNNING, task.status());
        assertEquals("agent_r", task.agentTaskId());
        assertEquals(NOW, task.spawnTime());
        assertEquals(NOW, enforcer.getSpawnTime("research").orElseThrow());
    }

    @Test
    @DisplayName("Spawn options carry the enforcer's session id")
    void sessionOptions() {
        var handle = runningHandle("agent_d");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenReturn(handle);

        dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer);

        verify(manager).spawn(eq(WorkerType.EXPLORE), eq("p"),
                argThat(options -> "TNDM-T".equals(options.parentSessionId())));
    }

    @Test
    @DisplayName("Rejected spawn never reaches the lifecycle manager")
    void rejectedSpawn() {
        var e = assertThrows(SpawnValidationException.class,
                () -> dispatcher.spawnTask("implement", WorkerType.FRONTEND, "p", enforcer));

        assertEquals(SpawnValidation.Rejection.UNMET_DEPENDENCIES, e.rejection());
        assertEquals("implement", e.taskId());
        verifyNoInteractions(manager);
    }

    @Test
    @DisplayName("Unknown task id is rejected before spawning")
    void unknownTask() {
        var e = assertThrows(SpawnValidationException.class,
                () -> dispatcher.spawnTask("ghost", WorkerType.GENERAL, "p", enforcer));
        assertEquals(SpawnValidation.Rejection.UNKNOWN_TASK, e.rejection());
        verifyNoInteractions(manager);
    }

    @Test
    @DisplayName("A failed dependency raises DependencyFailedException")
    void dependencyFailed() {
        var handle = runningHandle("agent_r");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenReturn(handle);
        dispatcher.spawnTask("research", WorkerType.DEWEY, "p", enforcer);
        enforcer.markTaskFailed("research");

        var e = assertThrows(DependencyFailedException.class,
                () -> dispatcher.spawnTask("implement", WorkerType.FRONTEND, "p", enforcer));
        assertEquals("research", e.failedDependency());
        verify(manager, times(1)).spawn(any(), anyString(), any(SpawnOptions.class));
    }

    @Test
    @DisplayName("Launch failure propagates and leaves the task PENDING")
    void launchFailure() {
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class)))
                .thenThrow(new SpawnException("executable missing"));

        assertThrows(SpawnException.class, () -> dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
        assertEquals(TaskStatus.PENDING, enforcer.graph().getTask("docs").orElseThrow().status());
        assertTrue(enforcer.getSpawnTime("docs").isEmpty());
    }

    @Test
    @DisplayName("A worker that already finished stays SPAWNED until its outcome is reported")
    void alreadyFinishedWorker() {
        var handle = mock(WorkerProcessHandle.class);
        when(handle.agentTaskId()).thenReturn("agent_fast");
        when(handle.status()).thenReturn(HandleStatus.COMPLETED);
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenReturn(handle);

        dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer);
        assertEquals(TaskStatus.SPAWNED, enforcer.graph().getTask("docs").orElseThrow().status());
    }

    @Test
    @DisplayName("A launch failure releases the claim so the task can be spawned again")
    void launchFailureReleasesClaim() {
        var handle = runningHandle("agent_d2");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class)))
                .thenThrow(new SpawnException("executable missing"))
                .thenReturn(handle);

        assertThrows(SpawnException.class, () -> dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
        assertTrue(enforcer.validateSpawn("docs").ok());
        assertEquals("agent_d2", dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
    }

    @Test
    @DisplayName("A second spawn of a task whose worker is still launching is rejected")
    void concurrentSpawnOfSameTask() throws Exception {
        var launching = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var handle = runningHandle("agent_once");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenAnswer(invocation -> {
            launching.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return handle;
        });

        var executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> first = executor.submit(
                    () -> dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
            assertTrue(launching.await(5, TimeUnit.SECONDS));

            var e = assertThrows(SpawnValidationException.class,
                    () -> dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
            assertEquals(SpawnValidation.Rejection.ALREADY_SPAWNED, e.rejection());

            release.countDown();
            assertEquals("agent_once", first.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        verify(manager, times(1)).spawn(any(), anyString(), any(SpawnOptions.class));
        assertEquals(TaskStatus.RUNNING, enforcer.graph().getTask("docs").orElseThrow().status());
    }

    @Test
    @DisplayName("A worker whose task failed while it launched is cancelled")
    void taskFailedWhileLaunching() {
        var handle = runningHandle("agent_orphan");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenAnswer(invocation -> {
            enforcer.markTaskFailed("docs");
            return handle;
        });

        assertThrows(IllegalStateException.class,
                () -> dispatcher.spawnTask("docs", WorkerType.EXPLORE, "p", enforcer));
        verify(manager).cancel("agent_orphan");
        assertEquals(TaskStatus.FAILED, enforcer.graph().getTask("docs").orElseThrow().status());
        assertTrue(enforcer.getSpawnTime("docs").isEmpty());
    }

    @Test
    @DisplayName("Without an enforcer the spawn is unconstrained")
    void noEnforcer() {
        var handle = runningHandle("agent_free");
        when(manager.spawn(any(), anyString(), any(SpawnOptions.class))).thenReturn(handle);

        assertEquals("agent_free", dispatcher.spawnTask("anything", WorkerType.GENERAL, "p", null));
        assertEquals("agent_free", dispatcher.spawnAdHoc(WorkerType.GENERAL, "p", "quick look"));
        verify(manager, times(2)).spawn(eq(WorkerType.GENERAL), eq("p"), any(SpawnOptions.class));
    }
}
