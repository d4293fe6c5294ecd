package com.tandem.core.orchestration;

import com.tandem.core.enforcer.DelegationEnforcer;
import com.tandem.core.enforcer.DependencyFailedException;
import com.tandem.core.enforcer.SpawnValidation;
import com.tandem.core.enforcer.SpawnValidationException;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.model.HandleStatus;
import com.tandem.core.model.WorkerType;
import com.tandem.process.ProcessLifecycleManager;
import com.tandem.process.SpawnOptions;
import com.tandem.process.WorkerProcessHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * The single call through which work is handed to a worker process.
 *
 * <p>With an enforcer, the task is validated and claimed first, so a rejection never reaches the
 * {@link ProcessLifecycleManager} and concurrent calls for one task launch at most one worker. After a successful spawn the enforcer records the spawn
 * time taken from its own clock. Without an enforcer the spawn is unconstrained.
 */
@Service
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ProcessLifecycleManager manager;

    public TaskDispatcher(ProcessLifecycleManager manager) {
        this.manager = manager;
    }

    public ProcessLifecycleManager manager() {
        return manager;
    }

    public String spawnTask(String taskId, WorkerType workerType, String payload,
                            @Nullable DelegationEnforcer enforcer) {
        String sessionId = enforcer != null ? enforcer.sessionId() : null;
        return spawnTask(taskId, workerType, payload, enforcer, SpawnOptions.forSession(sessionId, taskId));
    }

    /**
     * Spawns a worker for a task.
     *
     * @return the agent task id of the new worker
     * @throws SpawnValidationException               if the enforcer rejects the task; a
     *                                                {@link DependencyFailedException}
     *                                                when a dependency failed
     * @throws com.tandem.process.SpawnException      if the process could not be started
     */
    public String spawnTask(String taskId, WorkerType workerType, String payload,
                            @Nullable DelegationEnforcer enforcer, SpawnOptions options) {
        MdcContext.setTask(options.parentSessionId(), taskId, workerType.tag());
        try {
            if (enforcer == null) {
                return manager.spawn(workerType, payload, options).agentTaskId();
            }

            SpawnValidation validation = enforcer.reserveSpawn(taskId);
            if (!validation.ok()) {
                log.info("Spawn of {} rejected: {}", taskId, validation.reason());
                if (validation.rejection() == SpawnValidation.Rejection.DEPENDENCY_FAILED) {
                    String failedDependency = enforcer.getFailureCause(taskId)
                            .map(DependencyFailedException::failedDependency)
                            .orElseGet(() -> enforcer.graph().failedDependencies(taskId).stream()
                                    .findFirst().orElse(null));
                    if (failedDependency != null) {
                        throw new DependencyFailedException(taskId, failedDependency);
                    }
                }
                throw new SpawnValidationException(taskId, validation);
            }

            WorkerProcessHandle handle;
            try {
                handle = manager.spawn(workerType, payload, options);
            } catch (RuntimeException e) {
                enforcer.releaseSpawn(taskId);
                throw e;
            }
            try {
                enforcer.recordSpawn(taskId, handle.agentTaskId(), enforcer.clock().instant());
            } catch (RuntimeException e) {
                // The task left PENDING while its worker was launching
                log.warn("Task {} could not be linked to {}, cancelling it: {}", taskId, handle.agentTaskId(),
                        e.getMessage());
                enforcer.releaseSpawn(taskId);
                manager.cancel(handle.agentTaskId());
                throw e;
            }
            if (handle.status() == HandleStatus.RUNNING) {
                enforcer.markTaskRunning(taskId);
            }
            log.debug("Task {} spawned as {}", taskId, handle.agentTaskId());
            return handle.agentTaskId();
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Spawns work that belongs to no task graph.
     */
    public String spawnAdHoc(WorkerType workerType, String payload, String description) {
        return manager.spawn(workerType, payload, SpawnOptions.forSession(null, description)).agentTaskId();
    }
}
