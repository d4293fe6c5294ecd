package com.tandem.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while tasks are delegated and worker processes run.
 *
 * @param eventType event type (e.g. "worker.spawned", "task.completed", "wave.advanced")
 * @param sessionId the orchestration session this event belongs to (nullable for ad-hoc workers)
 * @param taskId    the task or agent task this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TandemEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static TandemEvent of(String eventType, String sessionId, String taskId, Map<String, Object> payload) {
        return new TandemEvent(eventType, sessionId, taskId, payload, Instant.now());
    }
}
