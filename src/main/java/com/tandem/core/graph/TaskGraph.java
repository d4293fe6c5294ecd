package com.tandem.core.graph;

import com.tandem.core.model.TaskSpec;
import com.tandem.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Directed acyclic graph of declared tasks plus its partition into waves.
 *
 * <p>Waves are the earliest-possible layering of the graph: wave 0 holds every task
 * without dependencies, and each later wave holds the tasks whose dependencies all
 * sit in earlier waves. Tasks within one wave are mutually independent and are
 * expected to be spawned together.
 *
 * <p>The structure is fixed once constructed. Only task status changes, through
 * the {@code mark*} methods, which are safe to call from concurrent threads.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final Map<String, Task> tasks;
    private final List<Set<String>> waves;
    private final Map<String, Integer> waveIndex;
    private final Map<String, List<String>> directDependents;
    private final Object lock = new Object();

    /**
     * Builds a graph from task specifications.
     *
     * @throws IllegalArgumentException   if two specifications share an id
     * @throws UnknownDependencyException if a dependency names an undeclared task
     * @throws CycleDetectedException     if the dependencies form a cycle
     */
    public TaskGraph(Collection<TaskSpec> specs) {
        var byId = new LinkedHashMap<String, Task>();
        for (var spec : specs) {
            if (byId.putIfAbsent(spec.id(), new Task(spec)) != null) {
                throw new IllegalArgumentException("Duplicate task id: " + spec.id());
            }
        }
        for (var task : byId.values()) {
            for (var dep : task.dependencies()) {
                if (!byId.containsKey(dep)) {
                    throw new UnknownDependencyException(task.id(), dep);
                }
            }
        }
        var cycle = findCycle(byId);
        if (cycle != null) {
            throw new CycleDetectedException(cycle);
        }

        this.tasks = Collections.unmodifiableMap(byId);
        this.waves = computeWaves(byId);
        var index = new HashMap<String, Integer>();
        for (int i = 0; i < waves.size(); i++) {
            for (var id : waves.get(i)) {
                index.put(id, i);
            }
        }
        this.waveIndex = Collections.unmodifiableMap(index);
        var reverse = new HashMap<String, List<String>>();
        for (var task : byId.values()) {
            for (var dep : task.dependencies()) {
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }
        this.directDependents = reverse;

        log.info("Task graph built: {} tasks in {} waves", tasks.size(), waves.size());
        for (int i = 0; i < waves.size(); i++) {
            log.debug("  wave {}: {}", i + 1, waves.get(i));
        }
    }

    public static TaskGraph of(TaskSpec... specs) {
        return new TaskGraph(List.of(specs));
    }

    /** All tasks, in declaration order. */
    public Collection<Task> tasks() {
        return tasks.values();
    }

    public Optional<Task> getTask(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public boolean contains(String id) {
        return tasks.containsKey(id);
    }

    public int size() {
        return tasks.size();
    }

    /** Ordered, pairwise-disjoint waves of task ids. */
    public List<Set<String>> waves() {
        return waves;
    }

    public int waveCount() {
        return waves.size();
    }

    /**
     * @return zero-based wave index of the task, or -1 if the id is unknown
     */
    public int waveIndexOf(String id) {
        return waveIndex.getOrDefault(id, -1);
    }

    /**
     * Tasks of the given wave that are still {@link TaskStatus#PENDING}. Pure query.
     */
    public List<Task> getReadyTasks(int wave) {
        if (wave < 0 || wave >= waves.size()) {
            return List.of();
        }
        return waves.get(wave).stream()
                .map(tasks::get)
                .filter(t -> t.status() == TaskStatus.PENDING)
                .toList();
    }

    public List<Task> getWaveTasks(int wave) {
        if (wave < 0 || wave >= waves.size()) {
            return List.of();
        }
        return waves.get(wave).stream().map(tasks::get).toList();
    }

    public boolean isWaveTerminal(int wave) {
        return getWaveTasks(wave).stream().allMatch(t -> t.status().isTerminal());
    }

    /** Dependencies of the task that have not reached {@link TaskStatus#COMPLETED}. */
    public List<String> unmetDependencies(String id) {
        return require(id).dependencies().stream()
                .filter(dep -> tasks.get(dep).status() != TaskStatus.COMPLETED)
                .toList();
    }

    /** Dependencies of the task that ended {@link TaskStatus#FAILED}. */
    public List<String> failedDependencies(String id) {
        return require(id).dependencies().stream()
                .filter(dep -> tasks.get(dep).status() == TaskStatus.FAILED)
                .toList();
    }

    /** Every task that directly or transitively depends on the given task, in declaration order. */
    public List<String> dependentsOf(String id) {
        require(id);
        var reached = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(id);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            for (var dependent : directDependents.getOrDefault(current, List.of())) {
                if (reached.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return tasks.keySet().stream().filter(reached::contains).toList();
    }

    /**
     * PENDING -> SPAWNED, linking the task to its worker process.
     *
     * @throws IllegalStateException if the task is not PENDING
     */
    public void markSpawned(String id, String agentTaskId, Instant spawnTime) {
        var task = require(id);
        synchronized (lock) {
            if (task.status() != TaskStatus.PENDING) {
                throw new IllegalStateException("Task " + id + " cannot be spawned from status " + task.status());
            }
            task.recordSpawn(agentTaskId, spawnTime);
        }
        log.debug("Task {} spawned as {}", id, agentTaskId);
    }

    /**
     * SPAWNED -> RUNNING. Has no effect from any other status.
     *
     * @return true if the status changed
     */
    public boolean markRunning(String id) {
        var task = require(id);
        synchronized (lock) {
            if (task.status() != TaskStatus.SPAWNED) {
                return false;
            }
            task.setStatus(TaskStatus.RUNNING);
        }
        return true;
    }

    /**
     * Moves a non-terminal task to COMPLETED. Repeated calls on a terminal task are no-ops.
     *
     * @return true if the status changed
     */
    public boolean markCompleted(String id) {
        return markTerminal(id, TaskStatus.COMPLETED);
    }

    /**
     * Moves a non-terminal task to FAILED. Repeated calls on a terminal task are no-ops.
     *
     * @return true if the status changed
     */
    public boolean markFailed(String id) {
        return markTerminal(id, TaskStatus.FAILED);
    }

    private boolean markTerminal(String id, TaskStatus target) {
        var task = require(id);
        synchronized (lock) {
            if (task.status().isTerminal()) {
                log.debug("Task {} already {}, ignoring {}", id, task.status(), target);
                return false;
            }
            task.setStatus(target);
        }
        log.debug("Task {} -> {}", id, target);
        return true;
    }

    private Task require(String id) {
        var task = tasks.get(id);
        if (task == null) {
            throw new NoSuchElementException("Unknown task: " + id);
        }
        return task;
    }

    /**
     * Depth-first search for a back edge, with an explicit stack so long chains cannot overflow.
     *
     * @return the cycle as a path that starts and ends with the same id, or null if acyclic
     */
    private static List<String> findCycle(Map<String, Task> byId) {
        var visited = new HashSet<String>();
        var onPath = new LinkedHashSet<String>();
        var stack = new ArrayDeque<Map.Entry<String, Iterator<String>>>();
        for (var root : byId.keySet()) {
            if (!visited.add(root)) {
                continue;
            }
            onPath.add(root);
            stack.push(Map.entry(root, byId.get(root).dependencies().iterator()));
            while (!stack.isEmpty()) {
                var frame = stack.peek();
                if (!frame.getValue().hasNext()) {
                    onPath.remove(frame.getKey());
                    stack.pop();
                    continue;
                }
                var dep = frame.getValue().next();
                if (onPath.contains(dep)) {
                    var path = new ArrayList<>(onPath);
                    var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                    cycle.add(dep);
                    return cycle;
                }
                if (visited.add(dep)) {
                    onPath.add(dep);
                    stack.push(Map.entry(dep, byId.get(dep).dependencies().iterator()));
                }
            }
        }
        return null;
    }

    /**
     * Kahn-style layering: a task's wave is one past the latest wave among its dependencies.
     * Within a wave, tasks keep their declaration order.
     */
    private static List<Set<String>> computeWaves(Map<String, Task> byId) {
        var remaining = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        var level = new HashMap<String, Integer>();
        var queue = new ArrayDeque<String>();
        for (var task : byId.values()) {
            remaining.put(task.id(), task.dependencies().size());
            for (var dep : task.dependencies()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
            if (task.dependencies().isEmpty()) {
                level.put(task.id(), 0);
                queue.add(task.id());
            }
        }
        int waveCount = 0;
        while (!queue.isEmpty()) {
            var id = queue.poll();
            int next = level.get(id) + 1;
            waveCount = Math.max(waveCount, next);
            for (var dependent : dependents.getOrDefault(id, List.of())) {
                level.merge(dependent, next, Math::max);
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }
        if (level.size() < byId.size() || remaining.values().stream().anyMatch(n -> n > 0)) {
            // Cycles are rejected before layering, so this means the graph was built incorrectly
            throw new IllegalStateException("Wave layering made no progress with "
                    + remaining.values().stream().filter(n -> n > 0).count() + " tasks unplaced");
        }

        var result = new ArrayList<Set<String>>();
        for (int i = 0; i < waveCount; i++) {
            result.add(new LinkedHashSet<>());
        }
        for (var id : byId.keySet()) {
            result.get(level.get(id)).add(id);
        }
        result.replaceAll(Collections::unmodifiableSet);
        return Collections.unmodifiableList(result);
    }
}
