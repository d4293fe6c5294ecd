package com.tandem.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.core.model.TaskSpec;
import com.tandem.core.model.WorkerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads task specifications from a JSON task plan.
 *
 * <p>Two document shapes are accepted. Keyed by task id:
 * <pre>
 * {"research":  {"description": "Research codebase", "agent_type": "explore", "depends_on": []},
 *  "implement": {"description": "Implement feature", "agent_type": "frontend", "depends_on": ["research"]}}
 * </pre>
 * or as a task array:
 * <pre>
 * {"tasks": [{"id": "research", "worker_type": "explore", "description": "...", "dependencies": []}]}
 * </pre>
 * Worker type may be given as {@code agent_type}, {@code worker_type} or {@code workerType};
 * dependencies as {@code depends_on} or {@code dependencies}.
 */
@Component
public class TaskPlanReader {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanReader.class);

    private final ObjectMapper objectMapper;

    public TaskPlanReader() {
        this(new ObjectMapper());
    }

    public TaskPlanReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<TaskSpec> read(Path planFile) {
        try {
            return read(Files.readString(planFile));
        } catch (IOException e) {
            throw new TaskPlanParseException("Failed to read task plan " + planFile, e);
        }
    }

    public List<TaskSpec> read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TaskPlanParseException("Task plan is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TaskPlanParseException("Task plan must be a JSON object");
        }

        var specs = new ArrayList<TaskSpec>();
        JsonNode taskArray = root.get("tasks");
        if (taskArray != null && taskArray.isArray()) {
            for (JsonNode node : taskArray) {
                specs.add(toSpec(requiredText(node, "id", "<unnamed>"), node));
            }
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (!entry.getValue().isObject()) {
                    throw new TaskPlanParseException("Task " + entry.getKey() + " must be a JSON object");
                }
                specs.add(toSpec(entry.getKey(), entry.getValue()));
            }
        }
        log.debug("Read {} task specifications", specs.size());
        return specs;
    }

    /** Reads and builds the graph in one step. */
    public TaskGraph readGraph(Path planFile) {
        return new TaskGraph(read(planFile));
    }

    private TaskSpec toSpec(String id, JsonNode node) {
        String typeTag = firstText(node, "agent_type", "worker_type", "workerType");
        if (typeTag == null) {
            throw new TaskPlanParseException("Task " + id + " has no worker type");
        }
        WorkerType workerType;
        try {
            workerType = WorkerType.fromTag(typeTag);
        } catch (IllegalArgumentException e) {
            throw new TaskPlanParseException("Task " + id + ": " + e.getMessage(), e);
        }

        var dependencies = new ArrayList<String>();
        JsonNode deps = node.has("depends_on") ? node.get("depends_on") : node.get("dependencies");
        if (deps != null && !deps.isNull()) {
            if (!deps.isArray()) {
                throw new TaskPlanParseException("Dependencies of task " + id + " must be an array");
            }
            deps.forEach(d -> dependencies.add(d.asText()));
        }

        String description = firstText(node, "description");
        return new TaskSpec(id, workerType, description, dependencies);
    }

    private static String requiredText(JsonNode node, String field, String context) {
        String value = firstText(node, field);
        if (value == null || value.isBlank()) {
            throw new TaskPlanParseException("Task " + context + " is missing '" + field + "'");
        }
        return value;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
