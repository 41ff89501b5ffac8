package org.opstranslate.vro.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes translated tasks to JSON in the target's task shape: the module name is the key of its
 * parameters, guarded blocks use block/rescue/always. Key order is fixed so equal input gives
 * byte-identical output.
 */
public class TaskWriter {
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ArrayNode toJson(List<TaskNode> tasks) {
        ArrayNode array = mapper.createArrayNode();
        for (TaskNode task : tasks) {
            array.add(toJson(task));
        }
        return array;
    }

    public static ObjectNode toJson(TaskNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", node.name());

        if (node instanceof TranslatedTask task) {
            json.set(task.action(), mapper.valueToTree(task.params()));
            putIfPresent(json, "register", task.register());
            putIfPresent(json, "when", task.when());
            putIfPresent(json, "until", task.until());
            if (task.retries() != null) {
                json.put("retries", task.retries());
            }
            if (task.delay() != null) {
                json.put("delay", task.delay());
            }
            putIfPresent(json, "failed_when", task.failedWhen());
        } else if (node instanceof GuardedBlock block) {
            json.set("block", toJson(block.primary()));
            if (block.onFailure() != null) {
                json.set("rescue", toJson(block.onFailure()));
            }
            if (block.always() != null) {
                json.set("always", toJson(block.always()));
            }
        } else {
            throw new IllegalArgumentException("Unsupported task node: " + node.getClass().getName());
        }

        if (!node.tags().isEmpty()) {
            ArrayNode tags = json.putArray("tags");
            node.tags().forEach(tags::add);
        }
        putIfPresent(json, "comment", node.comment());
        return json;
    }

    public static String toJsonString(List<TaskNode> tasks) {
        try {
            return mapper.writeValueAsString(toJson(tasks));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize tasks", e);
        }
    }

    public static void write(List<TaskNode> tasks, Path outputFile) {
        try {
            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            mapper.writeValue(outputFile.toFile(), toJson(tasks));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write tasks file: " + outputFile, e);
        }
    }

    private static void putIfPresent(ObjectNode json, String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
