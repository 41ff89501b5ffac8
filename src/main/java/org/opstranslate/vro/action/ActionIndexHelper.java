package org.opstranslate.vro.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opstranslate.vro.action.models.ActionDef;
import org.opstranslate.vro.action.models.ActionInput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class ActionIndexHelper {
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes the index as JSON: {@code {"actions": {fqName: {...}}, "count": n, "indexed_at": "..."}}.
     * Parent directories are created as needed.
     *
     * @param index     index to persist
     * @param indexFile target file
     */
    public static void saveActionIndex(ActionIndex index, Path indexFile) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode actionsNode = root.putObject("actions");

        for (ActionDef action : index.all()) {
            ObjectNode node = actionsNode.putObject(action.fqName());
            node.put("fqname", action.fqName());
            node.put("name", action.name());
            node.put("module", action.module());
            node.put("script", action.script());
            ArrayNode inputs = node.putArray("inputs");
            for (ActionInput input : action.inputs()) {
                ObjectNode inputNode = inputs.addObject();
                inputNode.put("name", input.name());
                inputNode.put("type", input.type());
                inputNode.put("description", input.description());
            }
            node.put("result_type", action.resultType());
            node.put("description", action.description());
            node.put("source_path", action.sourcePath());
            node.put("version", action.version());
            node.put("sha256", action.sha256());
        }
        root.put("count", index.size());
        root.put("indexed_at", Instant.now().toString());

        try {
            if (indexFile.getParent() != null) {
                Files.createDirectories(indexFile.getParent());
            }
            mapper.writeValue(indexFile.toFile(), root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write action index file: " + indexFile, e);
        }
        System.out.println("Saved action index (" + index.size() + " actions) to " + indexFile);
    }

    /**
     * Reads an index written by {@link #saveActionIndex(ActionIndex, Path)}.
     *
     * @param indexFile index file
     * @return the index, or null when the file is absent, unreadable or structurally incomplete
     */
    public static ActionIndex loadActionIndex(Path indexFile) {
        if (!Files.isRegularFile(indexFile)) {
            return null;
        }
        try {
            JsonNode root = mapper.readTree(indexFile.toFile());
            JsonNode actionsNode = root == null ? null : root.get("actions");
            if (actionsNode == null || !actionsNode.isObject()) {
                System.err.println("Action index " + indexFile + " has no 'actions' object, ignoring it");
                return null;
            }

            ActionIndex index = new ActionIndex();
            Iterator<Map.Entry<String, JsonNode>> fields = actionsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                index.add(readAction(entry.getValue()));
            }
            return index;
        } catch (IOException | IllegalStateException e) {
            System.err.println("Failed to load action index " + indexFile + ": " + e.getMessage());
            return null;
        }
    }

    private static ActionDef readAction(JsonNode node) {
        List<ActionInput> inputs = new ArrayList<>();
        for (JsonNode input : required(node, "inputs")) {
            inputs.add(new ActionInput(
                    text(required(input, "name")),
                    text(input.get("type")),
                    text(input.get("description"))));
        }
        return ActionDef.builder()
                .fqName(text(required(node, "fqname")))
                .name(text(required(node, "name")))
                .module(text(required(node, "module")))
                .script(text(required(node, "script")))
                .inputs(inputs)
                .resultType(text(node.get("result_type")))
                .description(text(node.get("description")))
                .sourcePath(text(required(node, "source_path")))
                .version(text(node.get("version")))
                .sha256(text(required(node, "sha256")))
                .build();
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
