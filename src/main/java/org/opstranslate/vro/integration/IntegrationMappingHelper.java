package org.opstranslate.vro.integration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.opstranslate.vro.integration.models.IntegrationMapping;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class IntegrationMappingHelper {
    static final String DEFAULT_MAPPINGS = "mappings/integration_mappings.json";
    static final String MAPPINGS_SCHEMA = "schemas/integration_mappings_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static IntegrationMappings defaultMappings;

    /**
     * The mappings bundled on the classpath. Loaded and validated once.
     */
    public static synchronized IntegrationMappings loadDefaultMappings() {
        if (defaultMappings == null) {
            try (InputStream in = IntegrationMappingHelper.class.getClassLoader().getResourceAsStream(DEFAULT_MAPPINGS)) {
                if (in == null) {
                    throw new IllegalArgumentException("Mappings resource not found: " + DEFAULT_MAPPINGS);
                }
                defaultMappings = parseMappings(mapper.readTree(in), DEFAULT_MAPPINGS);
            } catch (IOException e) {
                throw new RuntimeException("Failed to parse integration mappings file: " + DEFAULT_MAPPINGS, e);
            }
        }
        return defaultMappings;
    }

    /**
     * Loads a mappings file from disk.
     *
     * @param mappingsFile JSON file, {@code {integration: {method: {match, target, requires, severity}}}}
     * @return validated mappings in file order
     * @throws IllegalArgumentException if the file does not satisfy the mappings schema
     */
    public static IntegrationMappings loadMappings(Path mappingsFile) {
        try {
            return parseMappings(mapper.readTree(Files.readString(mappingsFile)), mappingsFile.toString());
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse integration mappings file: " + mappingsFile, e);
        }
    }

    /**
     * Validates mappings JSON against the bundled schema.
     *
     * @return the validation messages, empty when valid
     */
    public static Set<ValidationMessage> validate(JsonNode mappingsNode) {
        try (InputStream schemaStream = IntegrationMappingHelper.class.getClassLoader().getResourceAsStream(MAPPINGS_SCHEMA)) {
            if (schemaStream == null) {
                throw new IllegalArgumentException("Schema resource not found: " + MAPPINGS_SCHEMA);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(mappingsNode);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read schema: " + MAPPINGS_SCHEMA, e);
        }
    }

    private static IntegrationMappings parseMappings(JsonNode root, String source) {
        Set<ValidationMessage> errors = validate(root);
        if (!errors.isEmpty()) {
            System.err.println("Integration mappings " + source + " are INVALID:");
            errors.forEach(e -> System.err.println(" - " + e.getMessage()));
            throw new IllegalArgumentException("Integration mappings are invalid: " + source);
        }

        List<IntegrationMapping> mappings = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> integrations = root.fields();
        while (integrations.hasNext()) {
            Map.Entry<String, JsonNode> integration = integrations.next();
            Iterator<Map.Entry<String, JsonNode>> methods = integration.getValue().fields();
            while (methods.hasNext()) {
                Map.Entry<String, JsonNode> method = methods.next();
                mappings.add(toMapping(integration.getKey(), method.getKey(), method.getValue()));
            }
        }
        System.out.println("Loaded " + mappings.size() + " integration mappings from " + source);
        return new IntegrationMappings(mappings);
    }

    private static IntegrationMapping toMapping(String integration, String method, JsonNode node) {
        JsonNode match = node.path("match");
        JsonNode target = node.path("target");

        List<String> contains = new ArrayList<>();
        match.path("contains").forEach(c -> contains.add(c.asText()));
        List<String> requires = new ArrayList<>();
        node.path("requires").forEach(r -> requires.add(r.asText()));

        Map<String, Object> params = mapper.convertValue(target.path("params"), new TypeReference<LinkedHashMap<String, Object>>() {
        });

        return IntegrationMapping.builder()
                .integration(integration)
                .method(method)
                .matchObject(match.hasNonNull("object") ? match.get("object").asText() : null)
                .matchMethod(match.hasNonNull("method") ? match.get("method").asText() : null)
                .contains(contains)
                .targetAction(target.path("action").asText())
                .params(params)
                .requiredConfig(requires)
                .severity(node.path("severity").asText("warning"))
                .description(node.hasNonNull("description") ? node.get("description").asText() : null)
                .build();
    }
}
