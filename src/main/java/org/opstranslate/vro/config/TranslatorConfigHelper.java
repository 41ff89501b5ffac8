package org.opstranslate.vro.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.opstranslate.vro.config.models.ApprovalConfig;
import org.opstranslate.vro.config.models.LockingConfig;
import org.opstranslate.vro.config.models.TranslatorConfig;
import org.opstranslate.vro.integration.ConfigurationFacts;
import org.opstranslate.vro.integration.IntegrationMappingHelper;
import org.opstranslate.vro.integration.IntegrationMappings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

public class TranslatorConfigHelper {
    static final String CONFIG_SCHEMA = "schemas/translator_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    public static TranslatorConfig defaults() {
        return new TranslatorConfig();
    }

    /**
     * Loads and validates a translator configuration file.
     *
     * @param configFile JSON configuration
     * @return the configuration, missing sections filled with defaults
     * @throws IllegalArgumentException if the file does not satisfy the configuration schema
     */
    public static TranslatorConfig loadConfig(Path configFile) throws IOException {
        JsonNode node = mapper.readTree(Files.readString(configFile));

        Set<ValidationMessage> errors = validate(node);
        if (!errors.isEmpty()) {
            System.err.println("Translator config " + configFile + " is INVALID:");
            errors.forEach(e -> System.err.println(" - " + e.getMessage()));
            throw new IllegalArgumentException("Translator config is invalid: " + configFile);
        }

        TranslatorConfig config = mapper.treeToValue(node, TranslatorConfig.class);
        if (config.locking == null) {
            config.locking = new LockingConfig();
        }
        if (config.approval == null) {
            config.approval = new ApprovalConfig();
        }
        return config;
    }

    public static Set<ValidationMessage> validate(JsonNode configNode) {
        try (InputStream schemaStream = TranslatorConfigHelper.class.getClassLoader().getResourceAsStream(CONFIG_SCHEMA)) {
            if (schemaStream == null) {
                throw new IllegalArgumentException("Schema resource not found: " + CONFIG_SCHEMA);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(configNode);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read schema: " + CONFIG_SCHEMA, e);
        }
    }

    public static ConfigurationFacts facts(TranslatorConfig config) {
        return ConfigurationFacts.fromJson(config.profile);
    }

    /**
     * The mappings the configuration points to, or the bundled mappings when it names none.
     * A relative path is resolved against {@code baseDir}.
     */
    public static IntegrationMappings mappings(TranslatorConfig config, Path baseDir) {
        if (config.mappingsFile == null || config.mappingsFile.isBlank()) {
            return IntegrationMappingHelper.loadDefaultMappings();
        }
        Path mappingsFile = Path.of(config.mappingsFile);
        if (!mappingsFile.isAbsolute() && baseDir != null) {
            mappingsFile = baseDir.resolve(mappingsFile);
        }
        return IntegrationMappingHelper.loadMappings(mappingsFile);
    }
}
