package org.opstranslate.vro.locking;

import org.opstranslate.vro.util.TemplateRenderer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

public class LockingSetupDocGenerator {
    private static final String TEMPLATE = "templates/locking_setup.ftl";

    /**
     * Renders the operator guide for setting up the given locking backend.
     *
     * @param backend "redis", "consul" or "file"
     * @return markdown document
     * @throws IllegalArgumentException for an unsupported backend
     */
    public static String generate(String backend) {
        if (!LockingTaskGenerator.isSupported(backend)) {
            throw new IllegalArgumentException("Unsupported locking backend: " + backend);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("backend", backend);
        model.put("retryDelay", LockBackend.RETRY_DELAY_SECONDS);
        model.put("minRetries", LockBackend.MIN_RETRIES);
        return TemplateRenderer.render(TEMPLATE, model);
    }

    public static void write(String backend, Path outputFile) {
        try {
            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            Files.writeString(outputFile, generate(backend), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write locking setup guide: " + outputFile, e);
        }
    }
}
