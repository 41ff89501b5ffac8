package org.opstranslate.vro.util;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.Version;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class TemplateRenderer {

    private static final Configuration FREEMARKER_CONFIG;

    static {
        FREEMARKER_CONFIG = new Configuration(new Version("2.3.32"));
        FREEMARKER_CONFIG.setDefaultEncoding(StandardCharsets.UTF_8.name());
        FREEMARKER_CONFIG.setClassLoaderForTemplateLoading(
                TemplateRenderer.class.getClassLoader(),
                "/"
        );

        // fail fast when variables are missing
        FREEMARKER_CONFIG.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        FREEMARKER_CONFIG.setLogTemplateExceptions(false);
        FREEMARKER_CONFIG.setFallbackOnNullLoopVariable(false);
    }

    /**
     * Renders a classpath template.
     *
     * @param ftlPath   template path relative to the classpath root
     * @param variables data model
     * @return rendered text
     */
    public static String render(String ftlPath, Map<String, Object> variables) {
        try {
            Template template = FREEMARKER_CONFIG.getTemplate(ftlPath);
            StringWriter writer = new StringWriter();
            template.process(variables, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new RuntimeException("Failed to load FTL template: " + ftlPath, e);
        } catch (TemplateException e) {
            throw new RuntimeException("Error rendering template (possible missing variable): " + ftlPath, e);
        }
    }
}
