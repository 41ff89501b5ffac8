package org.opstranslate.vro.integration;

import org.opstranslate.vro.integration.models.IntegrationMapping;
import org.opstranslate.vro.script.CallScanner;
import org.opstranslate.vro.script.ExpressionHelper;
import org.opstranslate.vro.script.StatementExtractor;
import org.opstranslate.vro.script.models.CallSite;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.util.TemplateRenderer;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates allowlisted plugin calls. A call whose required configuration is missing becomes a
 * failing "DECISION REQUIRED" stub instead of a guessed task.
 */
public class IntegrationCallExtractor implements StatementExtractor {
    private static final String DECISION_TEMPLATE = "templates/decision_required.ftl";
    private static final Pattern WHOLE_PLACEHOLDER = Pattern.compile("^\\{arg(\\d+)}$");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{arg(\\d+)}");

    private final IntegrationMappings mappings;
    private final ConfigurationFacts facts;

    public IntegrationCallExtractor(IntegrationMappings mappings, ConfigurationFacts facts) {
        this.mappings = mappings;
        this.facts = facts;
    }

    public boolean claims(CallSite site) {
        return mappings.matches(site);
    }

    @Override
    public List<TranslatedTask> extract(String script, WorkflowItem item) {
        List<TranslatedTask> tasks = new ArrayList<>();
        for (CallSite site : CallScanner.scan(script)) {
            mappings.find(site).ifPresent(mapping -> {
                List<String> missing = facts.missing(mapping.requiredConfig());
                if (missing.isEmpty()) {
                    tasks.add(integrationTask(mapping, site, item));
                } else {
                    tasks.add(decisionRequiredStub(mapping, site, item, missing));
                }
            });
        }
        return tasks;
    }

    private TranslatedTask integrationTask(IntegrationMapping mapping, CallSite site, WorkflowItem item) {
        return TranslatedTask.builder()
                .name(capitalize(mapping.integration()) + " " + mapping.method() + ": " + item.displayName())
                .action(mapping.targetAction())
                .params(substituteParams(mapping.params(), site.arguments()))
                .register(site.boundVariable())
                .tags(List.of("integration", mapping.integration()))
                .comment(mapping.description() != null ? mapping.description() + ". Source: " + site.text() : "Source: " + site.text())
                .build();
    }

    private TranslatedTask decisionRequiredStub(IntegrationMapping mapping, CallSite site, WorkflowItem item,
                                                List<String> missing) {
        Map<String, Object> model = new HashMap<>();
        model.put("integration", capitalize(mapping.integration()));
        model.put("method", mapping.method());
        model.put("displayName", item.displayName());
        model.put("evidence", site.text().strip());
        model.put("missingKeys", missing.stream().map(k -> "profile." + k).toList());
        model.put("targetAction", mapping.targetAction());
        model.put("severity", mapping.severity());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("msg", TemplateRenderer.render(DECISION_TEMPLATE, model));

        return TranslatedTask.builder()
                .name("DECISION REQUIRED: " + capitalize(mapping.integration()) + " " + mapping.method())
                .action(TargetActions.FAIL)
                .params(params)
                .tags(List.of("decision_required", "integration", mapping.integration()))
                .comment("Missing configuration: " + String.join(", ", missing))
                .build();
    }

    /**
     * Fills {@code {argN}} placeholders. A parameter that is exactly one placeholder takes the converted
     * argument (literal text without quotes, anything else as a template); a parameter whose argument
     * is missing is dropped. Nested maps are substituted recursively.
     */
    static Map<String, Object> substituteParams(Map<?, ?> template, List<String> arguments) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : template.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                result.put(key, substituteParams(nested, arguments));
                continue;
            }
            if (!(value instanceof String text)) {
                result.put(key, value);
                continue;
            }

            Matcher whole = WHOLE_PLACEHOLDER.matcher(text);
            if (whole.matches()) {
                int index = Integer.parseInt(whole.group(1));
                if (index < arguments.size()) {
                    result.put(key, convertArgument(arguments.get(index)));
                }
                continue;
            }

            Matcher placeholder = PLACEHOLDER.matcher(text);
            StringBuilder substituted = new StringBuilder();
            boolean complete = true;
            while (placeholder.find()) {
                int index = Integer.parseInt(placeholder.group(1));
                if (index >= arguments.size()) {
                    complete = false;
                    break;
                }
                placeholder.appendReplacement(substituted,
                        Matcher.quoteReplacement(String.valueOf(convertArgument(arguments.get(index)))));
            }
            if (complete) {
                placeholder.appendTail(substituted);
                result.put(key, substituted.toString());
            }
        }
        return result;
    }

    private static Object convertArgument(String argument) {
        if (ExpressionHelper.isStringLiteral(argument)) {
            return ExpressionHelper.stripQuotes(argument);
        }
        return ExpressionHelper.toTemplate(argument);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
    }
}
