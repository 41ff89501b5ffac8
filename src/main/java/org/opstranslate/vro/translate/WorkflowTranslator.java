package org.opstranslate.vro.translate;

import org.opstranslate.vro.action.ActionIndex;
import org.opstranslate.vro.config.TranslatorConfigHelper;
import org.opstranslate.vro.config.models.TranslatorConfig;
import org.opstranslate.vro.integration.IntegrationMappings;
import org.opstranslate.vro.script.ExpressionHelper;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.util.TemplateRenderer;
import org.opstranslate.vro.workflow.WorkflowHelper;
import org.opstranslate.vro.workflow.models.ItemKind;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates a vRO workflow into target tasks, item by item in execution order.
 * Every item yields at least one task; anything that cannot be translated becomes a TODO placeholder.
 */
public class WorkflowTranslator {
    private static final Pattern RETURN_PATTERN = Pattern.compile("return\\s+(.+?);", Pattern.DOTALL);
    private static final String APPROVAL_BLOCKED_TEMPLATE = "templates/approval_blocked.ftl";

    private static final List<String> EMAIL_TO_BINDINGS = List.of("toAddress", "to", "recipient", "recipients");
    private static final List<String> EMAIL_SUBJECT_BINDINGS = List.of("subject", "title");
    private static final List<String> EMAIL_BODY_BINDINGS = List.of("content", "body", "message");

    private final TranslatorConfig config;
    private final ActionIndex actionIndex;
    private final ScriptTranslator scriptTranslator;

    public WorkflowTranslator(TranslatorConfig config, IntegrationMappings mappings, ActionIndex actionIndex) {
        this.config = config == null ? TranslatorConfigHelper.defaults() : config;
        this.actionIndex = actionIndex;
        this.scriptTranslator = new ScriptTranslator(
                this.config.locking, mappings, TranslatorConfigHelper.facts(this.config));
    }

    /**
     * Parses, orders and translates a workflow file.
     *
     * @param workflowFile vRO workflow XML
     * @return tasks of all reachable items, in execution order
     */
    public List<TaskNode> translate(Path workflowFile) {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(workflowFile, actionIndex);
        return translateItems(items);
    }

    public List<TaskNode> translateItems(List<WorkflowItem> items) {
        List<TaskNode> tasks = new ArrayList<>();
        for (WorkflowItem item : items) {
            tasks.addAll(translateItem(item));
        }
        return tasks;
    }

    public List<TaskNode> translateItem(WorkflowItem item) {
        List<TaskNode> tasks = switch (item.kind()) {
            case TASK -> item.hasScript() ? scriptTranslator.translate(item.script(), item) : List.of();
            case DECISION -> List.of(decisionTask(item));
            case INTERACTION -> List.of(approvalTask(item));
            case EMAIL -> List.of(emailTask(item));
            case END, UNKNOWN -> List.of();
        };
        if (tasks.isEmpty() && item.kind() != ItemKind.END) {
            return List.of(placeholder(item));
        }
        return tasks;
    }

    private TranslatedTask decisionTask(WorkflowItem item) {
        String condition = "unknown";
        if (item.hasScript()) {
            Matcher matcher = RETURN_PATTERN.matcher(item.script());
            condition = matcher.find() ? matcher.group(1).strip() : item.script().strip();
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("msg", "Evaluating decision - Condition: {{ " + ExpressionHelper.toJinjaExpression(condition) + " }}");

        return TranslatedTask.builder()
                .name("Decision: " + item.displayName())
                .action(TargetActions.DEBUG)
                .params(params)
                .tags(List.of("decision"))
                .comment("Decision node: " + item.name()
                        + "\nCondition: " + condition
                        + "\nTrue path: " + item.nextName()
                        + "\nFalse path: " + item.altNextName())
                .build();
    }

    private TranslatedTask approvalTask(WorkflowItem item) {
        String model = config.approval == null || config.approval.model == null ? "blocked" : config.approval.model;
        Map<String, Object> params = new LinkedHashMap<>();

        switch (model) {
            case "blocked" -> {
                Map<String, Object> templateModel = new HashMap<>();
                templateModel.put("displayName", item.displayName());
                templateModel.put("itemType", item.type() == null ? "interaction" : item.type());
                params.put("msg", TemplateRenderer.render(APPROVAL_BLOCKED_TEMPLATE, templateModel));
                return TranslatedTask.builder()
                        .name("BLOCKED: Approval required - " + item.displayName())
                        .action(TargetActions.FAIL)
                        .params(params)
                        .tags(List.of("approval", "blocked"))
                        .comment("Approval gate: " + item.name())
                        .build();
            }
            case "servicenow" -> {
                params.put("file", "{{ playbook_dir }}/adapters/snow/request_approval.yml");
                return TranslatedTask.builder()
                        .name("Request ServiceNow approval: " + item.displayName())
                        .action(TargetActions.INCLUDE_TASKS)
                        .params(params)
                        .tags(List.of("approval", "servicenow"))
                        .comment("Approval via ServiceNow: " + item.displayName())
                        .build();
            }
            case "aap_workflow" -> {
                params.put("prompt", "Approve: " + item.displayName() + "? (yes/no)");
                return TranslatedTask.builder()
                        .name("AAP approval gate: " + item.displayName())
                        .action(TargetActions.PAUSE)
                        .params(params)
                        .register("approval_response")
                        .tags(List.of("approval", "aap"))
                        .comment("AAP Workflow approval gate")
                        .build();
            }
            case "pause" -> {
                params.put("prompt", "Approve " + item.displayName() + "? (Press Enter)");
                return TranslatedTask.builder()
                        .name("Manual approval: " + item.displayName())
                        .action(TargetActions.PAUSE)
                        .params(params)
                        .tags(List.of("approval", "manual"))
                        .comment("Manual approval (demo mode)")
                        .build();
            }
            default -> {
                params.put("msg", "Unknown approval model: " + model
                        + ". Valid options: servicenow, aap_workflow, pause, blocked");
                return TranslatedTask.builder()
                        .name("ERROR: Unknown approval model '" + model + "'")
                        .action(TargetActions.FAIL)
                        .params(params)
                        .tags(List.of("error"))
                        .comment("Invalid approval configuration for: " + item.displayName())
                        .build();
            }
        }
    }

    private TranslatedTask emailTask(WorkflowItem item) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("host", "{{ smtp_host | default('localhost') }}");
        putBinding(params, "to", item, EMAIL_TO_BINDINGS);
        putBinding(params, "subject", item, EMAIL_SUBJECT_BINDINGS);
        putBinding(params, "body", item, EMAIL_BODY_BINDINGS);
        if (!params.containsKey("subject")) {
            params.put("subject", item.displayName());
        }

        return TranslatedTask.builder()
                .name("Send email: " + item.displayName())
                .action(TargetActions.MAIL)
                .params(params)
                .tags(List.of("email"))
                .comment("Email notification from: " + item.displayName())
                .build();
    }

    private static void putBinding(Map<String, Object> params, String key, WorkflowItem item, List<String> candidates) {
        for (String candidate : candidates) {
            String source = item.inBindingSource(candidate);
            if (source != null) {
                params.put(key, "{{ " + source + " }}");
                return;
            }
        }
    }

    private static TranslatedTask placeholder(WorkflowItem item) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("msg", "Workflow item '" + item.displayName() + "' (type: " + item.type() + ")");

        return TranslatedTask.builder()
                .name("TODO: " + item.displayName())
                .action(TargetActions.DEBUG)
                .params(params)
                .tags(List.of("todo"))
                .comment("Workflow item: " + item.name() + "\nType: " + item.type())
                .build();
    }
}
