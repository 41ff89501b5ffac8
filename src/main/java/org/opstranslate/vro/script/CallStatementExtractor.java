package org.opstranslate.vro.script;

import org.opstranslate.vro.action.models.ActionDef;
import org.opstranslate.vro.action.models.ActionInput;
import org.opstranslate.vro.script.models.CallSite;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the remaining statement-level calls into tasks:
 * <ul>
 *     <li>action calls become include_tasks of the generated action task file</li>
 *     <li>{@code Server.getWorkflowWithId("id")} becomes include_role</li>
 *     <li>anything else becomes a TODO placeholder so no call is silently dropped</li>
 * </ul>
 * Constructors, {@code System.*} and {@code LockingSystem.*} calls are skipped, as are calls claimed by
 * another extractor.
 */
public class CallStatementExtractor implements StatementExtractor {
    private static final Pattern MODULE_VARIABLE_PATTERN = Pattern.compile(
            "(?:var|let|const)?\\s*([A-Za-z_$][\\w$]*)\\s*=\\s*System\\.getModule\\(\\s*[\"']([^\"']+)[\"']\\s*\\)\\s*;");

    private static final String MODULE_LOOKUP = "System.getModule";
    private static final String WORKFLOW_LOOKUP = "Server.getWorkflowWithId";

    private final Predicate<CallSite> claimedElsewhere;

    public CallStatementExtractor() {
        this(site -> false);
    }

    /**
     * @param claimedElsewhere call sites another extractor already translates
     */
    public CallStatementExtractor(Predicate<CallSite> claimedElsewhere) {
        this.claimedElsewhere = claimedElsewhere;
    }

    @Override
    public List<TranslatedTask> extract(String script, WorkflowItem item) {
        Map<String, String> moduleVariables = new HashMap<>();
        Matcher moduleMatcher = MODULE_VARIABLE_PATTERN.matcher(script);
        while (moduleMatcher.find()) {
            moduleVariables.put(moduleMatcher.group(1), moduleMatcher.group(2));
        }

        List<TranslatedTask> tasks = new ArrayList<>();
        for (CallSite site : CallScanner.scan(script)) {
            if (site.constructor() || claimedElsewhere.test(site)) {
                continue;
            }

            if (MODULE_LOOKUP.equals(site.callee())) {
                if (site.isChained() && site.argument(0) != null) {
                    String module = ExpressionHelper.stripQuotes(site.argument(0));
                    tasks.add(actionCallTask(module, site.chainedMethod(), site.chainedArguments(), site, item));
                }
                continue;
            }
            if (site.callee().startsWith("System.") || site.callee().startsWith("LockingSystem.")) {
                continue;
            }
            if (site.object() != null && moduleVariables.containsKey(site.object())) {
                tasks.add(actionCallTask(moduleVariables.get(site.object()), site.method(), site.arguments(), site, item));
                continue;
            }
            if (WORKFLOW_LOOKUP.equals(site.callee())) {
                tasks.add(workflowCallTask(site, item));
                continue;
            }
            tasks.add(todoTask(site, item));
        }
        return tasks;
    }

    private TranslatedTask actionCallTask(String module, String method, List<String> arguments,
                                          CallSite site, WorkflowItem item) {
        String fqName = module + "/" + method;
        ActionDef resolved = item.resolvedActions().stream()
                .filter(a -> a.fqName().equals(fqName))
                .findFirst()
                .orElse(null);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("file", "actions/" + module + "/" + method + ".yml");

        String comment;
        if (resolved != null) {
            Map<String, Object> vars = new LinkedHashMap<>();
            List<ActionInput> inputs = resolved.inputs();
            for (int i = 0; i < inputs.size() && i < arguments.size(); i++) {
                vars.put(inputs.get(i).name(), ExpressionHelper.toTemplate(arguments.get(i)));
            }
            if (!vars.isEmpty()) {
                params.put("vars", vars);
            }
            comment = "Resolved action " + fqName + " (" + resolved.sourcePath() + ")";
        } else {
            comment = "Unresolved action " + fqName + ": not found in the action index";
        }

        return TranslatedTask.builder()
                .name("Call action: " + fqName)
                .action(TargetActions.INCLUDE_TASKS)
                .params(params)
                .register(site.boundVariable())
                .tags(List.of("action_call"))
                .comment(comment)
                .build();
    }

    private TranslatedTask workflowCallTask(CallSite site, WorkflowItem item) {
        String workflowId = site.argument(0) == null ? "unknown" : ExpressionHelper.stripQuotes(site.argument(0));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", ExpressionHelper.sanitizeName(workflowId));

        return TranslatedTask.builder()
                .name("Call workflow: " + workflowId)
                .action(TargetActions.INCLUDE_ROLE)
                .params(params)
                .tags(List.of("workflow_call"))
                .comment("Nested workflow call in " + item.displayName() + ": " + site.text())
                .build();
    }

    private TranslatedTask todoTask(CallSite site, WorkflowItem item) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("msg", "Call '" + site.callee() + "' in '" + item.displayName() + "' needs manual translation");

        return TranslatedTask.builder()
                .name("TODO: " + site.callee() + " (" + item.displayName() + ")")
                .action(TargetActions.DEBUG)
                .params(params)
                .tags(List.of("todo"))
                .comment("Source: " + site.text())
                .build();
    }
}
