package org.opstranslate.vro.script;

import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level assignments become set_fact tasks. Assignments from calls are left to
 * {@link CallStatementExtractor} and the integration extractor.
 */
public class AssignmentExtractor implements StatementExtractor {
    private static final Pattern ASSIGNMENT_PATTERN = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:var|let|const)\\s+)?([A-Za-z_$][\\w$]*)\\s*=(?!=)\\s*(.+?);[ \\t]*$");
    private static final Pattern CALL_EXPRESSION_PATTERN = Pattern.compile(
            "^(?:new\\s+)?[A-Za-z_$][\\w$]*(?:\\s*\\.\\s*[A-Za-z_$][\\w$]*)*\\s*\\(.*", Pattern.DOTALL);

    @Override
    public List<TranslatedTask> extract(String script, WorkflowItem item) {
        List<TranslatedTask> tasks = new ArrayList<>();
        Matcher matcher = ASSIGNMENT_PATTERN.matcher(ValidationExtractor.blankValidations(script));
        while (matcher.find()) {
            String variable = matcher.group(1);
            String expression = matcher.group(2).strip();

            if (CALL_EXPRESSION_PATTERN.matcher(expression).matches()
                    || expression.contains("System.getModule")
                    || expression.contains("throw")) {
                continue;
            }

            Map<String, Object> params = new LinkedHashMap<>();
            params.put(variable, ExpressionHelper.toTemplate(expression));

            tasks.add(TranslatedTask.builder()
                    .name("Set " + variable + " (from " + item.displayName() + ")")
                    .action(TargetActions.SET_FACT)
                    .params(params)
                    .build());
        }
        return tasks;
    }
}
