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
 * {@code System.log(...)}, {@code System.warn(...)}, {@code System.error(...)} and
 * {@code System.debug(...)} become debug tasks.
 */
public class LogExtractor implements StatementExtractor {
    private static final Pattern LOG_PATTERN =
            Pattern.compile("System\\.(log|warn|error|debug)\\s*\\(\\s*(.+?)\\s*\\)\\s*;");

    @Override
    public List<TranslatedTask> extract(String script, WorkflowItem item) {
        List<TranslatedTask> tasks = new ArrayList<>();
        Matcher matcher = LOG_PATTERN.matcher(script);
        while (matcher.find()) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("msg", ExpressionHelper.toTemplateString(matcher.group(2)));

            TranslatedTask.TranslatedTaskBuilder task = TranslatedTask.builder()
                    .name("Log: " + item.displayName())
                    .action(TargetActions.DEBUG)
                    .params(params);
            if (!"log".equals(matcher.group(1))) {
                task.comment("System." + matcher.group(1) + " in " + item.name());
            }
            tasks.add(task.build());
        }
        return tasks;
    }
}
