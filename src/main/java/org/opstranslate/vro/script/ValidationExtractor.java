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
 * Validation gates, {@code if (cond) { throw "msg"; }} or {@code throw new Error("msg")}, become assert
 * tasks over the negated condition.
 */
public class ValidationExtractor implements StatementExtractor {
    private static final Pattern IF_PATTERN = Pattern.compile("(?<![\\w$.])if\\s*\\(");
    private static final Pattern THROW_OPEN_PATTERN =
            Pattern.compile("\\G\\s*\\{\\s*throw\\s+(?:new\\s+Error\\s*\\(\\s*)?([\"'])");
    private static final Pattern THROW_CLOSE_PATTERN = Pattern.compile("\\G\\s*\\)?\\s*;\\s*\\}");

    private static final int NAME_MESSAGE_LENGTH = 50;

    @Override
    public List<TranslatedTask> extract(String script, WorkflowItem item) {
        List<TranslatedTask> tasks = new ArrayList<>();
        for (ValidationGate gate : findGates(script)) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("that", ExpressionHelper.negateCondition(gate.condition()));
            params.put("fail_msg", gate.message());

            tasks.add(TranslatedTask.builder()
                    .name("Validate: " + gate.message().substring(0, Math.min(NAME_MESSAGE_LENGTH, gate.message().length())))
                    .action(TargetActions.ASSERT)
                    .params(params)
                    .comment("Validation in " + item.displayName() + ": if (" + gate.condition() + ") throw")
                    .build());
        }
        return tasks;
    }

    /**
     * Replaces every validation gate with spaces so later extractors do not see its statements.
     */
    public static String blankValidations(String script) {
        StringBuilder out = new StringBuilder(script);
        for (ValidationGate gate : findGates(script)) {
            for (int i = gate.start(); i < gate.end(); i++) {
                if (out.charAt(i) != '\n') {
                    out.setCharAt(i, ' ');
                }
            }
        }
        return out.toString();
    }

    /**
     * Finds {@code if} statements whose block is exactly one throw of a string message.
     * The condition ends at the parenthesis matching {@code if (}, so an {@code if} with any other
     * body is never merged with a later gate.
     */
    static List<ValidationGate> findGates(String script) {
        List<ValidationGate> gates = new ArrayList<>();
        if (script == null || script.isEmpty()) {
            return gates;
        }

        String masked = CallScanner.maskLiterals(script);
        Matcher ifMatcher = IF_PATTERN.matcher(masked);
        while (ifMatcher.find()) {
            int open = ifMatcher.end() - 1;
            int close = CallScanner.findClosingParen(masked, open);
            if (close < 0) {
                continue;
            }

            Matcher throwOpen = THROW_OPEN_PATTERN.matcher(masked);
            throwOpen.region(close + 1, masked.length());
            if (!throwOpen.find()) {
                continue;
            }
            int quote = throwOpen.start(1);
            int quoteEnd = masked.indexOf(masked.charAt(quote), quote + 1);
            if (quoteEnd < 0) {
                continue;
            }

            Matcher throwClose = THROW_CLOSE_PATTERN.matcher(masked);
            throwClose.region(quoteEnd + 1, masked.length());
            if (!throwClose.find()) {
                continue;
            }

            String message = script.substring(quote + 1, quoteEnd).strip();
            if (message.isEmpty()) {
                continue;
            }
            gates.add(new ValidationGate(ifMatcher.start(), throwClose.end(),
                    script.substring(open + 1, close).strip(), message));
        }
        return gates;
    }

    record ValidationGate(int start, int end, String condition, String message) {
    }
}
