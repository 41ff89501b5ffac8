package org.opstranslate.vro.workflow;

import org.opstranslate.vro.action.ActionIndex;
import org.opstranslate.vro.action.models.ActionDef;
import org.opstranslate.vro.workflow.models.ActionCall;
import org.opstranslate.vro.workflow.models.CallPattern;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ActionCallHelper {
    private static final Pattern DIRECT_CALL_PATTERN =
            Pattern.compile("System\\.getModule\\(\\s*[\"']([^\"']+)[\"']\\s*\\)\\s*\\.\\s*(\\w+)\\s*\\(");
    private static final Pattern MODULE_VARIABLE_PATTERN =
            Pattern.compile("(?:var|let|const)\\s+(\\w+)\\s*=\\s*System\\.getModule\\(\\s*[\"']([^\"']+)[\"']\\s*\\)\\s*;");

    /**
     * Finds every action invocation in a script. Both forms are recognized:
     * <ul>
     *     <li>{@code System.getModule("com.acme.nsx").createFirewallRule(...)}</li>
     *     <li>{@code var nsx = System.getModule("com.acme.nsx"); nsx.createFirewallRule(...)}</li>
     * </ul>
     * Calls are deduplicated by fully-qualified name; the first occurrence in the script wins.
     *
     * @param script workflow item script, may be null
     * @return action calls in source order
     */
    public static List<ActionCall> extractActionCalls(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }

        List<PositionedCall> found = new ArrayList<>();

        Matcher direct = DIRECT_CALL_PATTERN.matcher(script);
        while (direct.find()) {
            String module = direct.group(1);
            String method = direct.group(2);
            found.add(new PositionedCall(direct.start(), new ActionCall(
                    module + "/" + method, module, method, CallPattern.DIRECT_CALL, direct.group())));
        }

        Matcher variable = MODULE_VARIABLE_PATTERN.matcher(script);
        while (variable.find()) {
            String varName = variable.group(1);
            String module = variable.group(2);
            Pattern usage = Pattern.compile("(?<![\\w$.])" + Pattern.quote(varName) + "\\s*\\.\\s*(\\w+)\\s*\\(");
            Matcher usageMatcher = usage.matcher(script);
            usageMatcher.region(variable.end(), script.length());
            while (usageMatcher.find()) {
                String method = usageMatcher.group(1);
                found.add(new PositionedCall(usageMatcher.start(), new ActionCall(
                        module + "/" + method, module, method, CallPattern.VARIABLE_CALL,
                        variable.group() + " ... " + usageMatcher.group())));
            }
        }

        found.sort(Comparator.comparingInt(PositionedCall::position));

        Map<String, ActionCall> unique = new LinkedHashMap<>();
        for (PositionedCall call : found) {
            unique.putIfAbsent(call.call().fqName(), call.call());
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Attaches action call analysis to an item. Without an index the item is returned unchanged.
     */
    public static WorkflowItem resolveActions(WorkflowItem item, ActionIndex index) {
        if (index == null || !item.hasScript()) {
            return item;
        }

        List<ActionCall> calls = extractActionCalls(item.script());
        List<ActionDef> resolved = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (ActionCall call : calls) {
            ActionDef action = index.get(call.fqName());
            if (action != null) {
                resolved.add(action);
            } else {
                unresolved.add(call.fqName());
            }
        }

        if (!unresolved.isEmpty()) {
            System.err.println("Item '" + item.name() + "' calls actions missing from the index: " + unresolved);
        }

        return item.toBuilder()
                .actionCalls(calls)
                .resolvedActions(resolved)
                .unresolvedActions(unresolved)
                .build();
    }

    private record PositionedCall(int position, ActionCall call) {
    }
}
