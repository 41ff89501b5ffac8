package org.opstranslate.vro.script.models;

import lombok.Builder;

import java.util.List;

/**
 * A statement-level call expression found in a script.
 *
 * @param start            offset of the first character (including a leading {@code new})
 * @param end              offset just past the closing parenthesis
 * @param callee           dotted callee, e.g. "ServiceNow.createIncident"
 * @param object           receiver part of the callee, or null for a plain function call
 * @param method           last segment of the callee
 * @param arguments        top-level argument expressions, trimmed
 * @param text             exact source text of the call
 * @param boundVariable    variable the result is assigned to, or null
 * @param constructor      true for {@code new X(...)}
 * @param chainedMethod    method invoked on the result, e.g. for {@code System.getModule("m").run()}
 * @param chainedArguments arguments of the chained invocation
 */
@Builder
public record CallSite(
        int start,
        int end,
        String callee,
        String object,
        String method,
        List<String> arguments,
        String text,
        String boundVariable,
        boolean constructor,
        String chainedMethod,
        List<String> chainedArguments
) {
    public CallSite {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        chainedArguments = chainedArguments == null ? List.of() : List.copyOf(chainedArguments);
    }

    public boolean isChained() {
        return chainedMethod != null;
    }

    public String argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
