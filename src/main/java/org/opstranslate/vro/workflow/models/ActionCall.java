package org.opstranslate.vro.workflow.models;

/**
 * An action invocation found in a workflow script.
 *
 * @param fqName   resolved fully-qualified name, "module/method"
 * @param module   module path passed to {@code System.getModule}
 * @param method   invoked method name
 * @param pattern  syntactic form the call was found in
 * @param evidence source text that matched
 */
public record ActionCall(
        String fqName,
        String module,
        String method,
        CallPattern pattern,
        String evidence
) {
}
