package org.opstranslate.vro.workflow.models;

public record Binding(
        String name,
        String type,
        String exportName // workflow attribute the binding maps to
) {
}
