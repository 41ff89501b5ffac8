package org.opstranslate.vro.workflow.models;

import lombok.Builder;
import org.opstranslate.vro.action.models.ActionDef;

import java.util.List;

/**
 * One node of a vRO workflow graph.
 */
@Builder
public record WorkflowItem(
        String name,
        ItemKind kind,
        String type,        // raw vRO type attribute, kept for UNKNOWN items
        String displayName,
        String script,
        List<Binding> inBindings,
        List<Binding> outBindings,
        String nextName,    // successor, null at the end of the chain
        String altNextName, // decision false-branch, annotation only
        Position position,

        // filled by action call analysis
        List<ActionCall> actionCalls,
        List<ActionDef> resolvedActions,
        List<String> unresolvedActions
) {
    public WorkflowItem {
        if (kind == null) {
            kind = ItemKind.TASK;
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = name;
        }
        inBindings = inBindings == null ? List.of() : List.copyOf(inBindings);
        outBindings = outBindings == null ? List.of() : List.copyOf(outBindings);
        actionCalls = actionCalls == null ? List.of() : List.copyOf(actionCalls);
        resolvedActions = resolvedActions == null ? List.of() : List.copyOf(resolvedActions);
        unresolvedActions = unresolvedActions == null ? List.of() : List.copyOf(unresolvedActions);
    }

    public WorkflowItem(String name, ItemKind kind, String script, String nextName) {
        this(name, kind, null, null, script, null, null, nextName, null, null, null, null, null);
    }

    public WorkflowItemBuilder toBuilder() {
        return WorkflowItem.builder()
                .name(this.name)
                .kind(this.kind)
                .type(this.type)
                .displayName(this.displayName)
                .script(this.script)
                .inBindings(this.inBindings)
                .outBindings(this.outBindings)
                .nextName(this.nextName)
                .altNextName(this.altNextName)
                .position(this.position)
                .actionCalls(this.actionCalls)
                .resolvedActions(this.resolvedActions)
                .unresolvedActions(this.unresolvedActions);
    }

    public boolean hasScript() {
        return script != null && !script.isBlank();
    }

    /**
     * Value bound to the given input, preferring the workflow attribute it is exported from.
     */
    public String inBindingSource(String bindingName) {
        return inBindings.stream()
                .filter(b -> bindingName.equals(b.name()))
                .map(b -> b.exportName() != null && !b.exportName().isBlank() ? b.exportName() : b.name())
                .findFirst()
                .orElse(null);
    }
}
