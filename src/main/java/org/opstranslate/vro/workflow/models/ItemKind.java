package org.opstranslate.vro.workflow.models;

public enum ItemKind {
    TASK,
    DECISION,
    INTERACTION,
    EMAIL,
    END,
    UNKNOWN;

    /**
     * Maps the vRO {@code type} attribute of a workflow item. A missing type means "task".
     */
    public static ItemKind fromXmlType(String type) {
        if (type == null || type.isBlank()) {
            return TASK;
        }
        return switch (type.strip().toLowerCase()) {
            case "task" -> TASK;
            case "condition", "decision", "custom-condition" -> DECISION;
            case "input", "interaction", "user-interaction" -> INTERACTION;
            case "email", "mail" -> EMAIL;
            case "end" -> END;
            default -> UNKNOWN;
        };
    }
}
