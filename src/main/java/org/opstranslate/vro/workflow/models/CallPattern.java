package org.opstranslate.vro.workflow.models;

public enum CallPattern {
    /** {@code System.getModule("m").method(...)} */
    DIRECT_CALL,
    /** {@code var v = System.getModule("m"); ... v.method(...)} */
    VARIABLE_CALL
}
