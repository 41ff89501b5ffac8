package org.opstranslate.vro.action.models;

/**
 * Input parameter of a vRO action.
 *
 * @param name        parameter name
 * @param type        vRO type, e.g. "string", "VC:VirtualMachine"
 * @param description optional description
 */
public record ActionInput(
        String name,
        String type,
        String description
) {
}
