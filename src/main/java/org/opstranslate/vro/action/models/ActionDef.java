package org.opstranslate.vro.action.models;

import lombok.Builder;

import java.util.List;

/**
 * A parsed vRO action: a reusable script module addressed by its fully-qualified name
 * ({@code module-path/short-name}).
 *
 * @param fqName      fully-qualified name, e.g. "com.acme.nsx/createFirewallRule"
 * @param name        short name, e.g. "createFirewallRule"
 * @param module      module path, e.g. "com.acme.nsx"
 * @param script      JavaScript body, trimmed
 * @param inputs      input parameters in declaration order
 * @param resultType  declared return type, or null
 * @param description action description, or null
 * @param sourcePath  location of the originating document
 * @param version     version tag, or null
 * @param sha256      hex SHA-256 of {@code script}
 */
@Builder
public record ActionDef(
        String fqName,
        String name,
        String module,
        String script,
        List<ActionInput> inputs,
        String resultType,
        String description,
        String sourcePath,
        String version,
        String sha256
) {
    public ActionDef {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
