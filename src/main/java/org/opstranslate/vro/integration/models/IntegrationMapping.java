package org.opstranslate.vro.integration.models;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Allowlist entry describing how one vRO plugin call translates.
 *
 * @param integration    integration key, e.g. "servicenow"
 * @param method         method key, e.g. "createIncident"
 * @param matchObject    receiver to match exactly, or null
 * @param matchMethod    method to match exactly, or null
 * @param contains       substrings that identify the call when no exact match applies
 * @param targetAction   target module
 * @param params         parameter template; {@code {argN}} refers to the Nth call argument
 * @param requiredConfig configuration keys that must be present before a real task is emitted
 * @param severity       "info", "warning" or "blocking"
 * @param description    what the call does
 */
@Builder
public record IntegrationMapping(
        String integration,
        String method,
        String matchObject,
        String matchMethod,
        List<String> contains,
        String targetAction,
        Map<String, Object> params,
        List<String> requiredConfig,
        String severity,
        String description
) {
    public IntegrationMapping {
        contains = contains == null ? List.of() : List.copyOf(contains);
        params = params == null ? Map.of() : params;
        requiredConfig = requiredConfig == null ? List.of() : List.copyOf(requiredConfig);
    }

    public boolean hasExactMatch() {
        return matchObject != null && matchMethod != null;
    }
}
