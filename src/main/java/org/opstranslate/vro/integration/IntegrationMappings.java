package org.opstranslate.vro.integration;

import org.opstranslate.vro.integration.models.IntegrationMapping;
import org.opstranslate.vro.script.models.CallSite;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered set of integration mappings.
 */
public class IntegrationMappings {
    private final List<IntegrationMapping> mappings;

    public IntegrationMappings(List<IntegrationMapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    public static IntegrationMappings empty() {
        return new IntegrationMappings(List.of());
    }

    /**
     * Looks up the mapping for a call: an exact receiver and method match wins, otherwise the first
     * mapping whose substring appears in the call text.
     */
    public Optional<IntegrationMapping> find(CallSite site) {
        if (site.constructor()) {
            return Optional.empty();
        }
        for (IntegrationMapping mapping : mappings) {
            if (mapping.hasExactMatch()
                    && mapping.matchObject().equals(site.object())
                    && mapping.matchMethod().equals(site.method())) {
                return Optional.of(mapping);
            }
        }
        for (IntegrationMapping mapping : mappings) {
            if (mapping.contains().stream().anyMatch(s -> site.text().contains(s))) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }

    public boolean matches(CallSite site) {
        return find(site).isPresent();
    }

    public List<IntegrationMapping> all() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }
}
