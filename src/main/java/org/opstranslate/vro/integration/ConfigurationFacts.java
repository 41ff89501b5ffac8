package org.opstranslate.vro.integration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dotted configuration keys known to be available, e.g. "itsm.servicenow".
 * Every prefix of a present key is present too.
 */
public class ConfigurationFacts {
    private final Set<String> keys;

    private ConfigurationFacts(Set<String> keys) {
        this.keys = Collections.unmodifiableSet(keys);
    }

    public static ConfigurationFacts none() {
        return new ConfigurationFacts(new TreeSet<>());
    }

    public static ConfigurationFacts of(String... keys) {
        Set<String> all = new TreeSet<>();
        for (String key : keys) {
            addWithPrefixes(all, key);
        }
        return new ConfigurationFacts(all);
    }

    /**
     * Flattens a JSON object into dotted keys. Null values and empty objects do not count as present.
     */
    public static ConfigurationFacts fromJson(JsonNode profile) {
        Set<String> all = new TreeSet<>();
        if (profile != null && profile.isObject()) {
            flatten(profile, "", all);
        }
        return new ConfigurationFacts(all);
    }

    public boolean has(String key) {
        return keys.contains(key);
    }

    public List<String> missing(List<String> required) {
        return required.stream().filter(k -> !has(k)).toList();
    }

    public Set<String> keys() {
        return keys;
    }

    private static void flatten(JsonNode node, String prefix, Set<String> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isObject()) {
                if (value.size() > 0) {
                    flatten(value, key, out);
                }
            } else {
                addWithPrefixes(out, key);
            }
        }
    }

    private static void addWithPrefixes(Set<String> out, String key) {
        String[] parts = key.split("\\.");
        StringBuilder current = new StringBuilder();
        for (String part : parts) {
            if (current.length() > 0) {
                current.append('.');
            }
            current.append(part);
            out.add(current.toString());
        }
    }
}
