package org.opstranslate.vro.action;

import org.opstranslate.vro.action.models.ActionDef;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory index of vRO actions keyed by fully-qualified name.
 * Iteration follows insertion order, which is the order of the paths given to {@link #build(List)}.
 */
public class ActionIndex {
    private final Map<String, ActionDef> actions = new LinkedHashMap<>();

    public ActionIndex() {
    }

    public ActionIndex(Collection<ActionDef> actions) {
        actions.forEach(this::add);
    }

    /**
     * Parses each action document and indexes the ones that parse cleanly.
     * A failing document is reported on stderr and skipped; it never aborts the build.
     *
     * @param actionFiles action documents, in the order they should be indexed
     * @return the number of actions that failed to parse
     */
    public int build(List<Path> actionFiles) {
        int failed = 0;
        for (Path actionFile : actionFiles) {
            try {
                add(ActionHelper.parseActionXml(actionFile));
            } catch (RuntimeException e) {
                failed++;
                System.err.println("Failed to index action " + actionFile + ": " + e.getMessage());
            }
        }
        System.out.println("Indexed " + actions.size() + " actions (" + failed + " failed)");
        return failed;
    }

    public void add(ActionDef action) {
        actions.put(action.fqName(), action);
    }

    /**
     * @return the action with the given fully-qualified name, or null if not indexed
     */
    public ActionDef get(String fqName) {
        return actions.get(fqName);
    }

    public boolean contains(String fqName) {
        return actions.containsKey(fqName);
    }

    public List<ActionDef> findByModule(String module) {
        return actions.values().stream()
                .filter(a -> a.module().equals(module))
                .toList();
    }

    /**
     * Groups the indexed fully-qualified names by module, modules and names in index order.
     */
    public Map<String, List<String>> modules() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (ActionDef action : actions.values()) {
            result.computeIfAbsent(action.module(), m -> new ArrayList<>()).add(action.fqName());
        }
        return result;
    }

    public Collection<ActionDef> all() {
        return Collections.unmodifiableCollection(actions.values());
    }

    public int size() {
        return actions.size();
    }
}
