package org.opstranslate.vro.workflow;

import org.opstranslate.vro.action.ActionIndex;
import org.opstranslate.vro.util.XmlHelper;
import org.opstranslate.vro.workflow.models.Binding;
import org.opstranslate.vro.workflow.models.ItemKind;
import org.opstranslate.vro.workflow.models.Position;
import org.opstranslate.vro.workflow.models.WorkflowItem;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class WorkflowHelper {

    public static List<WorkflowItem> parseWorkflowFile(Path workflowFile) {
        return parseWorkflowFile(workflowFile, null);
    }

    /**
     * Parses a vRO workflow export into its items, sorted into execution order.
     * END items are dropped. With an action index, every item is annotated with the actions its
     * script calls.
     *
     * @param workflowFile workflow XML
     * @param actionIndex  optional index used to resolve {@code System.getModule} calls
     * @return items in execution order
     * @throws RuntimeException if the file is missing or not well-formed
     */
    public static List<WorkflowItem> parseWorkflowFile(Path workflowFile, ActionIndex actionIndex) {
        Document doc;
        try {
            doc = XmlHelper.parseDocument(workflowFile);
        } catch (RuntimeException e) {
            throw new RuntimeException("Failed to parse workflow file: " + workflowFile, e);
        }

        List<WorkflowItem> items = new ArrayList<>();
        for (Element itemEl : XmlHelper.descendants(doc.getDocumentElement(), "workflow-item")) {
            WorkflowItem item = parseWorkflowItem(itemEl);
            if (item == null) {
                continue;
            }
            items.add(ActionCallHelper.resolveActions(item, actionIndex));
        }

        List<WorkflowItem> ordered = sortByExecutionOrder(items);
        System.out.println("Parsed workflow " + workflowFile.getFileName() + ": "
                + items.size() + " items, " + ordered.size() + " reachable");
        return ordered;
    }

    private static WorkflowItem parseWorkflowItem(Element itemEl) {
        String type = XmlHelper.attributeOrNull(itemEl, "type");
        ItemKind kind = ItemKind.fromXmlType(type);
        if (kind == ItemKind.END) {
            return null;
        }

        String name = itemEl.getAttribute("name");
        String displayName = XmlHelper.childText(itemEl, "display-name");
        String script = XmlHelper.childText(itemEl, "script");
        if (script != null) {
            script = script.strip();
            if (script.isEmpty()) {
                script = null;
            }
        }

        return WorkflowItem.builder()
                .name(name)
                .kind(kind)
                .type(type == null ? "task" : type)
                .displayName(displayName == null ? null : displayName.strip())
                .script(script)
                .inBindings(parseBindings(itemEl, "in-binding"))
                .outBindings(parseBindings(itemEl, "out-binding"))
                .nextName(emptyToNull(XmlHelper.attributeOrNull(itemEl, "out-name")))
                .altNextName(emptyToNull(XmlHelper.attributeOrNull(itemEl, "alt-out-name")))
                .position(parsePosition(itemEl))
                .build();
    }

    private static List<Binding> parseBindings(Element itemEl, String bindingElement) {
        List<Binding> bindings = new ArrayList<>();
        for (Element bindingEl : XmlHelper.childElements(itemEl, bindingElement)) {
            for (Element bind : XmlHelper.childElements(bindingEl, "bind")) {
                bindings.add(new Binding(
                        bind.getAttribute("name"),
                        XmlHelper.attributeOrNull(bind, "type"),
                        XmlHelper.attributeOrNull(bind, "export-name")));
            }
        }
        return bindings;
    }

    private static Position parsePosition(Element itemEl) {
        Element positionEl = XmlHelper.firstChild(itemEl, "position");
        if (positionEl == null) {
            return null;
        }
        try {
            return new Position(
                    Double.parseDouble(positionEl.getAttribute("x")),
                    Double.parseDouble(positionEl.getAttribute("y")));
        } catch (NumberFormatException e) {
            System.err.println("Ignoring invalid position on item '" + itemEl.getAttribute("name") + "'");
            return null;
        }
    }

    /**
     * Orders items by following {@code nextName} links from a single root.
     * <p>
     * The root is the first item, in document order, that no other item points to. If every item is
     * pointed to (a cycle), the item with the smallest position is used instead. Traversal stops at a
     * missing successor or at an already visited item, so cycles terminate. Items not reachable from
     * the root are omitted.
     *
     * @param items items in document order
     * @return reachable items in execution order
     */
    public static List<WorkflowItem> sortByExecutionOrder(List<WorkflowItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }

        Map<String, WorkflowItem> byName = new LinkedHashMap<>();
        for (WorkflowItem item : items) {
            byName.putIfAbsent(item.name(), item);
        }

        Set<String> referenced = new HashSet<>();
        for (WorkflowItem item : items) {
            if (item.nextName() != null) {
                referenced.add(item.nextName());
            }
        }

        WorkflowItem root = items.stream()
                .filter(item -> !referenced.contains(item.name()))
                .findFirst()
                .orElseGet(() -> items.stream().min(POSITION_ORDER).orElseThrow());

        List<WorkflowItem> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        WorkflowItem current = root;
        while (current != null && visited.add(current.name())) {
            ordered.add(current);
            current = current.nextName() == null ? null : byName.get(current.nextName());
        }

        if (ordered.size() < items.size()) {
            System.out.println("Skipping " + (items.size() - ordered.size())
                    + " items not reachable from '" + root.name() + "'");
        }
        return ordered;
    }

    // smallest x, then y; items without a position sort last; ties broken by name
    private static final Comparator<WorkflowItem> POSITION_ORDER = Comparator
            .comparing((WorkflowItem item) -> item.position() == null)
            .thenComparingDouble(item -> item.position() == null ? 0 : item.position().x())
            .thenComparingDouble(item -> item.position() == null ? 0 : item.position().y())
            .thenComparing(WorkflowItem::name);

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
