package org.opstranslate.vro.workflow;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.action.ActionIndex;
import org.opstranslate.vro.workflow.models.ItemKind;
import org.opstranslate.vro.workflow.models.Position;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowHelperTest {
    private static final Path PROVISION_WORKFLOW =
            Path.of("src/test/resources/fixtures/bundle/workflows/provision_vm.workflow.xml");
    private static final Path CHAIN_WORKFLOW = Path.of("src/test/resources/fixtures/workflows/chain.workflow.xml");
    private static final Path CYCLE_WORKFLOW = Path.of("src/test/resources/fixtures/workflows/cycle.workflow.xml");
    private static final Path UNREACHABLE_WORKFLOW = Path.of("src/test/resources/fixtures/workflows/unreachable.workflow.xml");
    private static final Path KINDS_WORKFLOW = Path.of("src/test/resources/fixtures/workflows/kinds.workflow.xml");
    private static final Path BROKEN_WORKFLOW = Path.of("src/test/resources/fixtures/workflows/broken.workflow.xml");
    private static final Path ACTIONS_DIR = Path.of("src/test/resources/fixtures/bundle/actions");

    @Test
    void shouldParseItemsWithBindingsAndPositions() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(PROVISION_WORKFLOW);

        assertEquals(4, items.size());
        WorkflowItem first = items.get(0);
        assertEquals("item0", first.name());
        assertEquals("Validate Input", first.displayName());
        assertEquals(ItemKind.TASK, first.kind());
        assertEquals("item1", first.nextName());
        assertEquals(new Position(100.0, 60.0), first.position());
        assertEquals(2, first.inBindings().size());
        assertEquals("cpuCount", first.inBindings().get(0).name());
        assertEquals("number", first.inBindings().get(0).type());
        assertEquals("cpuCount", first.inBindings().get(0).exportName());
        assertTrue(first.script().startsWith("if (cpuCount > 16)"));

        WorkflowItem last = items.get(3);
        assertEquals("Finish", last.displayName());
        assertEquals("status", last.outBindings().get(0).name());
    }

    @Test
    void shouldDropEndItems() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(PROVISION_WORKFLOW);

        assertTrue(items.stream().noneMatch(i -> i.kind() == ItemKind.END));
        assertTrue(items.stream().noneMatch(i -> i.name().equals("item4")));
    }

    @Test
    void shouldOrderByFollowingNextPointers() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(CHAIN_WORKFLOW);

        assertEquals(List.of("First", "Second", "Third"), items.stream().map(WorkflowItem::displayName).toList());
    }

    @Test
    void shouldStartCycleAtSmallestPositionAndVisitEachItemOnce() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(CYCLE_WORKFLOW);

        assertEquals(List.of("a", "b", "c"), items.stream().map(WorkflowItem::name).toList());
    }

    @Test
    void shouldOmitItemsUnreachableFromRoot() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(UNREACHABLE_WORKFLOW);

        assertEquals(List.of("start", "next"), items.stream().map(WorkflowItem::name).toList());
    }

    @Test
    void shouldFallBackToNameWhenDisplayNameIsMissing() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(CYCLE_WORKFLOW);

        assertEquals("a", items.get(0).displayName());
    }

    @Test
    void shouldMapItemKinds() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(KINDS_WORKFLOW);

        assertEquals(List.of(ItemKind.DECISION, ItemKind.INTERACTION, ItemKind.EMAIL, ItemKind.UNKNOWN, ItemKind.TASK),
                items.stream().map(WorkflowItem::kind).toList());
        assertEquals("notify", items.get(0).altNextName());
        assertEquals("link", items.get(3).type());
        assertNull(items.get(4).script());
    }

    @Test
    void shouldFailOnMalformedWorkflow() {
        RuntimeException ex = assertThrows(RuntimeException.class,
                () -> WorkflowHelper.parseWorkflowFile(BROKEN_WORKFLOW));

        assertTrue(ex.getMessage().startsWith("Failed to parse workflow file"));
    }

    @Test
    void shouldFailOnMissingWorkflow() {
        assertThrows(RuntimeException.class,
                () -> WorkflowHelper.parseWorkflowFile(Path.of("src/test/resources/fixtures/workflows/absent.workflow.xml")));
    }

    @Test
    void shouldResolveActionCallsAgainstIndex() {
        ActionIndex index = new ActionIndex();
        index.build(List.of(
                ACTIONS_DIR.resolve("com.acme.nsx/createFirewallRule.action.xml"),
                ACTIONS_DIR.resolve("com/acme/utils/formatHostname.action.xml")));

        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(PROVISION_WORKFLOW, index);
        WorkflowItem firewall = items.get(1);

        assertEquals(3, firewall.actionCalls().size());
        assertEquals(List.of("com.acme.nsx/createFirewallRule", "com.acme.utils/formatHostname"),
                firewall.resolvedActions().stream().map(a -> a.fqName()).toList());
        assertEquals(List.of("com.acme.missing/doSomething"), firewall.unresolvedActions());
    }

    @Test
    void shouldLeaveActionListsEmptyWithoutIndex() {
        List<WorkflowItem> items = WorkflowHelper.parseWorkflowFile(PROVISION_WORKFLOW);
        WorkflowItem firewall = items.get(1);

        assertTrue(firewall.actionCalls().isEmpty());
        assertTrue(firewall.resolvedActions().isEmpty());
        assertTrue(firewall.unresolvedActions().isEmpty());
    }

    @Test
    void shouldSortDirectlyBuiltItems() {
        WorkflowItem c = new WorkflowItem("c", ItemKind.TASK, null, null);
        WorkflowItem a = new WorkflowItem("a", ItemKind.TASK, null, "b");
        WorkflowItem b = new WorkflowItem("b", ItemKind.TASK, null, "c");

        List<WorkflowItem> ordered = WorkflowHelper.sortByExecutionOrder(List.of(c, a, b));

        assertEquals(List.of("a", "b", "c"), ordered.stream().map(WorkflowItem::name).toList());
        assertTrue(WorkflowHelper.sortByExecutionOrder(List.of()).isEmpty());
    }

    @Test
    void shouldPreferPositionedItemsWhenEveryItemIsReferenced() {
        WorkflowItem unpositioned = WorkflowItem.builder().name("a").nextName("b").build();
        WorkflowItem positioned = WorkflowItem.builder().name("b").nextName("a").position(new Position(500, 500)).build();

        List<WorkflowItem> ordered = WorkflowHelper.sortByExecutionOrder(List.of(unpositioned, positioned));

        assertEquals(List.of("b", "a"), ordered.stream().map(WorkflowItem::name).toList());
    }
}
