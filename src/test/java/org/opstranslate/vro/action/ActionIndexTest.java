package org.opstranslate.vro.action;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.action.models.ActionDef;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionIndexTest {
    private static final Path NSX_ACTION =
            Path.of("src/test/resources/fixtures/bundle/actions/com.acme.nsx/createFirewallRule.action.xml");
    private static final Path UTILS_ACTION =
            Path.of("src/test/resources/fixtures/bundle/actions/com/acme/utils/formatHostname.action.xml");
    private static final Path NO_SCRIPT_ACTION = Path.of("src/test/resources/fixtures/malformed/noScript.action.xml");
    private static final Path UNKNOWN_ROOT_ACTION = Path.of("src/test/resources/fixtures/malformed/unknownRoot.action.xml");

    @Test
    void shouldSkipFailingActionsWithoutAbortingBuild() {
        ActionIndex index = new ActionIndex();

        int failed = index.build(List.of(NSX_ACTION, NO_SCRIPT_ACTION, UTILS_ACTION, UNKNOWN_ROOT_ACTION));

        assertEquals(2, failed);
        assertEquals(2, index.size());
        assertTrue(index.contains("com.acme.nsx/createFirewallRule"));
        assertTrue(index.contains("com.acme.utils/formatHostname"));
        assertFalse(index.contains("com.acme.broken/noScript"));
    }

    @Test
    void shouldReturnNullForUnknownAction() {
        ActionIndex index = new ActionIndex();
        index.build(List.of(NSX_ACTION));

        assertNull(index.get("com.acme.nsx/deleteFirewallRule"));
        assertNotNull(index.get("com.acme.nsx/createFirewallRule"));
    }

    @Test
    void shouldFindActionsByModule() {
        ActionIndex index = new ActionIndex();
        index.build(List.of(NSX_ACTION, UTILS_ACTION));

        List<ActionDef> nsx = index.findByModule("com.acme.nsx");
        assertEquals(1, nsx.size());
        assertEquals("createFirewallRule", nsx.get(0).name());
        assertTrue(index.findByModule("com.acme.none").isEmpty());
    }

    @Test
    void shouldGroupNamesByModuleInIndexOrder() {
        ActionIndex index = new ActionIndex();
        index.build(List.of(UTILS_ACTION, NSX_ACTION));

        Map<String, List<String>> modules = index.modules();

        assertEquals(List.of("com.acme.utils", "com.acme.nsx"), List.copyOf(modules.keySet()));
        assertEquals(List.of("com.acme.nsx/createFirewallRule"), modules.get("com.acme.nsx"));
    }

    @Test
    void shouldKeepLastDefinitionForDuplicateName() {
        ActionDef first = ActionDef.builder().fqName("m/a").name("a").module("m").script("one").build();
        ActionDef second = ActionDef.builder().fqName("m/a").name("a").module("m").script("two").build();

        ActionIndex index = new ActionIndex(List.of(first, second));

        assertEquals(1, index.size());
        assertEquals("two", index.get("m/a").script());
    }
}
