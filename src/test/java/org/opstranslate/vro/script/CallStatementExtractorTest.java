package org.opstranslate.vro.script;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.action.models.ActionDef;
import org.opstranslate.vro.action.models.ActionInput;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallStatementExtractorTest {
    private static final ActionDef FIREWALL_ACTION = ActionDef.builder()
            .fqName("com.acme.nsx/createFirewallRule")
            .name("createFirewallRule")
            .module("com.acme.nsx")
            .script("return 1;")
            .inputs(List.of(new ActionInput("ruleName", "string", null), new ActionInput("port", "number", null)))
            .sourcePath("actions/com.acme.nsx/createFirewallRule.action.xml")
            .build();

    private static WorkflowItem item(String script) {
        return WorkflowItem.builder()
                .name("item1")
                .displayName("Configure Network")
                .script(script)
                .resolvedActions(List.of(FIREWALL_ACTION))
                .unresolvedActions(List.of("com.acme.missing/run"))
                .build();
    }

    @Test
    void shouldIncludeResolvedActionWithInputVars() {
        String script = "var nsx = System.getModule(\"com.acme.nsx\");\nvar id = nsx.createFirewallRule(name + \"-fw\", 443);";

        List<TranslatedTask> tasks = new CallStatementExtractor().extract(script, item(script));

        assertEquals(1, tasks.size());
        TranslatedTask task = tasks.get(0);
        assertEquals("Call action: com.acme.nsx/createFirewallRule", task.name());
        assertEquals(TargetActions.INCLUDE_TASKS, task.action());
        assertEquals("actions/com.acme.nsx/createFirewallRule.yml", task.params().get("file"));
        Map<?, ?> vars = (Map<?, ?>) task.params().get("vars");
        assertEquals("{{ name }}-fw", vars.get("ruleName"));
        assertEquals("443", vars.get("port"));
        assertEquals("id", task.register());
        assertTrue(task.hasTag("action_call"));
        assertTrue(task.comment().startsWith("Resolved action"));
    }

    @Test
    void shouldIncludeUnresolvedActionWithComment() {
        String script = "System.getModule(\"com.acme.missing\").run();";

        List<TranslatedTask> tasks = new CallStatementExtractor().extract(script, item(script));

        assertEquals(1, tasks.size());
        assertEquals("actions/com.acme.missing/run.yml", tasks.get(0).params().get("file"));
        assertFalse(tasks.get(0).params().containsKey("vars"));
        assertTrue(tasks.get(0).comment().startsWith("Unresolved action com.acme.missing/run"));
    }

    @Test
    void shouldIncludeRoleForNestedWorkflow() {
        String script = "var wf = Server.getWorkflowWithId(\"Deploy App-Tier\");";

        List<TranslatedTask> tasks = new CallStatementExtractor().extract(script, item(script));

        assertEquals(1, tasks.size());
        assertEquals(TargetActions.INCLUDE_ROLE, tasks.get(0).action());
        assertEquals("deploy_app_tier", tasks.get(0).params().get("name"));
        assertTrue(tasks.get(0).hasTag("workflow_call"));
    }

    @Test
    void shouldEmitTodoForUnknownCalls() {
        String script = "vm.powerOffVM_Task();";

        List<TranslatedTask> tasks = new CallStatementExtractor().extract(script, item(script));

        assertEquals(1, tasks.size());
        assertEquals("TODO: vm.powerOffVM_Task (Configure Network)", tasks.get(0).name());
        assertTrue(tasks.get(0).hasTag("todo"));
        assertEquals("Source: vm.powerOffVM_Task()", tasks.get(0).comment());
    }

    @Test
    void shouldSkipSystemLockingAndConstructorCalls() {
        String script = "System.log(\"x\");\n"
                + "LockingSystem.lockAndWait(\"r\", 10);\n"
                + "var h = new RESTHost(\"api\");\n"
                + "var nsx = System.getModule(\"com.acme.nsx\");\n"
                + "LockingSystem.unlock(\"r\");";

        assertTrue(new CallStatementExtractor().extract(script, item(script)).isEmpty());
    }

    @Test
    void shouldSkipCallsClaimedElsewhere() {
        String script = "ServiceNow.createIncident(\"a\");\nother();";

        List<TranslatedTask> tasks = new CallStatementExtractor(site -> site.callee().startsWith("ServiceNow."))
                .extract(script, item(script));

        assertEquals(1, tasks.size());
        assertEquals("TODO: other (Configure Network)", tasks.get(0).name());
    }
}
