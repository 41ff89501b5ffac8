package org.opstranslate.vro.integration;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.script.CallScanner;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;
import org.opstranslate.vro.workflow.models.WorkflowItem;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationCallExtractorTest {
    private static final String INCIDENT_SCRIPT =
            "var incident = ServiceNow.createIncident(\"Disk full\", \"Host \" + host, 2);";
    private static final WorkflowItem ITEM = WorkflowItem.builder()
            .name("item2")
            .displayName("Alert Ops")
            .build();

    private static IntegrationCallExtractor extractor(ConfigurationFacts facts) {
        return new IntegrationCallExtractor(IntegrationMappingHelper.loadDefaultMappings(), facts);
    }

    @Test
    void shouldEmitRealTaskWhenConfigurationIsPresent() {
        List<TranslatedTask> tasks =
                extractor(ConfigurationFacts.of("itsm.servicenow.instance")).extract(INCIDENT_SCRIPT, ITEM);

        assertEquals(1, tasks.size());
        TranslatedTask task = tasks.get(0);
        assertEquals("Servicenow createIncident: Alert Ops", task.name());
        assertEquals("servicenow.itsm.incident", task.action());
        assertEquals("new", task.params().get("state"));
        assertEquals("Disk full", task.params().get("short_description"));
        assertEquals("Host {{ host }}", task.params().get("description"));
        assertEquals("2", task.params().get("urgency"));
        assertEquals("incident", task.register());
        assertEquals(List.of("integration", "servicenow"), task.tags());
    }

    @Test
    void shouldEmitDecisionRequiredStubWhenConfigurationIsMissing() {
        List<TranslatedTask> tasks = extractor(ConfigurationFacts.none()).extract(INCIDENT_SCRIPT, ITEM);

        assertEquals(1, tasks.size());
        TranslatedTask stub = tasks.get(0);
        assertEquals("DECISION REQUIRED: Servicenow createIncident", stub.name());
        assertEquals(TargetActions.FAIL, stub.action());
        assertEquals(List.of("decision_required", "integration", "servicenow"), stub.tags());
        assertEquals("Missing configuration: itsm.servicenow", stub.comment());

        String msg = (String) stub.params().get("msg");
        assertTrue(msg.contains("Evidence: ServiceNow.createIncident(\"Disk full\", \"Host \" + host, 2)"));
        assertTrue(msg.contains("Missing configuration:"));
        assertTrue(msg.contains("- profile.itsm.servicenow"));
        assertTrue(msg.contains("Action required:"));
    }

    @Test
    void shouldTranslateRestRequestWithoutRequiredConfiguration() {
        String script = "var response = request.createRequest(\"GET\", \"/api/vms\");";

        List<TranslatedTask> tasks = extractor(ConfigurationFacts.none()).extract(script, ITEM);

        assertEquals(1, tasks.size());
        assertEquals("ansible.builtin.uri", tasks.get(0).action());
        assertEquals("GET", tasks.get(0).params().get("method"));
        assertEquals("{{ rest_base_url }}/api/vms", tasks.get(0).params().get("url"));
        assertEquals(Boolean.TRUE, tasks.get(0).params().get("return_content"));
        assertEquals("response", tasks.get(0).register());
    }

    @Test
    void shouldOnlyClaimMappedCalls() {
        IntegrationCallExtractor extractor = extractor(ConfigurationFacts.none());

        assertTrue(extractor.claims(CallScanner.scan("Infoblox.getNextAvailableIP(\"10.0.0.0/24\");").get(0)));
        assertFalse(extractor.claims(CallScanner.scan("vm.powerOn();").get(0)));
        assertTrue(extractor.extract("vm.powerOn();", ITEM).isEmpty());
    }

    @Test
    void shouldSubstituteNestedParamsAndDropMissingArguments() {
        Map<String, Object> template = Map.of(
                "name", "{arg0}",
                "password", "{arg1}",
                "groups", Map.of("set", "{arg3}"),
                "state", "present");

        Map<String, Object> params =
                IntegrationCallExtractor.substituteParams(template, List.of("\"jdoe\"", "secret"));

        assertEquals("jdoe", params.get("name"));
        assertEquals("{{ secret }}", params.get("password"));
        assertEquals(Map.of(), params.get("groups"));
        assertEquals("present", params.get("state"));
    }

    @Test
    void shouldDropEmbeddedPlaceholderWithoutArgument() {
        Map<String, Object> params = IntegrationCallExtractor.substituteParams(
                Map.of("url", "{{ base }}{arg1}", "flag", true), List.of("\"GET\""));

        assertFalse(params.containsKey("url"));
        assertEquals(Boolean.TRUE, params.get("flag"));
    }
}
