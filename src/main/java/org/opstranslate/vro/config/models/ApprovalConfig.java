package org.opstranslate.vro.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ApprovalConfig {
    /**
     * "blocked", "servicenow", "aap_workflow" or "pause".
     */
    public String model = "blocked";
}
