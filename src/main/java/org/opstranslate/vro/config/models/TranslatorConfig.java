package org.opstranslate.vro.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Root of translator-config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranslatorConfig {
    public LockingConfig locking = new LockingConfig();
    public ApprovalConfig approval = new ApprovalConfig();

    /**
     * Environment facts integration codegen may rely on.
     * Example: {"itsm": {"servicenow": {"instance": "https://acme.service-now.com"}}}
     */
    public JsonNode profile;

    /**
     * Optional integration mappings file replacing the bundled one.
     */
    public String mappingsFile;
}
