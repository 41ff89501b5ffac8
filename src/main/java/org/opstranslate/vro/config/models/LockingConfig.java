package org.opstranslate.vro.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LockingConfig {
    public boolean enabled = true;

    /**
     * "redis", "consul" or "file".
     */
    public String backend = "redis";

    /**
     * Treat a lock without a matching unlock as intentional and lock the rest of the script.
     */
    public boolean acknowledgeUnreleased;
}
