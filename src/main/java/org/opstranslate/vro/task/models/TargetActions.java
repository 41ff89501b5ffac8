package org.opstranslate.vro.task.models;

/**
 * Target module names used by the generated tasks.
 */
public final class TargetActions {
    public static final String DEBUG = "ansible.builtin.debug";
    public static final String SET_FACT = "ansible.builtin.set_fact";
    public static final String ASSERT = "ansible.builtin.assert";
    public static final String FAIL = "ansible.builtin.fail";
    public static final String PAUSE = "ansible.builtin.pause";
    public static final String INCLUDE_TASKS = "ansible.builtin.include_tasks";
    public static final String INCLUDE_ROLE = "ansible.builtin.include_role";
    public static final String FILE = "ansible.builtin.file";
    public static final String MAIL = "community.general.mail";
    public static final String REDIS_DATA = "community.general.redis_data";
    public static final String CONSUL_SESSION = "community.general.consul_session";
    public static final String CONSUL_KV = "community.general.consul_kv";

    private TargetActions() {
    }
}
