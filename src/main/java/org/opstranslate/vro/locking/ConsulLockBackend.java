package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consul lock: a session with a TTL owns the KV key. Destroying the session releases the key.
 */
public class ConsulLockBackend implements LockBackend {

    @Override
    public String name() {
        return "consul";
    }

    @Override
    public List<TranslatedTask> acquire(LockPattern pattern) {
        String var = LockingHelper.sanitizeResourceName(pattern.resource());
        String sessionVar = var + "_session";
        String lockVar = var + "_lock";

        Map<String, Object> sessionParams = new LinkedHashMap<>();
        sessionParams.put("state", "present");
        sessionParams.put("name", "lock_" + pattern.resource());
        sessionParams.put("ttl", pattern.timeoutSeconds());

        Map<String, Object> kvParams = new LinkedHashMap<>();
        kvParams.put("key", "locks/" + pattern.resource());
        kvParams.put("value", "{{ ansible_date_time.epoch }}");
        kvParams.put("session", "{{ " + sessionVar + ".session_id }}");

        return List.of(
                TranslatedTask.builder()
                        .name("Create Consul session for " + pattern.resource())
                        .action(TargetActions.CONSUL_SESSION)
                        .params(sessionParams)
                        .register(sessionVar)
                        .tags(List.of("locking"))
                        .build(),
                TranslatedTask.builder()
                        .name("Acquire Consul lock: " + pattern.resource())
                        .action(TargetActions.CONSUL_KV)
                        .params(kvParams)
                        .register(lockVar)
                        .until(lockVar + " is not failed")
                        .retries(LockBackend.retries(pattern))
                        .delay(RETRY_DELAY_SECONDS)
                        .tags(List.of("locking"))
                        .build());
    }

    @Override
    public List<TranslatedTask> release(LockPattern pattern) {
        String sessionVar = LockingHelper.sanitizeResourceName(pattern.resource()) + "_session";

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("state", "absent");
        params.put("session_id", "{{ " + sessionVar + ".session_id }}");

        return List.of(TranslatedTask.builder()
                .name("Release Consul lock: " + pattern.resource())
                .action(TargetActions.CONSUL_SESSION)
                .params(params)
                .when(sessionVar + " is defined")
                .tags(List.of("locking"))
                .build());
    }
}
