package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis lock: {@code SET key value NX} with an expiry, so a crashed run cannot hold the lock forever.
 */
public class RedisLockBackend implements LockBackend {

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public List<TranslatedTask> acquire(LockPattern pattern) {
        String var = LockingHelper.sanitizeResourceName(pattern.resource());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "lock:" + pattern.resource());
        params.put("value", "{{ ansible_date_time.epoch }}");
        params.put("expiration", pattern.timeoutSeconds() * 1000L);
        params.put("nx", true);

        return List.of(TranslatedTask.builder()
                .name("Acquire lock: " + pattern.resource())
                .action(TargetActions.REDIS_DATA)
                .params(params)
                .register(var + "_lock")
                .until(var + "_lock is not failed")
                .retries(LockBackend.retries(pattern))
                .delay(RETRY_DELAY_SECONDS)
                .tags(List.of("locking"))
                .build());
    }

    @Override
    public List<TranslatedTask> release(LockPattern pattern) {
        String var = LockingHelper.sanitizeResourceName(pattern.resource());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "lock:" + pattern.resource());
        params.put("state", "absent");

        return List.of(TranslatedTask.builder()
                .name("Release lock: " + pattern.resource())
                .action(TargetActions.REDIS_DATA)
                .params(params)
                .when(var + "_lock is succeeded")
                .tags(List.of("locking"))
                .build());
    }
}
