package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lock file on the control node. Not distributed: only serializes runs on one machine.
 */
public class FileLockBackend implements LockBackend {
    private static final String LOCK_DIR = "/var/lock/ansible/";

    @Override
    public String name() {
        return "file";
    }

    @Override
    public List<TranslatedTask> acquire(LockPattern pattern) {
        String var = LockingHelper.sanitizeResourceName(pattern.resource());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("path", LOCK_DIR + var + ".lock");
        params.put("state", "touch");
        params.put("modification_time", "preserve");
        params.put("access_time", "preserve");

        return List.of(TranslatedTask.builder()
                .name("Acquire file lock: " + pattern.resource() + " (WARNING: not distributed)")
                .action(TargetActions.FILE)
                .params(params)
                .register(var + "_lock")
                .until(var + "_lock is not failed")
                .retries(LockBackend.retries(pattern))
                .delay(RETRY_DELAY_SECONDS)
                .failedWhen("false")
                .tags(List.of("locking"))
                .build());
    }

    @Override
    public List<TranslatedTask> release(LockPattern pattern) {
        String var = LockingHelper.sanitizeResourceName(pattern.resource());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("path", LOCK_DIR + var + ".lock");
        params.put("state", "absent");

        return List.of(TranslatedTask.builder()
                .name("Release file lock: " + pattern.resource())
                .action(TargetActions.FILE)
                .params(params)
                .when(var + "_lock is succeeded")
                .tags(List.of("locking"))
                .build());
    }
}
