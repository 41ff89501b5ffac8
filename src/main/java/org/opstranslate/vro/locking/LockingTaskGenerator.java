package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TaskNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class LockingTaskGenerator {
    private static final Map<String, LockBackend> BACKENDS = Map.of(
            "redis", new RedisLockBackend(),
            "consul", new ConsulLockBackend(),
            "file", new FileLockBackend());

    private final LockBackend backend;

    /**
     * @param backendName one of "redis", "consul", "file"
     * @throws IllegalArgumentException for any other backend name
     */
    public LockingTaskGenerator(String backendName) {
        LockBackend selected = backendName == null ? null : BACKENDS.get(backendName);
        if (selected == null) {
            throw new IllegalArgumentException(
                    "Unsupported locking backend: " + backendName + ". Valid options: redis, consul, file");
        }
        this.backend = selected;
    }

    public static boolean isSupported(String backendName) {
        return backendName != null && BACKENDS.containsKey(backendName);
    }

    public String backendName() {
        return backend.name();
    }

    /**
     * Wraps work in acquire/release: the primary section acquires the lock and runs the work, the
     * always section releases it whether or not the work failed.
     *
     * @param pattern lock to synthesize
     * @param work    tasks to run while holding the lock
     * @return the locking block
     */
    public GuardedBlock generateLockTasks(LockPattern pattern, List<TaskNode> work) {
        List<TaskNode> primary = new ArrayList<>(backend.acquire(pattern));
        primary.addAll(work);

        return GuardedBlock.builder()
                .name("Execute with lock: " + pattern.resource())
                .primary(primary)
                .always(new ArrayList<>(backend.release(pattern)))
                .tags(List.of("locking"))
                .comment("LockingSystem lock on '" + pattern.resource() + "' (" + backend.name() + " backend, timeout "
                        + pattern.timeoutSeconds() + "s)")
                .build();
    }
}
