package org.opstranslate.vro.locking;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.GuardedBlock;
import org.opstranslate.vro.task.models.TargetActions;
import org.opstranslate.vro.task.models.TaskNode;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LockingTaskGeneratorTest {
    private static final List<TaskNode> WORK =
            List.of(new TranslatedTask("Do work", TargetActions.DEBUG, Map.of("msg", "work")));

    private static LockPattern lock(String resource, int timeout) {
        return new LockPattern(resource, timeout, 0, 10, 20, 30, true);
    }

    @Test
    void shouldWrapWorkWithRedisLock() {
        GuardedBlock block = new LockingTaskGenerator("redis").generateLockTasks(lock("ip-pool", 60), WORK);

        assertEquals("Execute with lock: ip-pool", block.name());
        assertEquals(List.of("locking"), block.tags());
        assertNull(block.onFailure());
        assertEquals(2, block.primary().size());

        TranslatedTask acquire = (TranslatedTask) block.primary().get(0);
        assertEquals(TargetActions.REDIS_DATA, acquire.action());
        assertEquals("lock:ip-pool", acquire.params().get("key"));
        assertEquals(60000L, acquire.params().get("expiration"));
        assertEquals(Boolean.TRUE, acquire.params().get("nx"));
        assertEquals("ip_pool_lock", acquire.register());
        assertEquals("ip_pool_lock is not failed", acquire.until());
        assertEquals(12, acquire.retries());
        assertEquals(5, acquire.delay());
        assertSame(WORK.get(0), block.primary().get(1));

        TranslatedTask release = (TranslatedTask) block.always().get(0);
        assertEquals("absent", release.params().get("state"));
        assertEquals("ip_pool_lock is succeeded", release.when());
    }

    @Test
    void shouldScaleRetriesWithTimeout() {
        assertEquals(12, LockBackend.retries(lock("r", 10)));
        assertEquals(12, LockBackend.retries(lock("r", 60)));
        assertEquals(60, LockBackend.retries(lock("r", 300)));
        assertEquals(120, LockBackend.retries(lock("r", 600)));
    }

    @Test
    void shouldUseSessionForConsulLock() {
        GuardedBlock block = new LockingTaskGenerator("consul").generateLockTasks(lock("db", 300), WORK);

        assertEquals(3, block.primary().size());
        TranslatedTask session = (TranslatedTask) block.primary().get(0);
        assertEquals(TargetActions.CONSUL_SESSION, session.action());
        assertEquals(300, session.params().get("ttl"));
        assertEquals("db_session", session.register());

        TranslatedTask kv = (TranslatedTask) block.primary().get(1);
        assertEquals(TargetActions.CONSUL_KV, kv.action());
        assertEquals("{{ db_session.session_id }}", kv.params().get("session"));
        assertEquals(60, kv.retries());

        TranslatedTask release = (TranslatedTask) block.always().get(0);
        assertEquals(TargetActions.CONSUL_SESSION, release.action());
        assertEquals("db_session is defined", release.when());
    }

    @Test
    void shouldWarnThatFileLockIsNotDistributed() {
        GuardedBlock block = new LockingTaskGenerator("file").generateLockTasks(lock("build", 30), WORK);

        TranslatedTask acquire = (TranslatedTask) block.primary().get(0);
        assertTrue(acquire.name().contains("not distributed"));
        assertEquals("/var/lock/ansible/build.lock", acquire.params().get("path"));
        assertEquals("false", acquire.failedWhen());
        assertTrue(block.primary().stream().allMatch(t -> t == WORK.get(0) || t.tags().contains("locking")));
    }

    @Test
    void shouldRejectUnknownBackend() {
        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> new LockingTaskGenerator("zookeeper"));

        assertTrue(e.getMessage().contains("Unsupported locking backend: zookeeper"));
        assertFalse(LockingTaskGenerator.isSupported("zookeeper"));
        assertFalse(LockingTaskGenerator.isSupported(null));
        assertEquals("consul", new LockingTaskGenerator("consul").backendName());
    }

    @Test
    void shouldComputeRedisExpirationWithoutOverflow() {
        GuardedBlock block = new LockingTaskGenerator("redis").generateLockTasks(lock("pool", 3000000), WORK);

        TranslatedTask acquire = (TranslatedTask) block.primary().get(0);
        assertEquals(3000000000L, acquire.params().get("expiration"));
    }
}
