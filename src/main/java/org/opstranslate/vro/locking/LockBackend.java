package org.opstranslate.vro.locking;

import org.opstranslate.vro.locking.models.LockPattern;
import org.opstranslate.vro.task.models.TranslatedTask;

import java.util.List;

/**
 * Target-side locking implementation.
 */
public interface LockBackend {
    int RETRY_DELAY_SECONDS = 5;
    int MIN_RETRIES = 12;

    String name();

    List<TranslatedTask> acquire(LockPattern pattern);

    List<TranslatedTask> release(LockPattern pattern);

    /**
     * Retry count covering the lock timeout at the fixed delay, never fewer than {@value #MIN_RETRIES}.
     */
    static int retries(LockPattern pattern) {
        return Math.max(pattern.timeoutSeconds() / RETRY_DELAY_SECONDS, MIN_RETRIES);
    }
}
