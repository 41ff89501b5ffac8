package org.opstranslate.vro.locking.models;

/**
 * A {@code LockingSystem.lock*} call and, when found, its matching unlock call.
 *
 * @param resource       lock key as written in the script
 * @param timeoutSeconds acquisition timeout, 300 unless the script passes an integer
 * @param lockPosition   offset of the lock call
 * @param lockEnd        offset just past the lock statement
 * @param unlockPosition offset of the matching unlock call, or null when the lock is never released
 * @param unlockEnd      offset just past the unlock statement, or null
 * @param hasTryFinally  whether a finally block lies between lock and unlock
 */
public record LockPattern(
        String resource,
        int timeoutSeconds,
        int lockPosition,
        int lockEnd,
        Integer unlockPosition,
        Integer unlockEnd,
        boolean hasTryFinally
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public boolean isReleased() {
        return unlockPosition != null;
    }
}
