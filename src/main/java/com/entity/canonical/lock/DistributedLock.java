package com.entity.canonical.lock;

/**
 * Serializes index rebuilds. Each entity type has its own key, built by
 * {@link #fitKey(String)}, so fits of different types run in parallel.
 */
public interface DistributedLock {

    static String fitKey(String entityType) {
        return "fit:" + entityType;
    }

    /**
     * Waits for the key up to the configured timeout.
     *
     * @return true once the caller holds the key
     * @throws LockAcquisitionException if another holder keeps it past the timeout
     */
    boolean tryLock(String key);

    /**
     * Releases a key held by the caller; a no-op for a key it does not hold.
     */
    void unlock(String key);
}
