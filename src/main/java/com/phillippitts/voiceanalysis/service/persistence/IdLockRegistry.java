package com.phillippitts.voiceanalysis.service.persistence;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-id locks. Calls for the same id are always serialized; calls for different
 * ids usually proceed in parallel (two ids may share a stripe).
 *
 * <p>Locks are reentrant so a locked operation may call another locked operation for the
 * same id.
 */
public class IdLockRegistry {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public IdLockRegistry() {
        this(DEFAULT_STRIPES);
    }

    public IdLockRegistry(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(long id, Supplier<T> action) {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(long id, Runnable action) {
        withLock(id, () -> {
            action.run();
            return null;
        });
    }

    ReentrantLock lockFor(long id) {
        return stripes[Math.floorMod(Long.hashCode(id), stripes.length)];
    }
}
