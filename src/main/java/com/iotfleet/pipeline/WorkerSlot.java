package com.iotfleet.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Capacity token handed out by {@link BoundedWorkerPool#acquire}. Released exactly once:
 * later {@link #release()} calls are no-ops.
 */
public final class WorkerSlot {

    private final BoundedWorkerPool pool;
    private final AtomicBoolean released = new AtomicBoolean(false);

    WorkerSlot(BoundedWorkerPool pool) {
        this.pool = pool;
    }

    /**
     * @return true if this call returned the slot to the pool
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        pool.returnSlot();
        return true;
    }

    public boolean isReleased() {
        return released.get();
    }
}
