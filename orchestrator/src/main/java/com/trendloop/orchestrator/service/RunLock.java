package com.trendloop.orchestrator.service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide exclusive lock for pipeline runs.
 *
 * Non-blocking: {@link #acquire} either takes the lock at once or reports who holds
 * it. There is no queueing. The holder is identified by run id so the lock can be
 * released from a different thread than the one that took it.
 */
public class RunLock {

    private final AtomicReference<UUID> holder = new AtomicReference<>();

    /**
     * @throws ConcurrentRunException if another run holds the lock
     */
    public void acquire(UUID runId) {
        if (!holder.compareAndSet(null, runId)) {
            UUID active = holder.get();
            // The holder may have released between the CAS and the read; retry once.
            if (active == null && holder.compareAndSet(null, runId)) return;
            throw new ConcurrentRunException(active);
        }
    }

    /** Release if {@code runId} is the holder; a no-op otherwise. */
    public void release(UUID runId) {
        holder.compareAndSet(runId, null);
    }

    public Optional<UUID> activeRunId() {
        return Optional.ofNullable(holder.get());
    }

    public boolean isHeld() {
        return holder.get() != null;
    }
}
