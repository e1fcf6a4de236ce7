package io.herald4j.core;

import io.herald4j.DedupeGuard;

import java.time.Instant;

/**
 * Always grants the lock. Used when no lock service is configured; the job unique index still prevents duplicates.
 */
public final class NoopDedupeGuard implements DedupeGuard {

    public static final NoopDedupeGuard INSTANCE = new NoopDedupeGuard();

    private NoopDedupeGuard() {
    }

    @Override
    public boolean tryAcquire(String scheduleId, Instant plannedAt) {
        return true;
    }

    @Override
    public void release(String scheduleId, Instant plannedAt) {
    }
}
