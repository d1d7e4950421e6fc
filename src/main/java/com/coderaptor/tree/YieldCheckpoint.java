package com.coderaptor.tree;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class YieldCheckpoint {
    private static final int RUNNING = 0;
    private static final int CANCELLED = 1;
    private static final int COMMITTED = 2;

    private final int yieldEvery;
    private final AtomicLong units = new AtomicLong();
    private final AtomicLong yields = new AtomicLong();
    private final AtomicInteger state = new AtomicInteger(RUNNING);

    public YieldCheckpoint(int yieldEvery) {
        if (yieldEvery < 1) {
            throw new IllegalArgumentException("yieldEvery must be >= 1");
        }
        this.yieldEvery = yieldEvery;
    }

    public static YieldCheckpoint unbounded() {
        return new YieldCheckpoint(Integer.MAX_VALUE);
    }

    public void tick() {
        throwIfCancelled();
        if (units.incrementAndGet() % yieldEvery == 0) {
            yieldNow();
        }
    }

    public void levelCompleted() {
        throwIfCancelled();
        yieldNow();
    }

    public boolean cancel() {
        return state.compareAndSet(RUNNING, CANCELLED) || state.get() == CANCELLED;
    }

    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }

    public boolean isCommitted() {
        return state.get() == COMMITTED;
    }

    public void throwIfCancelled() {
        if (state.get() == CANCELLED) {
            throw new IndexingCancelledException("indexing cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            state.compareAndSet(RUNNING, CANCELLED);
            if (state.get() == CANCELLED) {
                throw new IndexingCancelledException("indexing thread interrupted");
            }
        }
    }

    /**
     * Claims the right to publish. Later cancels are ignored.
     *
     * @throws IndexingCancelledException when the job was cancelled first
     */
    public void commit() {
        throwIfCancelled();
        if (!state.compareAndSet(RUNNING, COMMITTED) && state.get() != COMMITTED) {
            throw new IndexingCancelledException("indexing cancelled");
        }
    }

    public long unitsCompleted() {
        return units.get();
    }

    public long yieldCount() {
        return yields.get();
    }

    private void yieldNow() {
        yields.incrementAndGet();
        Thread.yield();
    }
}
