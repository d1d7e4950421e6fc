package com.coderaptor.tree;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final AtomicReference<Snapshot> current;

    public SnapshotStore() {
        this(Snapshot.empty());
    }

    public SnapshotStore(Snapshot initial) {
        this.current = new AtomicReference<>(initial);
    }

    public Snapshot current() {
        return current.get();
    }

    /**
     * Publishes {@code next} only if {@code expected} is still current.
     *
     * @return false when another writer published in between; the store is left untouched
     */
    public boolean publish(Snapshot expected, Snapshot next) {
        boolean swapped = current.compareAndSet(expected, next);
        if (swapped) {
            log.info("snapshot.published version={} nodes={} roots={}", next.version(), next.nodeCount(),
                    next.rootIds().size());
        } else {
            log.warn("snapshot.publish.rejected expectedVersion={} currentVersion={} candidateVersion={}",
                    expected.version(), current.get().version(), next.version());
        }
        return swapped;
    }

    public void reset(Snapshot snapshot) {
        current.set(snapshot);
        log.info("snapshot.reset version={} nodes={}", snapshot.version(), snapshot.nodeCount());
    }
}
