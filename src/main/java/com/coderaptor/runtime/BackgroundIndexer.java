package com.coderaptor.runtime;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.tree.BuildResult;
import com.coderaptor.tree.IndexingCancelledException;
import com.coderaptor.tree.ProgressListener;
import com.coderaptor.tree.UpdateResult;
import com.coderaptor.tree.YieldCheckpoint;

public class BackgroundIndexer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundIndexer.class);

    private final IndexService service;
    private final ProgressListener listener;
    private final ExecutorService worker;
    private final AtomicReference<YieldCheckpoint> inFlight = new AtomicReference<>();

    public BackgroundIndexer(IndexService service) {
        this(service, ProgressListener.NONE);
    }

    public BackgroundIndexer(IndexService service, ProgressListener listener) {
        this.service = service;
        this.listener = listener;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "coderaptor-indexer");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            return thread;
        });
    }

    public Future<BuildResult> submitBuild(SourceBatch batch) {
        return submit("build", checkpoint -> service.build(batch, checkpoint, listener));
    }

    public Future<UpdateResult> submitUpdate(SourceBatch batch) {
        return submit("update", checkpoint -> service.update(service.current(), batch, checkpoint, listener));
    }

    public void cancelInFlight() {
        YieldCheckpoint checkpoint = inFlight.get();
        if (checkpoint != null) {
            checkpoint.cancel();
        }
    }

    private <T> Future<T> submit(String kind, Function<YieldCheckpoint, T> job) {
        YieldCheckpoint checkpoint = new YieldCheckpoint(service.config().yieldEvery());
        YieldCheckpoint previous = inFlight.getAndSet(checkpoint);
        if (previous != null) {
            previous.cancel();
            log.info("indexer.superseded kind={}", kind);
        }
        return worker.submit(() -> {
            try {
                checkpoint.throwIfCancelled();
                T result = job.apply(checkpoint);
                log.info("indexer.completed kind={} version={}", kind, service.current().version());
                return result;
            } catch (IndexingCancelledException e) {
                log.info("indexer.cancelled kind={} reason={}", kind, e.getMessage());
                throw e;
            } finally {
                inFlight.compareAndSet(checkpoint, null);
            }
        });
    }

    @Override
    public void close() {
        cancelInFlight();
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("indexer.close.timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
