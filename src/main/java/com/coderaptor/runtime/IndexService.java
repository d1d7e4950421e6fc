package com.coderaptor.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.EmbeddingCache;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.ingest.EmbeddingService;
import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.persist.CorruptIndexException;
import com.coderaptor.persist.SnapshotPersistence;
import com.coderaptor.retrieval.ContextRetrieval;
import com.coderaptor.retrieval.RetrievalResult;
import com.coderaptor.retrieval.TreeRetriever;
import com.coderaptor.summarize.RetryingSummarizer;
import com.coderaptor.summarize.Summarizer;
import com.coderaptor.tree.BuildResult;
import com.coderaptor.tree.BuildStats;
import com.coderaptor.tree.IncrementalUpdater;
import com.coderaptor.tree.ProgressListener;
import com.coderaptor.tree.Snapshot;
import com.coderaptor.tree.SnapshotStore;
import com.coderaptor.tree.ThresholdClusterer;
import com.coderaptor.tree.TreeBuilder;
import com.coderaptor.tree.UpdateResult;
import com.coderaptor.tree.UpdateStats;
import com.coderaptor.tree.YieldCheckpoint;

public class IndexService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IndexService.class);

    private final IndexConfig config;
    private final AppConfig.RetrievalSettings retrievalSettings;
    private final EmbeddingCache cache;
    private final ExecutorService embeddingPool;
    private final TreeBuilder builder;
    private final IncrementalUpdater updater;
    private final TreeRetriever retriever;
    private final SnapshotStore store = new SnapshotStore();
    private final SnapshotPersistence persistence = new SnapshotPersistence();

    public IndexService(IndexConfig config, EmbeddingService embeddingService, Summarizer summarizer) {
        this(config, new AppConfig.RetrievalSettings(), embeddingService, summarizer);
    }

    public IndexService(IndexConfig config,
            AppConfig.RetrievalSettings retrievalSettings,
            EmbeddingService embeddingService,
            Summarizer summarizer) {
        this.config = config;
        this.retrievalSettings = retrievalSettings;
        this.cache = new EmbeddingCache(embeddingService, config.embeddingCacheCapacity(), config.embeddingRetryPolicy());
        this.embeddingPool = Executors.newFixedThreadPool(config.embeddingWorkers(), workerThreads());
        RetryingSummarizer retryingSummarizer = new RetryingSummarizer(summarizer, config.summarizerRetryPolicy(),
                config.summaryInputMaxChars(), config.summaryMaxChars());
        this.builder = new TreeBuilder(config, cache, retryingSummarizer, new ThresholdClusterer(), embeddingPool);
        this.updater = new IncrementalUpdater(builder);
        this.retriever = new TreeRetriever(cache);
    }

    public Snapshot current() {
        return store.current();
    }

    public IndexConfig config() {
        return config;
    }

    public EmbeddingCache embeddingCache() {
        return cache;
    }

    public BuildResult build(SourceBatch batch) {
        return build(batch, new YieldCheckpoint(config.yieldEvery()), ProgressListener.NONE);
    }

    public BuildResult build(SourceBatch batch, YieldCheckpoint checkpoint, ProgressListener listener) {
        Snapshot base = store.current();
        BuildResult result = builder.build(batch, base, checkpoint, listener);
        checkpoint.commit();
        if (store.publish(base, result.snapshot())) {
            return result;
        }
        BuildStats stats = result.stats();
        return new BuildResult(result.snapshot(), new BuildStats(stats.nodeCount(), stats.depth(), stats.duration(),
                withStaleWarning(stats.warnings(), base)));
    }

    public UpdateResult update(SourceBatch batch) {
        return update(store.current(), batch, new YieldCheckpoint(config.yieldEvery()), ProgressListener.NONE);
    }

    public UpdateResult update(Snapshot base, SourceBatch batch) {
        return update(base, batch, new YieldCheckpoint(config.yieldEvery()), ProgressListener.NONE);
    }

    public UpdateResult update(Snapshot base, SourceBatch batch, YieldCheckpoint checkpoint, ProgressListener listener) {
        UpdateResult result = updater.update(base, batch, checkpoint, listener);
        checkpoint.commit();
        if (result.snapshot() == base || store.publish(base, result.snapshot())) {
            return result;
        }
        UpdateStats stats = result.stats();
        return new UpdateResult(result.snapshot(), new UpdateStats(stats.filesAdded(), stats.filesModified(),
                stats.filesDeleted(), stats.filesTouched(), stats.nodesRebuilt(), stats.duration(),
                withStaleWarning(stats.warnings(), base), stats.fullRebuild()));
    }

    public List<RetrievalResult> query(String queryText, int topK, Set<Integer> levels) throws EmbeddingException {
        return retriever.query(store.current(), queryText, topK, levels);
    }

    public List<RetrievalResult> query(Snapshot snapshot, String queryText, int topK, Set<Integer> levels)
            throws EmbeddingException {
        return retriever.query(snapshot, queryText, topK, levels);
    }

    public ContextRetrieval queryWithContext(String queryText, int topK) throws EmbeddingException {
        return retriever.retrieveWithContext(store.current(), queryText, topK, retrievalSettings.getExpandK(),
                retrievalSettings.getChunkThreshold());
    }

    public OpenResult open(Path indexPath, Supplier<SourceBatch> corpus) {
        List<IndexWarning> warnings = new ArrayList<>();
        try {
            Optional<Snapshot> loaded = persistence.load(indexPath, cache.embeddingVersion());
            if (loaded.isPresent()) {
                store.reset(loaded.get());
                return new OpenResult(loaded.get(), true, warnings);
            }
            log.info("index.open.missing path={}", indexPath);
        } catch (CorruptIndexException | IOException e) {
            log.warn("index.open.corrupt path={} reason={}", indexPath, e.getMessage());
            warnings.add(IndexWarning.of(WarningKind.CORRUPT_INDEX, indexPath.toString(), e.getMessage()));
        }
        BuildResult built = build(corpus.get());
        warnings.addAll(built.stats().warnings());
        return new OpenResult(built.snapshot(), false, warnings);
    }

    public void save(Path indexPath) throws IOException {
        persistence.save(indexPath, store.current(), cache.embeddingVersion());
    }

    public boolean clear(Path indexPath) throws IOException {
        boolean deleted = Files.deleteIfExists(indexPath);
        Snapshot previous = store.current();
        store.reset(Snapshot.empty());
        log.info("index.cleared path={} deletedFile={} previousVersion={}", indexPath, deleted, previous.version());
        return deleted;
    }

    @Override
    public void close() {
        embeddingPool.shutdownNow();
        try {
            if (!embeddingPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("index.close.timeout pool=embedding");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<IndexWarning> withStaleWarning(List<IndexWarning> warnings, Snapshot base) {
        List<IndexWarning> combined = new ArrayList<>(warnings);
        combined.add(IndexWarning.of(WarningKind.STALE_BASE, "snapshot " + base.version(),
                "a newer snapshot was published meanwhile, result not published"));
        return combined;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "coderaptor-embed-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
